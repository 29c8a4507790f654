package com.callflow.domain.workflow.model.entity;

import com.callflow.types.enums.StepStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * 执行步骤领域实体。
 * 工作流执行中的单个有序子动作，步骤序号在工作流内唯一且不可变。
 *
 * @author callflow
 * @since 2026-10-01
 */
@Data
public class ExecutionStepEntity {

    /**
     * 工作流 ID
     */
    private String workflowId;

    /**
     * 步骤序号，从 1 开始
     */
    private Integer stepNumber;

    /**
     * 动作描述
     */
    private String action;

    /**
     * 执行细节
     */
    private String details;

    /**
     * 所需工具类型
     */
    private String toolNeeded;

    /**
     * 验证标准
     */
    private String validationCriteria;

    /**
     * 状态
     */
    private StepStatusEnum status;

    /**
     * 执行结果
     */
    private Map<String, Object> result;

    /**
     * 错误信息
     */
    private String errorMessage;

    /**
     * 已尝试次数
     */
    private Integer attemptCount;

    /**
     * 最近一次开始时间
     */
    private LocalDateTime startedAt;

    /**
     * 执行完成时间
     */
    private LocalDateTime executedAt;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    /**
     * 开始执行（首次或错误后重试）
     */
    public void start() {
        if (this.status != StepStatusEnum.PENDING && this.status != StepStatusEnum.ERROR) {
            throw new IllegalStateException("Step must be PENDING or ERROR to start, current: " + this.status);
        }
        this.status = StepStatusEnum.IN_PROGRESS;
        this.attemptCount = (this.attemptCount == null ? 0 : this.attemptCount) + 1;
        this.errorMessage = null;
        this.startedAt = LocalDateTime.now();
        this.updatedAt = this.startedAt;
    }

    /**
     * 执行成功
     */
    public void complete(Map<String, Object> result) {
        if (this.status != StepStatusEnum.IN_PROGRESS) {
            throw new IllegalStateException("Only in-progress steps can be completed, current: " + this.status);
        }
        this.status = StepStatusEnum.EXECUTED;
        this.result = result == null ? new HashMap<>() : new HashMap<>(result);
        this.executedAt = LocalDateTime.now();
        this.updatedAt = this.executedAt;
    }

    /**
     * 执行失败
     */
    public void fail(String errorMessage) {
        if (this.status != StepStatusEnum.IN_PROGRESS) {
            throw new IllegalStateException("Only in-progress steps can fail, current: " + this.status);
        }
        this.status = StepStatusEnum.ERROR;
        this.errorMessage = errorMessage;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isExecuted() {
        return this.status == StepStatusEnum.EXECUTED;
    }

    public ExecutionStepEntity copy() {
        ExecutionStepEntity copy = new ExecutionStepEntity();
        copy.setWorkflowId(workflowId);
        copy.setStepNumber(stepNumber);
        copy.setAction(action);
        copy.setDetails(details);
        copy.setToolNeeded(toolNeeded);
        copy.setValidationCriteria(validationCriteria);
        copy.setStatus(status);
        copy.setResult(result == null ? null : new HashMap<>(result));
        copy.setErrorMessage(errorMessage);
        copy.setAttemptCount(attemptCount);
        copy.setStartedAt(startedAt);
        copy.setExecutedAt(executedAt);
        copy.setVersion(version);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}
