package com.callflow.domain.workflow.model.entity;

import com.callflow.domain.workflow.model.valobj.RoutingDecision;
import com.callflow.domain.workflow.model.valobj.StepDefinition;
import com.callflow.types.enums.RiskLevelEnum;
import com.callflow.types.enums.WorkflowStatusEnum;
import com.callflow.types.enums.WorkflowTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 工作流领域实体。
 * 从行动计划中抽取出的单个可执行行动项，需经过风险路由、审批与执行。
 *
 * @author callflow
 * @since 2026-10-01
 */
@Data
public class WorkflowEntity {

    /**
     * 主键 ID
     */
    private String id;

    /**
     * 行动计划 ID
     */
    private String planId;

    /**
     * 分析结果 ID
     */
    private String analysisId;

    /**
     * 通话记录 ID
     */
    private String transcriptId;

    /**
     * 运行 ID
     */
    private String runId;

    /**
     * 工作流所属角色
     */
    private WorkflowTypeEnum workflowType;

    /**
     * 风险等级，抽取时未给出则为 null，路由后填充
     */
    private RiskLevelEnum riskLevel;

    /**
     * 风险等级是否为缺省补齐
     */
    private boolean riskDefaulted;

    /**
     * 行动项描述
     */
    private String actionItem;

    /**
     * 优先级
     */
    private String priority;

    /**
     * 步骤定义
     */
    private List<StepDefinition> stepDefinitions = new ArrayList<>();

    /**
     * 状态
     */
    private WorkflowStatusEnum status;

    /**
     * 是否需要人工审批
     */
    private boolean requiresHumanApproval;

    /**
     * 路由原因
     */
    private String routingReason;

    private String approvedBy;

    private LocalDateTime approvedAt;

    private String approvalReasoning;

    private String rejectedBy;

    private LocalDateTime rejectedAt;

    private String rejectionReason;

    private String failedBy;

    private LocalDateTime failedAt;

    private String failureReason;

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
     * 验证工作流是否有效
     */
    public void validate() {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalStateException("Workflow ID cannot be empty");
        }
        if (planId == null || planId.trim().isEmpty()) {
            throw new IllegalStateException("Workflow plan ID cannot be empty");
        }
        if (workflowType == null) {
            throw new IllegalStateException("Workflow type cannot be null");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
    }

    /**
     * 应用路由决策
     */
    public void applyRouting(RoutingDecision decision) {
        if (this.status != WorkflowStatusEnum.PENDING_ASSESSMENT) {
            throw new IllegalStateException("Workflow must be in PENDING_ASSESSMENT status to be routed, current: " + this.status);
        }
        this.status = decision.getStatus();
        this.riskLevel = decision.getEffectiveRiskLevel();
        this.riskDefaulted = decision.isRiskDefaulted();
        this.requiresHumanApproval = decision.isRequiresHumanApproval();
        this.routingReason = decision.getReason();
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 人工审批通过
     */
    public void approve(String approver, String reasoning) {
        if (this.status != WorkflowStatusEnum.AWAITING_APPROVAL) {
            throw new IllegalStateException("Only workflows awaiting approval can be approved, current: " + this.status);
        }
        this.status = WorkflowStatusEnum.APPROVED;
        this.approvedBy = approver;
        this.approvalReasoning = reasoning;
        this.approvedAt = LocalDateTime.now();
        this.updatedAt = this.approvedAt;
    }

    /**
     * 人工驳回
     */
    public void reject(String rejector, String reason) {
        if (this.status != WorkflowStatusEnum.AWAITING_APPROVAL) {
            throw new IllegalStateException("Only workflows awaiting approval can be rejected, current: " + this.status);
        }
        this.status = WorkflowStatusEnum.REJECTED;
        this.rejectedBy = rejector;
        this.rejectionReason = reason;
        this.rejectedAt = LocalDateTime.now();
        this.updatedAt = this.rejectedAt;
    }

    /**
     * 所有步骤执行完成
     */
    public void markExecuted() {
        if (this.status == null || !this.status.isExecutable()) {
            throw new IllegalStateException("Only approved workflows can be marked executed, current: " + this.status);
        }
        this.status = WorkflowStatusEnum.EXECUTED;
        this.executedAt = LocalDateTime.now();
        this.updatedAt = this.executedAt;
    }

    /**
     * 标记为失败
     */
    public void markFailed(String actor, String reason) {
        if (this.status == null || !this.status.isExecutable()) {
            throw new IllegalStateException("Only approved workflows can be marked failed, current: " + this.status);
        }
        this.status = WorkflowStatusEnum.FAILED;
        this.failedBy = actor;
        this.failureReason = reason;
        this.failedAt = LocalDateTime.now();
        this.updatedAt = this.failedAt;
    }

    /**
     * 浅拷贝当前状态，步骤定义列表单独复制。
     */
    public WorkflowEntity copy() {
        WorkflowEntity copy = new WorkflowEntity();
        copy.setId(id);
        copy.setPlanId(planId);
        copy.setAnalysisId(analysisId);
        copy.setTranscriptId(transcriptId);
        copy.setRunId(runId);
        copy.setWorkflowType(workflowType);
        copy.setRiskLevel(riskLevel);
        copy.setRiskDefaulted(riskDefaulted);
        copy.setActionItem(actionItem);
        copy.setPriority(priority);
        copy.setStepDefinitions(stepDefinitions == null ? new ArrayList<>() : new ArrayList<>(stepDefinitions));
        copy.setStatus(status);
        copy.setRequiresHumanApproval(requiresHumanApproval);
        copy.setRoutingReason(routingReason);
        copy.setApprovedBy(approvedBy);
        copy.setApprovedAt(approvedAt);
        copy.setApprovalReasoning(approvalReasoning);
        copy.setRejectedBy(rejectedBy);
        copy.setRejectedAt(rejectedAt);
        copy.setRejectionReason(rejectionReason);
        copy.setFailedBy(failedBy);
        copy.setFailedAt(failedAt);
        copy.setFailureReason(failureReason);
        copy.setExecutedAt(executedAt);
        copy.setVersion(version);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}
