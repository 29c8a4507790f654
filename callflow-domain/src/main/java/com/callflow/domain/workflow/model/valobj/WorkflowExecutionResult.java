package com.callflow.domain.workflow.model.valobj;

import com.callflow.types.enums.WorkflowStatusEnum;

/**
 * 整体执行工作流的结果。
 *
 * @param workflowId    工作流 ID
 * @param status        执行后的工作流状态
 * @param totalSteps    步骤总数
 * @param executedSteps 已执行步骤数
 * @param failedStep    首个出错步骤序号，无则为 null
 * @param error         错误信息
 */
public record WorkflowExecutionResult(String workflowId,
                                      WorkflowStatusEnum status,
                                      int totalSteps,
                                      int executedSteps,
                                      Integer failedStep,
                                      String error) {

    public boolean executed() {
        return status == WorkflowStatusEnum.EXECUTED;
    }
}
