package com.callflow.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.Map;

/**
 * 审批与执行统计 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecutionStatisticsDTO {

    private Integer totalWorkflows;

    /**
     * 状态编码 → 工作流数量，包含数量为 0 的状态
     */
    private Map<String, Integer> workflowsByStatus;

    /**
     * 风险等级编码 → 工作流数量，风险缺失记为 unknown
     */
    private Map<String, Integer> workflowsByRiskLevel;

    private Integer totalSteps;

    /**
     * 状态编码 → 步骤数量，包含数量为 0 的状态
     */
    private Map<String, Integer> stepsByStatus;

    private Integer pendingApprovals;
    private Integer humanApproved;
    private Integer humanRejected;

    /**
     * 人工审批通过率 approved / (approved + rejected)，保留三位小数；无人工决策时为 0
     */
    private Double approvalRate;

    /**
     * 从工作流创建到人工审批的平均分钟数，保留两位小数；无人工审批时为 null
     */
    private Double avgApprovalMinutes;
}
