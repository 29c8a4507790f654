package com.callflow.domain.workflow.model.valobj;

import com.callflow.types.enums.RiskLevelEnum;
import com.callflow.types.enums.WorkflowStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 审批路由决策
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingDecision {

    /**
     * 目标状态：AUTO_APPROVED 或 AWAITING_APPROVAL
     */
    private WorkflowStatusEnum status;

    private boolean requiresHumanApproval;

    /**
     * 实际使用的风险等级
     */
    private RiskLevelEnum effectiveRiskLevel;

    /**
     * 风险等级缺失时按 HIGH 处理
     */
    private boolean riskDefaulted;

    private String reason;
}
