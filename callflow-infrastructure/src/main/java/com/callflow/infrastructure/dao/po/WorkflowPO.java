package com.callflow.infrastructure.dao.po;

import com.callflow.types.enums.RiskLevelEnum;
import com.callflow.types.enums.WorkflowStatusEnum;
import com.callflow.types.enums.WorkflowTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 工作流 PO
 *
 * @author callflow
 * @since 2026-10-01
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowPO {

    private String id;

    private String planId;

    private String analysisId;

    private String transcriptId;

    private String runId;

    private WorkflowTypeEnum workflowType;

    private RiskLevelEnum riskLevel;

    private Boolean riskDefaulted;

    private String actionItem;

    private String priority;

    /**
     * 步骤定义 (JSON)
     */
    private String stepDefinitions;

    private WorkflowStatusEnum status;

    private Boolean requiresHumanApproval;

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

    private LocalDateTime executedAt;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
