package com.callflow.infrastructure.dao.po;

import com.callflow.types.enums.RiskLevelEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 行动计划 PO
 *
 * @author callflow
 * @since 2026-10-01
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ActionPlanPO {

    private String id;

    private String analysisId;

    private String transcriptId;

    private String runId;

    /**
     * 借款人子计划 (JSON)
     */
    private String borrowerPlan;

    /**
     * 顾问子计划 (JSON)
     */
    private String advisorPlan;

    /**
     * 主管子计划 (JSON)
     */
    private String supervisorPlan;

    /**
     * 管理层子计划 (JSON)
     */
    private String leadershipPlan;

    private RiskLevelEnum riskLevel;

    private String approvalRoute;

    private Boolean autoExecutable;

    private String queueStatus;

    private String approvedBy;

    private LocalDateTime approvedAt;

    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
