package com.callflow.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 行动计划摘要 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlanSummaryDTO {

    private String planId;
    private String analysisId;
    private String transcriptId;
    private String runId;
    private String riskLevel;
    private String approvalRoute;
    private Boolean autoExecutable;
    private String queueStatus;
    private String approvedBy;
    private LocalDateTime approvedAt;
}
