package com.callflow.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 工作流详情 DTO，层级查询时携带步骤列表。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowDetailDTO {

    private String workflowId;
    private String planId;
    private String analysisId;
    private String transcriptId;
    private String runId;
    private String workflowType;
    private String riskLevel;
    private Boolean riskDefaulted;
    private String actionItem;
    private String priority;
    private String status;
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
    private Integer version;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private List<ExecutionStepDTO> executionSteps;
}
