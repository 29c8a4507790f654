package com.callflow.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 单条通话记录处理结果 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TranscriptResultDTO {

    private String transcriptId;
    private Boolean success;
    private String stage;
    private String analysisId;
    private String planId;
    private Integer workflowCount;
    private Integer autoApprovedCount;
    private Integer awaitingApprovalCount;
    private Integer executedCount;
    private Integer failedCount;
    private List<String> workflowIds;
    private String error;
    private LocalDateTime finishedAt;
}
