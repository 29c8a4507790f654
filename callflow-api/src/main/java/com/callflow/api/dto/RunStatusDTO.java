package com.callflow.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 运行状态快照 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunStatusDTO {

    private String runId;
    private String status;
    private String stage;
    private Boolean autoApprove;
    private Boolean cancelRequested;
    private List<String> transcriptIds;
    private Map<String, String> progress;
    private List<TranscriptResultDTO> results;
    private List<RunErrorDTO> errors;
    private RunSummaryDTO summary;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;
}
