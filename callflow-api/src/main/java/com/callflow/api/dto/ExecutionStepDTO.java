package com.callflow.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 执行步骤 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecutionStepDTO {

    private String workflowId;
    private Integer stepNumber;
    private String action;
    private String details;
    private String toolNeeded;
    private String validationCriteria;
    private String status;
    private Map<String, Object> result;
    private String errorMessage;
    private Integer attemptCount;
    private LocalDateTime startedAt;
    private LocalDateTime executedAt;
}
