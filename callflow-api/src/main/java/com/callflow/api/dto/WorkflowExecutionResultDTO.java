package com.callflow.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 工作流整体执行结果 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowExecutionResultDTO {

    private String workflowId;
    private String status;
    private Integer totalSteps;
    private Integer executedSteps;
    private Integer failedStep;
    private String error;
}
