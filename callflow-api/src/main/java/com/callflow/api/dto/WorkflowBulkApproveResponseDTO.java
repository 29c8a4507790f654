package com.callflow.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 批量审批结果 DTO，failures 为工作流 ID → 失败原因。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowBulkApproveResponseDTO {

    private Integer approvedCount;
    private Integer failedCount;
    private Integer totalRequested;
    private String approvedBy;
    private List<String> approvedIds;
    private Map<String, String> failures;
}
