package com.callflow.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * 运行创建请求 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunCreateRequestDTO {

    private List<String> transcriptIds;
    private Boolean autoApprove;
    private Long stageTimeoutMs;
    private Long actuatorTimeoutMs;
}
