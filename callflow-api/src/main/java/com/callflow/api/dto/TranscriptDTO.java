package com.callflow.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 通话记录 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TranscriptDTO {

    private String transcriptId;
    private String customerId;
    private String advisorId;
    private String topic;
    private String content;
    private LocalDateTime createdAt;
}
