package com.callflow.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 通话记录创建请求 DTO，未给出 ID 时由服务端生成。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TranscriptCreateRequestDTO {

    private String transcriptId;
    private String customerId;
    private String advisorId;
    private String topic;
    private String content;
}
