package com.callflow.domain.run.model.valobj;

import com.callflow.types.enums.ResponseCode;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 运行中单条通话记录的错误记录。
 */
@Value
@Builder
public class TranscriptError {

    String transcriptId;

    String error;

    /**
     * 错误码，取自 {@link ResponseCode}
     */
    String errorCode;

    /**
     * 出错阶段，如 ANALYSIS / PLAN / WORKFLOWS / EXECUTION / RESOLVE
     */
    String stage;

    LocalDateTime timestamp;

    public static TranscriptError of(String transcriptId, String stage, ResponseCode code, String error) {
        return of(transcriptId, stage, code == null ? null : code.getCode(), error);
    }

    public static TranscriptError of(String transcriptId, String stage, String errorCode, String error) {
        return TranscriptError.builder()
                .transcriptId(transcriptId)
                .stage(stage)
                .errorCode(errorCode == null ? ResponseCode.UN_ERROR.getCode() : errorCode)
                .error(error)
                .timestamp(LocalDateTime.now())
                .build();
    }
}
