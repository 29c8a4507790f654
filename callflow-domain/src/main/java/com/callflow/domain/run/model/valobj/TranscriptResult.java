package com.callflow.domain.run.model.valobj;

import com.callflow.types.enums.PipelineStageEnum;
import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 单条通话记录在一次运行中的处理结果。
 */
@Value
@Builder(toBuilder = true)
public class TranscriptResult {

    String transcriptId;

    boolean success;

    /**
     * 该通话记录到达的最后阶段
     */
    PipelineStageEnum stage;

    String analysisId;

    String planId;

    int workflowCount;

    int autoApprovedCount;

    int awaitingApprovalCount;

    int executedCount;

    int failedCount;

    @Builder.Default
    List<String> workflowIds = ImmutableList.of();

    String error;

    LocalDateTime finishedAt;

    public static TranscriptResult failure(String transcriptId, PipelineStageEnum stage, String error) {
        return TranscriptResult.builder()
                .transcriptId(transcriptId)
                .success(false)
                .stage(stage)
                .error(error)
                .finishedAt(LocalDateTime.now())
                .build();
    }
}
