package com.callflow.domain.run.model.valobj;

import com.callflow.types.enums.PipelineStageEnum;
import com.callflow.types.enums.RunStatusEnum;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 运行状态的不可变快照，读取方可在任意线程安全持有。
 */
@Value
@Builder
public class RunSnapshot {

    String runId;

    RunStatusEnum status;

    PipelineStageEnum stage;

    boolean autoApprove;

    boolean cancelRequested;

    ImmutableList<String> transcriptIds;

    /**
     * 每条通话记录当前到达的阶段
     */
    ImmutableMap<String, PipelineStageEnum> progress;

    ImmutableList<TranscriptResult> results;

    ImmutableList<TranscriptError> errors;

    RunSummary summary;

    LocalDateTime createdAt;

    LocalDateTime updatedAt;

    LocalDateTime completedAt;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
