package com.callflow.domain.run.model.entity;

import com.callflow.domain.run.model.valobj.RunSnapshot;
import com.callflow.domain.run.model.valobj.RunSummary;
import com.callflow.domain.run.model.valobj.TranscriptError;
import com.callflow.domain.run.model.valobj.TranscriptResult;
import com.callflow.types.enums.PipelineStageEnum;
import com.callflow.types.enums.RunStatusEnum;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 流水线运行聚合根。
 * 同一运行的各通话记录任务并发写入结果与错误，所有写操作在实体上同步；
 * 进入终态后不再接受任何修改，快照实例被缓存。
 *
 * @author callflow
 * @since 2026-10-01
 */
public class PipelineRunEntity {

    private final String id;

    private final ImmutableList<String> transcriptIds;

    private final boolean autoApprove;

    /**
     * 阶段调用超时（毫秒）
     */
    private final long stageTimeoutMs;

    /**
     * 执行器调用超时（毫秒）
     */
    private final long actuatorTimeoutMs;

    private final LocalDateTime createdAt;

    private RunStatusEnum status;

    private PipelineStageEnum stage;

    private boolean cancelRequested;

    private final Map<String, PipelineStageEnum> progress = new LinkedHashMap<>();

    private final Map<String, TranscriptResult> results = new LinkedHashMap<>();

    private final List<TranscriptError> errors = new ArrayList<>();

    private int successful;

    private int failed;

    private LocalDateTime updatedAt;

    private LocalDateTime completedAt;

    private RunSnapshot terminalSnapshot;

    public PipelineRunEntity(String id,
                             List<String> transcriptIds,
                             boolean autoApprove,
                             long stageTimeoutMs,
                             long actuatorTimeoutMs) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Run ID cannot be empty");
        }
        if (transcriptIds == null || transcriptIds.isEmpty()) {
            throw new IllegalArgumentException("Run must cover at least one transcript");
        }
        this.id = id;
        this.transcriptIds = ImmutableList.copyOf(transcriptIds);
        this.autoApprove = autoApprove;
        this.stageTimeoutMs = stageTimeoutMs;
        this.actuatorTimeoutMs = actuatorTimeoutMs;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
        this.status = RunStatusEnum.STARTED;
        this.stage = PipelineStageEnum.PENDING;
        for (String transcriptId : this.transcriptIds) {
            progress.put(transcriptId, PipelineStageEnum.PENDING);
        }
    }

    public String getId() {
        return id;
    }

    public List<String> getTranscriptIds() {
        return transcriptIds;
    }

    public boolean isAutoApprove() {
        return autoApprove;
    }

    public long getStageTimeoutMs() {
        return stageTimeoutMs;
    }

    public long getActuatorTimeoutMs() {
        return actuatorTimeoutMs;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public synchronized RunStatusEnum getStatus() {
        return status;
    }

    public synchronized PipelineStageEnum getStage() {
        return stage;
    }

    public synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * 开始处理
     */
    public synchronized void start() {
        if (this.status != RunStatusEnum.STARTED) {
            throw new IllegalStateException("Run must be in STARTED status to start processing, current: " + this.status);
        }
        this.status = RunStatusEnum.RUNNING;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 请求取消，已在途的阶段调用结束后生效
     */
    public synchronized void requestCancel() {
        if (this.status.isTerminal()) {
            throw new IllegalStateException("Cannot cancel a terminal run, current: " + this.status);
        }
        this.cancelRequested = true;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 记录某条通话记录到达的阶段，阶段只前进不后退
     */
    public synchronized void advance(String transcriptId, PipelineStageEnum reached) {
        ensureWritable();
        if (results.containsKey(transcriptId)) {
            return;
        }
        PipelineStageEnum current = progress.get(transcriptId);
        if (current == null) {
            throw new IllegalArgumentException("Transcript is not part of run " + id + ": " + transcriptId);
        }
        if (reached != null && reached.isAfter(current)) {
            progress.put(transcriptId, reached);
            this.updatedAt = LocalDateTime.now();
            recomputeStage();
        }
    }

    /**
     * 记录通话记录处理成功
     */
    public synchronized void recordSuccess(TranscriptResult result) {
        recordResult(result, null);
    }

    /**
     * 记录通话记录处理失败，error 为空时仅计数
     */
    public synchronized void recordFailure(TranscriptResult result, TranscriptError error) {
        recordResult(result, error);
    }

    /**
     * 无任何可处理的通话记录，运行直接失败
     */
    public synchronized void failToStart(List<TranscriptError> startErrors) {
        if (this.status != RunStatusEnum.STARTED) {
            throw new IllegalStateException("Only a run that has not started can fail to start, current: " + this.status);
        }
        if (startErrors != null) {
            for (TranscriptError error : startErrors) {
                errors.add(error);
                if (!results.containsKey(error.getTranscriptId()) && progress.containsKey(error.getTranscriptId())) {
                    results.put(error.getTranscriptId(),
                            TranscriptResult.failure(error.getTranscriptId(), PipelineStageEnum.PENDING, error.getError()));
                    failed++;
                }
            }
        }
        for (String transcriptId : transcriptIds) {
            if (!results.containsKey(transcriptId)) {
                results.put(transcriptId,
                        TranscriptResult.failure(transcriptId, PipelineStageEnum.PENDING, "Run failed to start"));
                failed++;
            }
        }
        this.status = RunStatusEnum.FAILED;
        this.completedAt = LocalDateTime.now();
        this.updatedAt = this.completedAt;
    }

    /**
     * 生成当前快照；终态后始终返回同一实例
     */
    public synchronized RunSnapshot snapshot() {
        if (terminalSnapshot != null) {
            return terminalSnapshot;
        }
        boolean terminal = status.isTerminal();
        RunSnapshot snapshot = RunSnapshot.builder()
                .runId(id)
                .status(status)
                .stage(stage)
                .autoApprove(autoApprove)
                .cancelRequested(cancelRequested)
                .transcriptIds(transcriptIds)
                .progress(ImmutableMap.copyOf(progress))
                .results(ImmutableList.copyOf(results.values()))
                .errors(ImmutableList.copyOf(errors))
                .summary(RunSummary.of(transcriptIds.size(), successful, failed, terminal))
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .completedAt(completedAt)
                .build();
        if (terminal) {
            terminalSnapshot = snapshot;
        }
        return snapshot;
    }

    private void recordResult(TranscriptResult result, TranscriptError error) {
        ensureWritable();
        if (result == null || result.getTranscriptId() == null) {
            throw new IllegalArgumentException("Transcript result must carry a transcript ID");
        }
        String transcriptId = result.getTranscriptId();
        if (!progress.containsKey(transcriptId)) {
            throw new IllegalArgumentException("Transcript is not part of run " + id + ": " + transcriptId);
        }
        if (results.containsKey(transcriptId)) {
            throw new IllegalStateException("Transcript already finished in run " + id + ": " + transcriptId);
        }
        results.put(transcriptId, result);
        if (error != null) {
            errors.add(error);
        }
        if (result.isSuccess() && error == null) {
            successful++;
        } else {
            failed++;
        }
        if (result.getStage() != null && result.getStage().isAfter(progress.get(transcriptId))) {
            progress.put(transcriptId, result.getStage());
        }
        this.updatedAt = LocalDateTime.now();
        recomputeStage();
        if (results.size() == transcriptIds.size()) {
            this.status = RunStatusEnum.COMPLETED;
            this.stage = PipelineStageEnum.COMPLETE;
            this.completedAt = this.updatedAt;
        }
    }

    private void recomputeStage() {
        PipelineStageEnum common = null;
        for (Map.Entry<String, PipelineStageEnum> entry : progress.entrySet()) {
            TranscriptResult result = results.get(entry.getKey());
            if (result != null && !result.isSuccess()) {
                continue;
            }
            common = PipelineStageEnum.earliest(common, entry.getValue());
        }
        if (common != null && common.isAfter(stage)) {
            this.stage = common;
        }
    }

    private void ensureWritable() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Run " + id + " is terminal and can no longer change");
        }
    }
}
