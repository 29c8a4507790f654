package com.callflow.trigger.service;

import com.callflow.domain.analysis.model.entity.AnalysisEntity;
import com.callflow.domain.pipeline.service.PipelineStageDomainService;
import com.callflow.domain.planning.model.entity.ActionPlanEntity;
import com.callflow.domain.run.adapter.repository.IPipelineRunRepository;
import com.callflow.domain.run.model.entity.PipelineRunEntity;
import com.callflow.domain.run.model.valobj.RunSnapshot;
import com.callflow.domain.run.model.valobj.TranscriptError;
import com.callflow.domain.run.model.valobj.TranscriptResult;
import com.callflow.domain.transcript.adapter.repository.ITranscriptRepository;
import com.callflow.domain.transcript.model.entity.TranscriptEntity;
import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.domain.workflow.model.valobj.RoutingContext;
import com.callflow.domain.workflow.model.valobj.WorkflowExecutionResult;
import com.callflow.domain.workflow.service.ApprovalGateDomainService;
import com.callflow.domain.workflow.service.ExecutionTrackerDomainService;
import com.callflow.types.common.Constants;
import com.callflow.types.enums.PipelineStageEnum;
import com.callflow.types.enums.ResponseCode;
import com.callflow.types.enums.WorkflowStatusEnum;
import com.callflow.types.exception.AppException;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * 流水线编排服务：接收一批通话记录，每条记录一个任务并发推进
 * 分析 → 计划 → 工作流抽取与路由 → 自动审批工作流执行，并把结果汇总到运行聚合。
 * <p>
 * 单条记录的失败只记录到运行错误列表，不影响同批其他记录；取消信号在阶段边界检查。
 */
@Slf4j
@Service
public class PipelineOrchestratorService {

    private static final String STAGE_RESOLVE = "RESOLVE";
    private static final String STAGE_ANALYSIS = "ANALYSIS";
    private static final String STAGE_PLAN = "PLAN";
    private static final String STAGE_WORKFLOWS = "WORKFLOWS";
    private static final String STAGE_EXECUTION = "EXECUTION";

    private final ITranscriptRepository transcriptRepository;
    private final IPipelineRunRepository pipelineRunRepository;
    private final PipelineStageDomainService pipelineStageDomainService;
    private final ApprovalGateDomainService approvalGateDomainService;
    private final ExecutionTrackerDomainService executionTrackerDomainService;
    private final Executor pipelineWorker;
    private final long defaultStageTimeoutMs;
    private final long defaultActuatorTimeoutMs;
    private final int maxWorkflowsPerPlan;

    private final Map<String, CompletableFuture<RunSnapshot>> completions = new ConcurrentHashMap<>();

    public PipelineOrchestratorService(ITranscriptRepository transcriptRepository,
                                       IPipelineRunRepository pipelineRunRepository,
                                       PipelineStageDomainService pipelineStageDomainService,
                                       ApprovalGateDomainService approvalGateDomainService,
                                       ExecutionTrackerDomainService executionTrackerDomainService,
                                       @Qualifier("pipelineWorker") Executor pipelineWorker,
                                       @Value("${callflow.pipeline.stage-timeout-ms:30000}") long defaultStageTimeoutMs,
                                       @Value("${callflow.pipeline.actuator-timeout-ms:10000}") long defaultActuatorTimeoutMs,
                                       @Value("${callflow.pipeline.max-workflows-per-plan:50}") int maxWorkflowsPerPlan) {
        this.transcriptRepository = transcriptRepository;
        this.pipelineRunRepository = pipelineRunRepository;
        this.pipelineStageDomainService = pipelineStageDomainService;
        this.approvalGateDomainService = approvalGateDomainService;
        this.executionTrackerDomainService = executionTrackerDomainService;
        this.pipelineWorker = pipelineWorker;
        this.defaultStageTimeoutMs = defaultStageTimeoutMs > 0 ? defaultStageTimeoutMs : 30000L;
        this.defaultActuatorTimeoutMs = defaultActuatorTimeoutMs > 0 ? defaultActuatorTimeoutMs : 10000L;
        this.maxWorkflowsPerPlan = maxWorkflowsPerPlan > 0 ? maxWorkflowsPerPlan : 50;
    }

    /**
     * 创建运行并立即返回受理时的快照（STARTED），或在没有任何可处理记录时返回 FAILED 快照。
     */
    public RunSnapshot runPipeline(List<String> transcriptIds,
                                   boolean autoApprove,
                                   Long stageTimeoutMs,
                                   Long actuatorTimeoutMs) {
        List<String> normalizedIds = normalizeTranscriptIds(transcriptIds);
        long stageTimeout = resolveTimeout("stage_timeout_ms", stageTimeoutMs, defaultStageTimeoutMs);
        long actuatorTimeout = resolveTimeout("actuator_timeout_ms", actuatorTimeoutMs, defaultActuatorTimeoutMs);

        String runId = "RUN_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase(Locale.ROOT);
        PipelineRunEntity run = new PipelineRunEntity(runId, normalizedIds, autoApprove, stageTimeout, actuatorTimeout);
        pipelineRunRepository.save(run);
        completions.put(runId, new CompletableFuture<>());
        RunSnapshot accepted = run.snapshot();
        Metrics.counter("callflow.run.started.total").increment();
        log.info("Pipeline run accepted. runId={}, transcriptCount={}, autoApprove={}, stageTimeoutMs={}, actuatorTimeoutMs={}",
                runId, normalizedIds.size(), autoApprove, stageTimeout, actuatorTimeout);

        Map<String, TranscriptEntity> resolved = new LinkedHashMap<>();
        List<TranscriptError> unresolved = new ArrayList<>();
        for (String transcriptId : normalizedIds) {
            TranscriptEntity transcript = transcriptRepository.findById(transcriptId);
            if (transcript == null) {
                unresolved.add(TranscriptError.of(transcriptId, STAGE_RESOLVE, ResponseCode.ILLEGAL_PARAMETER,
                        "Transcript not found: " + transcriptId));
            } else {
                resolved.put(transcriptId, transcript);
            }
        }

        if (resolved.isEmpty()) {
            run.failToStart(unresolved);
            log.warn("Pipeline run failed to start, no transcript resolved. runId={}, transcriptIds={}", runId, normalizedIds);
            finishIfTerminal(run);
            return run.snapshot();
        }

        run.start();
        for (TranscriptError error : unresolved) {
            run.recordFailure(TranscriptResult.failure(error.getTranscriptId(), PipelineStageEnum.PENDING, error.getError()), error);
            countTranscriptFailure(STAGE_RESOLVE);
        }
        for (TranscriptEntity transcript : resolved.values()) {
            try {
                pipelineWorker.execute(() -> processTranscript(run, transcript));
            } catch (RejectedExecutionException ex) {
                String message = "Pipeline worker rejected transcript " + transcript.getId();
                log.warn("Pipeline transcript rejected. runId={}, transcriptId={}", runId, transcript.getId());
                run.recordFailure(TranscriptResult.failure(transcript.getId(), PipelineStageEnum.PENDING, message),
                        TranscriptError.of(transcript.getId(), STAGE_RESOLVE, ResponseCode.STAGE_FAILURE, message));
                countTranscriptFailure(STAGE_RESOLVE);
            }
        }
        finishIfTerminal(run);
        return accepted;
    }

    /**
     * 返回最新快照，不阻塞在途任务
     */
    public RunSnapshot getStatus(String runId) {
        return requireRun(runId).snapshot();
    }

    /**
     * 所有运行快照，按创建时间倒序
     */
    public List<RunSnapshot> listRuns() {
        return pipelineRunRepository.findAll().stream()
                .map(PipelineRunEntity::snapshot)
                .collect(Collectors.toList());
    }

    /**
     * 请求取消运行；在途阶段调用完成后停止，已执行的工作流不回滚
     */
    public RunSnapshot cancelRun(String runId) {
        PipelineRunEntity run = requireRun(runId);
        try {
            run.requestCancel();
        } catch (IllegalStateException ex) {
            throw AppException.invalidTransition(ex.getMessage());
        }
        log.info("Pipeline run cancel requested. runId={}", runId);
        return run.snapshot();
    }

    /**
     * 阻塞等待运行进入终态，超时后返回当时的最新快照
     */
    public RunSnapshot awaitRun(String runId, Duration timeout) {
        PipelineRunEntity run = requireRun(runId);
        CompletableFuture<RunSnapshot> completion = completions.get(runId);
        if (completion == null || run.isTerminal()) {
            return run.snapshot();
        }
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            return run.snapshot();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return run.snapshot();
        } catch (ExecutionException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Awaiting run " + runId + " failed", ex);
        }
    }

    private void processTranscript(PipelineRunEntity run, TranscriptEntity transcript) {
        String transcriptId = transcript.getId();
        MDC.put(Constants.MDC_RUN_ID, run.getId());
        MDC.put(Constants.MDC_TRANSCRIPT_ID, transcriptId);
        TranscriptResult.TranscriptResultBuilder result = TranscriptResult.builder().transcriptId(transcriptId);
        PipelineStageEnum reached = PipelineStageEnum.PENDING;
        String stage = STAGE_ANALYSIS;
        try {
            if (cancelled(run, result, reached, stage)) {
                return;
            }
            AnalysisEntity analysis = pipelineStageDomainService.analyze(transcript, run.getId(), run.getStageTimeoutMs());
            result.analysisId(analysis.getId());
            reached = advance(run, transcriptId, PipelineStageEnum.ANALYSIS_COMPLETED);

            stage = STAGE_PLAN;
            if (cancelled(run, result, reached, stage)) {
                return;
            }
            ActionPlanEntity plan = pipelineStageDomainService.plan(analysis, run.getStageTimeoutMs());
            result.planId(plan.getId());
            reached = advance(run, transcriptId, PipelineStageEnum.PLAN_COMPLETED);

            stage = STAGE_WORKFLOWS;
            if (cancelled(run, result, reached, stage)) {
                return;
            }
            List<WorkflowEntity> extracted = pipelineStageDomainService.extractWorkflows(plan,
                    run.getStageTimeoutMs(), maxWorkflowsPerPlan);
            RoutingContext routingContext = new RoutingContext(run.isAutoApprove(), plan.getAutoExecutable());
            List<WorkflowEntity> routed = new ArrayList<>(extracted.size());
            for (WorkflowEntity workflow : extracted) {
                routed.add(approvalGateDomainService.applyRouting(workflow.getId(), routingContext));
            }
            result.workflowCount(routed.size())
                    .workflowIds(routed.stream().map(WorkflowEntity::getId).collect(Collectors.toList()));
            reached = advance(run, transcriptId, PipelineStageEnum.WORKFLOWS_COMPLETED);

            stage = STAGE_EXECUTION;
            if (cancelled(run, result, reached, stage)) {
                return;
            }
            executeAutoApproved(run, result, reached, routed);
        } catch (AppException ex) {
            recordStageFailure(run, result, reached, stage, ex.getCode(), ex.getInfo());
        } catch (RuntimeException ex) {
            log.error("Pipeline transcript crashed. runId={}, transcriptId={}, stage={}", run.getId(), transcriptId, stage, ex);
            recordStageFailure(run, result, reached, stage, ResponseCode.UN_ERROR.getCode(),
                    StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName()));
        } finally {
            finishIfTerminal(run);
            MDC.remove(Constants.MDC_TRANSCRIPT_ID);
            MDC.remove(Constants.MDC_RUN_ID);
        }
    }

    private void executeAutoApproved(PipelineRunEntity run,
                                     TranscriptResult.TranscriptResultBuilder result,
                                     PipelineStageEnum reached,
                                     List<WorkflowEntity> routed) {
        int autoApproved = 0;
        int awaiting = 0;
        int executed = 0;
        List<String> failures = new ArrayList<>();
        for (WorkflowEntity workflow : routed) {
            if (workflow.getStatus() == WorkflowStatusEnum.AWAITING_APPROVAL) {
                awaiting++;
                continue;
            }
            if (workflow.getStatus() != WorkflowStatusEnum.AUTO_APPROVED) {
                continue;
            }
            autoApproved++;
            try {
                WorkflowExecutionResult execution = executionTrackerDomainService.executeWorkflow(workflow.getId(),
                        run.getActuatorTimeoutMs());
                if (execution.executed()) {
                    executed++;
                } else {
                    failures.add(workflow.getId() + ": " + StringUtils.defaultIfBlank(execution.error(), "not executed"));
                }
            } catch (AppException ex) {
                failures.add(workflow.getId() + ": " + ex.getInfo());
            }
        }
        result.autoApprovedCount(autoApproved)
                .awaitingApprovalCount(awaiting)
                .executedCount(executed)
                .failedCount(failures.size())
                .finishedAt(LocalDateTime.now());

        if (failures.isEmpty()) {
            run.recordSuccess(result.success(true).stage(PipelineStageEnum.EXECUTION_COMPLETED).build());
            log.info("Pipeline transcript completed. runId={}, transcriptId={}, workflowCount={}, executed={}, awaitingApproval={}",
                    run.getId(), result.build().getTranscriptId(), routed.size(), executed, awaiting);
            return;
        }
        String message = failures.size() + " auto-approved workflow(s) did not execute: " + String.join("; ", failures);
        TranscriptResult failed = result.success(false).stage(reached).error(message).build();
        run.recordFailure(failed, TranscriptError.of(failed.getTranscriptId(), STAGE_EXECUTION,
                ResponseCode.STAGE_FAILURE, message));
        countTranscriptFailure(STAGE_EXECUTION);
        log.warn("Pipeline transcript failed. runId={}, transcriptId={}, stage={}, error={}",
                run.getId(), failed.getTranscriptId(), STAGE_EXECUTION, message);
    }

    private boolean cancelled(PipelineRunEntity run,
                              TranscriptResult.TranscriptResultBuilder result,
                              PipelineStageEnum reached,
                              String nextStage) {
        if (!run.isCancelRequested()) {
            return false;
        }
        String message = "Run cancelled before " + nextStage;
        TranscriptResult cancelled = result.success(false).stage(reached).error(message).finishedAt(LocalDateTime.now()).build();
        run.recordFailure(cancelled, TranscriptError.of(cancelled.getTranscriptId(), nextStage, ResponseCode.CANCELLED, message));
        countTranscriptFailure("CANCELLED");
        log.info("Pipeline transcript cancelled. runId={}, transcriptId={}, stage={}", run.getId(), cancelled.getTranscriptId(), nextStage);
        return true;
    }

    private void recordStageFailure(PipelineRunEntity run,
                                    TranscriptResult.TranscriptResultBuilder result,
                                    PipelineStageEnum reached,
                                    String stage,
                                    String errorCode,
                                    String message) {
        TranscriptResult failed = result.success(false).stage(reached).error(message).finishedAt(LocalDateTime.now()).build();
        run.recordFailure(failed, TranscriptError.of(failed.getTranscriptId(), stage, errorCode, message));
        countTranscriptFailure(stage);
        log.warn("Pipeline transcript failed. runId={}, transcriptId={}, stage={}, error={}",
                run.getId(), failed.getTranscriptId(), stage, message);
    }

    private PipelineStageEnum advance(PipelineRunEntity run, String transcriptId, PipelineStageEnum reached) {
        run.advance(transcriptId, reached);
        return reached;
    }

    private void finishIfTerminal(PipelineRunEntity run) {
        if (!run.isTerminal()) {
            return;
        }
        CompletableFuture<RunSnapshot> completion = completions.remove(run.getId());
        if (completion == null) {
            return;
        }
        RunSnapshot snapshot = run.snapshot();
        completion.complete(snapshot);
        Metrics.counter("callflow.run.finished.total", "status", snapshot.getStatus().name()).increment();
        log.info("Pipeline run finished. runId={}, status={}, total={}, successful={}, failed={}, successRate={}",
                run.getId(), snapshot.getStatus(), snapshot.getSummary().getTotal(), snapshot.getSummary().getSuccessful(),
                snapshot.getSummary().getFailed(), snapshot.getSummary().getSuccessRate());
    }

    private void countTranscriptFailure(String stage) {
        Metrics.counter("callflow.run.transcript.failed.total", "stage", stage).increment();
    }

    private List<String> normalizeTranscriptIds(List<String> transcriptIds) {
        if (transcriptIds == null || transcriptIds.isEmpty()) {
            throw AppException.invalidInput("transcript_ids must not be empty");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String transcriptId : transcriptIds) {
            if (StringUtils.isNotBlank(transcriptId)) {
                normalized.add(transcriptId.trim());
            }
        }
        if (normalized.isEmpty()) {
            throw AppException.invalidInput("transcript_ids must contain at least one non-blank ID");
        }
        return new ArrayList<>(normalized);
    }

    private long resolveTimeout(String name, Long requested, long defaultValue) {
        if (requested == null) {
            return defaultValue;
        }
        if (requested <= 0L) {
            throw AppException.invalidInput(name + " must be positive: " + requested);
        }
        return requested;
    }

    private PipelineRunEntity requireRun(String runId) {
        if (StringUtils.isBlank(runId)) {
            throw AppException.invalidInput("Run ID is required");
        }
        PipelineRunEntity run = pipelineRunRepository.findById(runId.trim());
        if (run == null) {
            throw AppException.invalidInput("Run not found: " + runId);
        }
        return run;
    }
}
