package com.callflow.test;

import com.callflow.domain.run.model.valobj.RunSnapshot;
import com.callflow.domain.run.model.valobj.TranscriptError;
import com.callflow.domain.run.model.valobj.TranscriptResult;
import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.infrastructure.analysis.KeywordTranscriptAnalyzer;
import com.callflow.infrastructure.execution.SimulatedStepActuator;
import com.callflow.test.support.PipelineTestContext;
import com.callflow.test.support.Sleeps;
import com.callflow.trigger.service.PipelineOrchestratorService;
import com.callflow.types.enums.PipelineStageEnum;
import com.callflow.types.enums.ResponseCode;
import com.callflow.types.enums.RunStatusEnum;
import com.callflow.types.enums.StepStatusEnum;
import com.callflow.types.enums.WorkflowStatusEnum;
import com.callflow.types.exception.AppException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class PipelineOrchestratorServiceTest {

    private static final Duration AWAIT = Duration.ofSeconds(10);

    private static final String GENERAL_CALL = "Borrower asked when the next statement will arrive and confirmed the address.";
    private static final String HARDSHIP_CALL = "I lost my job and I am behind on payments, I missed the last one.";

    private PipelineTestContext context;

    @BeforeEach
    public void setUp() {
        context = new PipelineTestContext();
        context.saveTranscript("TX_1", GENERAL_CALL);
        context.saveTranscript("TX_2", HARDSHIP_CALL);
        context.saveTranscript("TX_3", GENERAL_CALL);
    }

    @AfterEach
    public void tearDown() {
        context.close();
    }

    @Test
    public void shouldIsolateFailedAnalysisAndSummarizeRun() {
        KeywordTranscriptAnalyzer analyzer = new KeywordTranscriptAnalyzer();
        context.transcriptAnalyzer = transcript -> {
            if ("TX_2".equals(transcript.getId())) {
                throw new IllegalStateException("analysis engine unavailable");
            }
            return analyzer.analyze(transcript);
        };
        PipelineOrchestratorService orchestrator = context.orchestrator();

        RunSnapshot accepted = orchestrator.runPipeline(Arrays.asList("TX_1", "TX_2", "TX_3"), false, null, null);
        Assertions.assertEquals(RunStatusEnum.STARTED, accepted.getStatus());

        RunSnapshot finished = orchestrator.awaitRun(accepted.getRunId(), AWAIT);

        Assertions.assertEquals(RunStatusEnum.COMPLETED, finished.getStatus());
        Assertions.assertEquals(PipelineStageEnum.COMPLETE, finished.getStage());
        Assertions.assertEquals(3, finished.getSummary().getTotal());
        Assertions.assertEquals(2, finished.getSummary().getSuccessful());
        Assertions.assertEquals(1, finished.getSummary().getFailed());
        Assertions.assertEquals(0.667D, finished.getSummary().getSuccessRate(), 0.0001D);
        Assertions.assertEquals(1, finished.getErrors().size());
        TranscriptError error = finished.getErrors().get(0);
        Assertions.assertEquals("TX_2", error.getTranscriptId());
        Assertions.assertEquals("ANALYSIS", error.getStage());
        Assertions.assertEquals(ResponseCode.STAGE_FAILURE.getCode(), error.getErrorCode());
        Assertions.assertTrue(error.getError().contains("analysis engine unavailable"));

        TranscriptResult first = resultOf(finished, "TX_1");
        Assertions.assertTrue(first.isSuccess());
        Assertions.assertNotNull(first.getAnalysisId());
        Assertions.assertNotNull(first.getPlanId());
        Assertions.assertTrue(first.getWorkflowCount() > 0);
        Assertions.assertEquals(first.getWorkflowCount(), first.getAwaitingApprovalCount());
        Assertions.assertEquals(0, first.getExecutedCount());
        for (String workflowId : first.getWorkflowIds()) {
            WorkflowEntity workflow = context.workflowRepository.findById(workflowId);
            Assertions.assertEquals(WorkflowStatusEnum.AWAITING_APPROVAL, workflow.getStatus());
            Assertions.assertEquals(first.getPlanId(), workflow.getPlanId());
            Assertions.assertEquals(accepted.getRunId(), workflow.getRunId());
        }
    }

    @Test
    public void shouldExecuteLowRiskWorkflowsWhenAutoApproveEnabled() {
        PipelineOrchestratorService orchestrator = context.orchestrator();

        RunSnapshot finished = orchestrator.awaitRun(
                orchestrator.runPipeline(Collections.singletonList("TX_1"), true, null, null).getRunId(), AWAIT);

        TranscriptResult result = resultOf(finished, "TX_1");
        Assertions.assertTrue(result.isSuccess());
        Assertions.assertEquals(PipelineStageEnum.EXECUTION_COMPLETED, result.getStage());
        Assertions.assertEquals(result.getWorkflowCount(), result.getAutoApprovedCount());
        Assertions.assertEquals(result.getWorkflowCount(), result.getExecutedCount());
        for (String workflowId : result.getWorkflowIds()) {
            Assertions.assertEquals(WorkflowStatusEnum.EXECUTED, context.workflowRepository.findById(workflowId).getStatus());
        }
    }

    @Test
    public void shouldKeepHighRiskWorkflowsForHumanEvenWithAutoApprove() {
        PipelineOrchestratorService orchestrator = context.orchestrator();

        RunSnapshot finished = orchestrator.awaitRun(
                orchestrator.runPipeline(Collections.singletonList("TX_2"), true, null, null).getRunId(), AWAIT);

        TranscriptResult result = resultOf(finished, "TX_2");
        Assertions.assertTrue(result.isSuccess());
        Assertions.assertEquals(0, result.getAutoApprovedCount());
        Assertions.assertEquals(result.getWorkflowCount(), result.getAwaitingApprovalCount());
        List<WorkflowEntity> workflows = context.workflowRepository.findByStatus(WorkflowStatusEnum.AWAITING_APPROVAL);
        Assertions.assertEquals(result.getWorkflowCount(), workflows.size());
    }

    @Test
    public void shouldReportExecutionFailureOfAutoApprovedWorkflow() {
        SimulatedStepActuator simulated = new SimulatedStepActuator();
        context.stepActuator = step -> {
            if ("crm".equals(step.getToolNeeded())) {
                throw new IllegalStateException("CRM unavailable");
            }
            return simulated.execute(step);
        };
        PipelineOrchestratorService orchestrator = context.orchestrator();

        RunSnapshot finished = orchestrator.awaitRun(
                orchestrator.runPipeline(Collections.singletonList("TX_1"), true, null, null).getRunId(), AWAIT);

        TranscriptResult result = resultOf(finished, "TX_1");
        Assertions.assertFalse(result.isSuccess());
        Assertions.assertEquals(PipelineStageEnum.WORKFLOWS_COMPLETED, result.getStage());
        Assertions.assertEquals(1, result.getFailedCount());
        Assertions.assertEquals(1, finished.getErrors().size());
        Assertions.assertEquals("EXECUTION", finished.getErrors().get(0).getStage());
        boolean erroredStepKept = result.getWorkflowIds().stream()
                .flatMap(workflowId -> context.executionStepRepository.findByWorkflowId(workflowId).stream())
                .anyMatch(step -> step.getStatus() == StepStatusEnum.ERROR);
        Assertions.assertTrue(erroredStepKept);
    }

    @Test
    public void shouldRejectEmptyOrBlankInput() {
        PipelineOrchestratorService orchestrator = context.orchestrator();

        AppException empty = Assertions.assertThrows(AppException.class,
                () -> orchestrator.runPipeline(Collections.emptyList(), false, null, null));
        AppException blank = Assertions.assertThrows(AppException.class,
                () -> orchestrator.runPipeline(Arrays.asList(" ", ""), false, null, null));
        AppException badTimeout = Assertions.assertThrows(AppException.class,
                () -> orchestrator.runPipeline(Collections.singletonList("TX_1"), false, 0L, null));

        Assertions.assertTrue(empty.is(ResponseCode.ILLEGAL_PARAMETER));
        Assertions.assertTrue(blank.is(ResponseCode.ILLEGAL_PARAMETER));
        Assertions.assertTrue(badTimeout.is(ResponseCode.ILLEGAL_PARAMETER));
        Assertions.assertTrue(orchestrator.listRuns().isEmpty());
    }

    @Test
    public void shouldFailRunWhenNoTranscriptResolves() {
        PipelineOrchestratorService orchestrator = context.orchestrator();

        RunSnapshot snapshot = orchestrator.runPipeline(Arrays.asList("MISSING_1", "MISSING_2"), false, null, null);

        Assertions.assertEquals(RunStatusEnum.FAILED, snapshot.getStatus());
        Assertions.assertEquals(2, snapshot.getErrors().size());
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), snapshot.getErrors().get(0).getErrorCode());
        Assertions.assertEquals(0, snapshot.getSummary().getSuccessful());
        Assertions.assertSame(snapshot, orchestrator.getStatus(snapshot.getRunId()));
    }

    @Test
    public void shouldRecordUnknownTranscriptAndProcessTheRest() {
        PipelineOrchestratorService orchestrator = context.orchestrator();

        RunSnapshot finished = orchestrator.awaitRun(
                orchestrator.runPipeline(Arrays.asList("TX_1", "MISSING_1"), false, null, null).getRunId(), AWAIT);

        Assertions.assertEquals(RunStatusEnum.COMPLETED, finished.getStatus());
        Assertions.assertEquals(1, finished.getSummary().getSuccessful());
        Assertions.assertEquals(1, finished.getSummary().getFailed());
        Assertions.assertEquals("RESOLVE", finished.getErrors().get(0).getStage());
    }

    @Test
    public void shouldCollapseDuplicateTranscriptIds() {
        PipelineOrchestratorService orchestrator = context.orchestrator();

        RunSnapshot accepted = orchestrator.runPipeline(Arrays.asList("TX_1", " TX_1 ", "", "TX_3"), false, null, null);
        RunSnapshot finished = orchestrator.awaitRun(accepted.getRunId(), AWAIT);

        Assertions.assertEquals(Arrays.asList("TX_1", "TX_3"), accepted.getTranscriptIds());
        Assertions.assertEquals(2, finished.getSummary().getTotal());
        Assertions.assertEquals(2, finished.getResults().size());
    }

    @Test
    public void shouldTimeOutSlowTranscriptWithoutBlockingOthers() {
        KeywordTranscriptAnalyzer analyzer = new KeywordTranscriptAnalyzer();
        context.transcriptAnalyzer = transcript -> {
            if ("TX_2".equals(transcript.getId())) {
                Sleeps.sleep(5000L);
            }
            return analyzer.analyze(transcript);
        };
        PipelineOrchestratorService orchestrator = context.orchestrator();

        long startNs = System.nanoTime();
        RunSnapshot finished = orchestrator.awaitRun(
                orchestrator.runPipeline(Arrays.asList("TX_1", "TX_2", "TX_3"), false, 300L, null).getRunId(), AWAIT);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);

        Assertions.assertEquals(RunStatusEnum.COMPLETED, finished.getStatus());
        Assertions.assertTrue(elapsedMs < 4000L, "run waited for the slow analyzer: " + elapsedMs + "ms");
        Assertions.assertEquals(2, finished.getSummary().getSuccessful());
        TranscriptError error = finished.getErrors().get(0);
        Assertions.assertEquals("TX_2", error.getTranscriptId());
        Assertions.assertTrue(error.getError().contains("timed out"));
    }

    @Test
    public void shouldStopAtStageBoundaryWhenCancelled() throws InterruptedException {
        CountDownLatch analyzing = new CountDownLatch(3);
        CountDownLatch release = new CountDownLatch(1);
        KeywordTranscriptAnalyzer analyzer = new KeywordTranscriptAnalyzer();
        context.transcriptAnalyzer = transcript -> {
            analyzing.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return analyzer.analyze(transcript);
        };
        PipelineOrchestratorService orchestrator = context.orchestrator();
        RunSnapshot accepted = orchestrator.runPipeline(Arrays.asList("TX_1", "TX_2", "TX_3"), true, null, null);
        Assertions.assertTrue(analyzing.await(5, TimeUnit.SECONDS));

        RunSnapshot cancelling = orchestrator.cancelRun(accepted.getRunId());
        release.countDown();
        RunSnapshot finished = orchestrator.awaitRun(accepted.getRunId(), AWAIT);

        Assertions.assertTrue(cancelling.isCancelRequested());
        Assertions.assertEquals(RunStatusEnum.COMPLETED, finished.getStatus());
        Assertions.assertEquals(3, finished.getSummary().getFailed());
        Assertions.assertEquals(3, finished.getErrors().size());
        for (TranscriptError error : finished.getErrors()) {
            Assertions.assertEquals(ResponseCode.CANCELLED.getCode(), error.getErrorCode());
            Assertions.assertEquals("PLAN", error.getStage());
        }
        Assertions.assertTrue(context.workflowRepository.findAll().isEmpty());
        AppException ex = Assertions.assertThrows(AppException.class, () -> orchestrator.cancelRun(accepted.getRunId()));
        Assertions.assertTrue(ex.is(ResponseCode.INVALID_TRANSITION));
    }

    @Test
    public void shouldReturnIdenticalTerminalSnapshot() {
        PipelineOrchestratorService orchestrator = context.orchestrator();
        RunSnapshot accepted = orchestrator.runPipeline(Arrays.asList("TX_1", "TX_3"), false, null, null);

        RunSnapshot finished = orchestrator.awaitRun(accepted.getRunId(), AWAIT);

        Assertions.assertTrue(finished.isTerminal());
        Assertions.assertSame(finished, orchestrator.getStatus(accepted.getRunId()));
        Assertions.assertSame(finished, orchestrator.getStatus(accepted.getRunId()));
        Assertions.assertEquals(finished.getRunId(), orchestrator.listRuns().get(0).getRunId());
    }

    @Test
    public void shouldRejectUnknownRun() {
        PipelineOrchestratorService orchestrator = context.orchestrator();

        AppException ex = Assertions.assertThrows(AppException.class, () -> orchestrator.getStatus("RUN_UNKNOWN"));

        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
    }

    private TranscriptResult resultOf(RunSnapshot snapshot, String transcriptId) {
        return snapshot.getResults().stream()
                .filter(result -> transcriptId.equals(result.getTranscriptId()))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no result for " + transcriptId));
    }
}
