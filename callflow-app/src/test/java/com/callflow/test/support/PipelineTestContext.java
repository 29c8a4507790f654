package com.callflow.test.support;

import com.callflow.domain.analysis.adapter.gateway.IRiskClassifier;
import com.callflow.domain.analysis.adapter.gateway.ITranscriptAnalyzer;
import com.callflow.domain.pipeline.service.PipelineStageDomainService;
import com.callflow.domain.pipeline.service.StageCallInvoker;
import com.callflow.domain.planning.adapter.gateway.IActionPlanner;
import com.callflow.domain.planning.adapter.gateway.IWorkflowExtractor;
import com.callflow.domain.transcript.model.entity.TranscriptEntity;
import com.callflow.domain.workflow.adapter.gateway.IStepActuator;
import com.callflow.domain.workflow.service.ApprovalGateDomainService;
import com.callflow.domain.workflow.service.ExecutionTrackerDomainService;
import com.callflow.infrastructure.analysis.KeywordTranscriptAnalyzer;
import com.callflow.infrastructure.analysis.ThresholdRiskClassifier;
import com.callflow.infrastructure.dao.ActionPlanDao;
import com.callflow.infrastructure.dao.AnalysisDao;
import com.callflow.infrastructure.dao.ExecutionStepDao;
import com.callflow.infrastructure.dao.TranscriptDao;
import com.callflow.infrastructure.dao.WorkflowDao;
import com.callflow.infrastructure.execution.SimulatedStepActuator;
import com.callflow.infrastructure.planning.RolePlanWorkflowExtractor;
import com.callflow.infrastructure.planning.TemplateActionPlanner;
import com.callflow.infrastructure.repository.analysis.AnalysisRepositoryImpl;
import com.callflow.infrastructure.repository.planning.ActionPlanRepositoryImpl;
import com.callflow.infrastructure.repository.run.PipelineRunRepositoryImpl;
import com.callflow.infrastructure.repository.transcript.TranscriptRepositoryImpl;
import com.callflow.infrastructure.repository.workflow.ExecutionStepRepositoryImpl;
import com.callflow.infrastructure.repository.workflow.WorkflowRepositoryImpl;
import com.callflow.infrastructure.util.JsonCodec;
import com.callflow.trigger.service.PipelineOrchestratorService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.LocalDateTime;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 测试装配：真实的内存仓储与默认网关，网关可按需替换。
 */
public class PipelineTestContext implements AutoCloseable {

    public final JsonCodec jsonCodec = new JsonCodec(new ObjectMapper().registerModule(new JavaTimeModule()));
    public final TranscriptRepositoryImpl transcriptRepository = new TranscriptRepositoryImpl(new TranscriptDao());
    public final AnalysisRepositoryImpl analysisRepository = new AnalysisRepositoryImpl(new AnalysisDao(), jsonCodec);
    public final ActionPlanRepositoryImpl actionPlanRepository = new ActionPlanRepositoryImpl(new ActionPlanDao(), jsonCodec);
    public final WorkflowRepositoryImpl workflowRepository = new WorkflowRepositoryImpl(new WorkflowDao(), jsonCodec);
    public final ExecutionStepRepositoryImpl executionStepRepository = new ExecutionStepRepositoryImpl(new ExecutionStepDao(), jsonCodec);
    public final PipelineRunRepositoryImpl pipelineRunRepository = new PipelineRunRepositoryImpl();

    public final ExecutorService stageCallWorker = Executors.newFixedThreadPool(16);
    public final ExecutorService pipelineWorker = Executors.newFixedThreadPool(8);
    public final StageCallInvoker stageCallInvoker = new StageCallInvoker(stageCallWorker);

    public ITranscriptAnalyzer transcriptAnalyzer = new KeywordTranscriptAnalyzer();
    public IRiskClassifier riskClassifier = new ThresholdRiskClassifier(0.7D, 0.4D);
    public IActionPlanner actionPlanner = new TemplateActionPlanner();
    public IWorkflowExtractor workflowExtractor = new RolePlanWorkflowExtractor();
    public IStepActuator stepActuator = new SimulatedStepActuator();

    public ExecutionTrackerDomainService executionTracker() {
        return new ExecutionTrackerDomainService(workflowRepository, executionStepRepository, stepActuator, stageCallInvoker);
    }

    public ApprovalGateDomainService approvalGate() {
        return new ApprovalGateDomainService(workflowRepository, executionTracker());
    }

    public PipelineStageDomainService pipelineStages() {
        return new PipelineStageDomainService(transcriptAnalyzer, riskClassifier, actionPlanner, workflowExtractor,
                analysisRepository, actionPlanRepository, workflowRepository, stageCallInvoker);
    }

    public PipelineOrchestratorService orchestrator() {
        return orchestrator(30000L, 10000L);
    }

    public PipelineOrchestratorService orchestrator(long stageTimeoutMs, long actuatorTimeoutMs) {
        ExecutionTrackerDomainService executionTracker = executionTracker();
        return new PipelineOrchestratorService(transcriptRepository, pipelineRunRepository, pipelineStages(),
                new ApprovalGateDomainService(workflowRepository, executionTracker), executionTracker,
                pipelineWorker, stageTimeoutMs, actuatorTimeoutMs, 50);
    }

    public TranscriptEntity saveTranscript(String id, String content) {
        TranscriptEntity transcript = new TranscriptEntity();
        transcript.setId(id);
        transcript.setCustomerId("CUST_" + id);
        transcript.setAdvisorId("ADV_001");
        transcript.setTopic("servicing");
        transcript.setContent(content);
        transcript.setCreatedAt(LocalDateTime.now());
        return transcriptRepository.save(transcript);
    }

    @Override
    public void close() {
        pipelineWorker.shutdownNow();
        stageCallWorker.shutdownNow();
    }
}
