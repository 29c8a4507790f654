package com.callflow.domain.pipeline.service;

import com.callflow.domain.analysis.adapter.gateway.IRiskClassifier;
import com.callflow.domain.analysis.adapter.gateway.ITranscriptAnalyzer;
import com.callflow.domain.analysis.adapter.repository.IAnalysisRepository;
import com.callflow.domain.analysis.model.entity.AnalysisEntity;
import com.callflow.domain.analysis.model.valobj.RiskAssessment;
import com.callflow.domain.planning.adapter.gateway.IActionPlanner;
import com.callflow.domain.planning.adapter.gateway.IWorkflowExtractor;
import com.callflow.domain.planning.adapter.repository.IActionPlanRepository;
import com.callflow.domain.planning.model.entity.ActionPlanEntity;
import com.callflow.domain.transcript.model.entity.TranscriptEntity;
import com.callflow.domain.workflow.adapter.repository.IWorkflowRepository;
import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.types.enums.WorkflowStatusEnum;
import com.callflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 流水线阶段领域服务：以超时为界调用分析、风险分类、计划生成与工作流抽取引擎，
 * 校验其输出并补齐血缘字段后持久化。引擎输出不合法时抛出 STAGE_FAILURE。
 */
@Slf4j
@Service
public class PipelineStageDomainService {

    private final ITranscriptAnalyzer transcriptAnalyzer;
    private final IRiskClassifier riskClassifier;
    private final IActionPlanner actionPlanner;
    private final IWorkflowExtractor workflowExtractor;
    private final IAnalysisRepository analysisRepository;
    private final IActionPlanRepository actionPlanRepository;
    private final IWorkflowRepository workflowRepository;
    private final StageCallInvoker stageCallInvoker;

    public PipelineStageDomainService(ITranscriptAnalyzer transcriptAnalyzer,
                                      IRiskClassifier riskClassifier,
                                      IActionPlanner actionPlanner,
                                      IWorkflowExtractor workflowExtractor,
                                      IAnalysisRepository analysisRepository,
                                      IActionPlanRepository actionPlanRepository,
                                      IWorkflowRepository workflowRepository,
                                      StageCallInvoker stageCallInvoker) {
        this.transcriptAnalyzer = transcriptAnalyzer;
        this.riskClassifier = riskClassifier;
        this.actionPlanner = actionPlanner;
        this.workflowExtractor = workflowExtractor;
        this.analysisRepository = analysisRepository;
        this.actionPlanRepository = actionPlanRepository;
        this.workflowRepository = workflowRepository;
        this.stageCallInvoker = stageCallInvoker;
    }

    public AnalysisEntity analyze(TranscriptEntity transcript, String runId, long timeoutMs) {
        AnalysisEntity analysis = stageCallInvoker.invoke("analyze", timeoutMs,
                () -> transcriptAnalyzer.analyze(transcript));
        if (analysis == null) {
            throw AppException.stageFailure("Analyzer returned no analysis for transcript " + transcript.getId(), null);
        }
        if (analysis.getTranscriptId() == null) {
            analysis.setTranscriptId(transcript.getId());
        } else if (!Objects.equals(analysis.getTranscriptId(), transcript.getId())) {
            throw AppException.stageFailure("Analysis " + analysis.getId() + " belongs to transcript "
                    + analysis.getTranscriptId() + ", expected " + transcript.getId(), null);
        }
        analysis.setRunId(runId);
        if (analysis.getCreatedAt() == null) {
            analysis.setCreatedAt(LocalDateTime.now());
        }
        validate("analysis", analysis::validate);
        AnalysisEntity saved = analysisRepository.save(analysis);
        log.info("Analysis completed. runId={}, transcriptId={}, analysisId={}", runId, transcript.getId(), saved.getId());
        return saved;
    }

    /**
     * 风险分类后生成行动计划，计划未声明风险等级或审批路由时取分类结果。
     */
    public ActionPlanEntity plan(AnalysisEntity analysis, long timeoutMs) {
        RiskAssessment assessment = stageCallInvoker.invoke("classify", timeoutMs,
                () -> riskClassifier.classify(analysis));
        if (assessment == null) {
            throw AppException.stageFailure("Risk classifier returned no assessment for analysis " + analysis.getId(), null);
        }
        ActionPlanEntity plan = stageCallInvoker.invoke("plan", timeoutMs,
                () -> actionPlanner.plan(analysis, assessment));
        if (plan == null) {
            throw AppException.stageFailure("Planner returned no plan for analysis " + analysis.getId(), null);
        }
        if (plan.getAnalysisId() == null) {
            plan.setAnalysisId(analysis.getId());
        } else if (!Objects.equals(plan.getAnalysisId(), analysis.getId())) {
            throw AppException.stageFailure("Plan " + plan.getId() + " belongs to analysis "
                    + plan.getAnalysisId() + ", expected " + analysis.getId(), null);
        }
        plan.setTranscriptId(analysis.getTranscriptId());
        plan.setRunId(analysis.getRunId());
        if (plan.getRiskLevel() == null) {
            plan.setRiskLevel(assessment.getRiskLevel());
        }
        if (StringUtils.isBlank(plan.getApprovalRoute())) {
            plan.setApprovalRoute(assessment.getApprovalRoute());
        }
        LocalDateTime now = LocalDateTime.now();
        if (plan.getCreatedAt() == null) {
            plan.setCreatedAt(now);
        }
        plan.setUpdatedAt(now);
        validate("plan", plan::validate);
        ActionPlanEntity saved = actionPlanRepository.save(plan);
        log.info("Plan completed. runId={}, analysisId={}, planId={}, riskLevel={}, approvalRoute={}",
                saved.getRunId(), analysis.getId(), saved.getId(), saved.getRiskLevel(), saved.getApprovalRoute());
        return saved;
    }

    /**
     * 抽取工作流并补齐血缘；数量超过上限视为引擎输出不合法。
     */
    public List<WorkflowEntity> extractWorkflows(ActionPlanEntity plan, long timeoutMs, int maxWorkflows) {
        List<WorkflowEntity> extracted = stageCallInvoker.invoke("extract", timeoutMs,
                () -> workflowExtractor.extract(plan));
        if (extracted == null) {
            throw AppException.stageFailure("Extractor returned no workflow list for plan " + plan.getId(), null);
        }
        if (maxWorkflows > 0 && extracted.size() > maxWorkflows) {
            throw AppException.stageFailure("Plan " + plan.getId() + " produced " + extracted.size()
                    + " workflows, limit is " + maxWorkflows, null);
        }
        LocalDateTime now = LocalDateTime.now();
        List<WorkflowEntity> prepared = new ArrayList<>(extracted.size());
        for (WorkflowEntity workflow : extracted) {
            if (workflow == null) {
                throw AppException.stageFailure("Extractor returned a null workflow for plan " + plan.getId(), null);
            }
            if (workflow.getPlanId() == null) {
                workflow.setPlanId(plan.getId());
            } else if (!Objects.equals(workflow.getPlanId(), plan.getId())) {
                throw AppException.stageFailure("Workflow " + workflow.getId() + " belongs to plan "
                        + workflow.getPlanId() + ", expected " + plan.getId(), null);
            }
            if (workflow.getStatus() == null) {
                workflow.setStatus(WorkflowStatusEnum.PENDING_ASSESSMENT);
            } else if (workflow.getStatus() != WorkflowStatusEnum.PENDING_ASSESSMENT) {
                throw AppException.stageFailure("Extracted workflow " + workflow.getId()
                        + " must start in PENDING_ASSESSMENT, got " + workflow.getStatus(), null);
            }
            workflow.setAnalysisId(plan.getAnalysisId());
            workflow.setTranscriptId(plan.getTranscriptId());
            workflow.setRunId(plan.getRunId());
            workflow.setCreatedAt(now);
            workflow.setUpdatedAt(now);
            validate("workflow", workflow::validate);
            prepared.add(workflow);
        }
        List<WorkflowEntity> saved = new ArrayList<>(prepared.size());
        for (WorkflowEntity workflow : prepared) {
            saved.add(workflowRepository.save(workflow));
        }
        log.info("Workflows extracted. runId={}, planId={}, workflowCount={}", plan.getRunId(), plan.getId(), saved.size());
        return saved;
    }

    private void validate(String subject, Runnable validation) {
        try {
            validation.run();
        } catch (IllegalStateException ex) {
            throw AppException.stageFailure("Malformed " + subject + ": " + ex.getMessage(), ex);
        }
    }
}
