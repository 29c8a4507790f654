package com.callflow.domain.workflow.service;

import com.callflow.domain.workflow.adapter.repository.IWorkflowRepository;
import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.domain.workflow.model.valobj.BulkApprovalResult;
import com.callflow.domain.workflow.model.valobj.RoutingContext;
import com.callflow.domain.workflow.model.valobj.RoutingDecision;
import com.callflow.types.enums.RiskLevelEnum;
import com.callflow.types.enums.WorkflowStatusEnum;
import com.callflow.types.exception.AppException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 审批闸门领域服务：按风险等级路由工作流，并负责人工审批与驳回迁移。
 */
@Slf4j
@Service
public class ApprovalGateDomainService {

    private static final String BULK_APPROVAL_NOTES = "Bulk approval";

    private final IWorkflowRepository workflowRepository;
    private final ExecutionTrackerDomainService executionTrackerDomainService;
    private final Counter dataQualityWarningCounter;
    private final Counter autoApprovedCounter;
    private final Counter awaitingApprovalCounter;

    public ApprovalGateDomainService(IWorkflowRepository workflowRepository,
                                     ExecutionTrackerDomainService executionTrackerDomainService) {
        this.workflowRepository = workflowRepository;
        this.executionTrackerDomainService = executionTrackerDomainService;
        this.dataQualityWarningCounter = Counter.builder("callflow.workflow.data_quality.warning.total")
                .tag("reason", "MISSING_RISK_LEVEL")
                .register(Metrics.globalRegistry);
        this.autoApprovedCounter = Counter.builder("callflow.workflow.route.total")
                .tag("status", WorkflowStatusEnum.AUTO_APPROVED.name())
                .register(Metrics.globalRegistry);
        this.awaitingApprovalCounter = Counter.builder("callflow.workflow.route.total")
                .tag("status", WorkflowStatusEnum.AWAITING_APPROVAL.name())
                .register(Metrics.globalRegistry);
    }

    /**
     * 路由决策，只取决于风险等级、运行级自动审批开关和计划级自动执行标记。
     * 风险等级缺失时按 HIGH 处理并记录数据质量告警。
     */
    public RoutingDecision route(WorkflowEntity workflow, RoutingContext context) {
        if (workflow == null) {
            throw AppException.invalidInput("Workflow cannot be null");
        }
        RoutingContext effectiveContext = context == null ? RoutingContext.of(false) : context;
        RiskLevelEnum riskLevel = workflow.getRiskLevel();
        boolean riskDefaulted = false;
        if (riskLevel == null) {
            riskLevel = RiskLevelEnum.HIGH;
            riskDefaulted = true;
            dataQualityWarningCounter.increment();
            log.warn("DATA_QUALITY_WARNING Workflow risk level missing, routed as HIGH. workflowId={}, transcriptId={}, planId={}",
                    workflow.getId(), workflow.getTranscriptId(), workflow.getPlanId());
        }

        return switch (riskLevel) {
            case HIGH, MEDIUM -> awaiting(riskLevel, riskDefaulted,
                    riskDefaulted
                            ? "Risk level missing, treated as HIGH"
                            : riskLevel.name() + " risk requires human approval");
            case LOW -> {
                if (!effectiveContext.autoApprove()) {
                    yield awaiting(riskLevel, false, "LOW risk without run-level auto-approve");
                }
                if (effectiveContext.planForbidsAutoExecution()) {
                    yield awaiting(riskLevel, false, "Plan is not auto-executable");
                }
                yield RoutingDecision.builder()
                        .status(WorkflowStatusEnum.AUTO_APPROVED)
                        .requiresHumanApproval(false)
                        .effectiveRiskLevel(riskLevel)
                        .riskDefaulted(false)
                        .reason("LOW risk with auto-approve")
                        .build();
            }
        };
    }

    /**
     * 对 PENDING_ASSESSMENT 工作流应用路由决策并持久化
     */
    public WorkflowEntity applyRouting(String workflowId, RoutingContext context) {
        WorkflowEntity workflow = requireWorkflow(workflowId);
        RoutingDecision decision = route(workflow, context);
        try {
            workflow.applyRouting(decision);
        } catch (IllegalStateException ex) {
            throw AppException.invalidTransition(ex.getMessage());
        }
        WorkflowEntity routed = workflowRepository.update(workflow);
        if (routed.getStatus() == WorkflowStatusEnum.AUTO_APPROVED) {
            autoApprovedCounter.increment();
        } else {
            awaitingApprovalCounter.increment();
        }
        log.info("Workflow routed. workflowId={}, riskLevel={}, riskDefaulted={}, status={}",
                routed.getId(), routed.getRiskLevel(), routed.isRiskDefaulted(), routed.getStatus());
        return routed;
    }

    /**
     * 人工审批通过：AWAITING_APPROVAL → APPROVED。
     * 执行步骤先于审批落库构建，无法拆解步骤的工作流保持原状态。
     */
    public WorkflowEntity approve(String workflowId, String approverId, String reasoning) {
        if (StringUtils.isBlank(approverId)) {
            throw AppException.invalidInput("Approver is required");
        }
        WorkflowEntity workflow = requireWorkflow(workflowId);
        try {
            workflow.approve(approverId.trim(), StringUtils.trimToNull(reasoning));
        } catch (IllegalStateException ex) {
            throw AppException.invalidTransition(ex.getMessage());
        }
        executionTrackerDomainService.buildSteps(workflow);
        WorkflowEntity approved = workflowRepository.update(workflow);
        log.info("Workflow approved. workflowId={}, approvedBy={}", approved.getId(), approved.getApprovedBy());
        return approved;
    }

    /**
     * 批量审批：ID 去空去重后逐个审批，单个失败只记入结果。
     */
    public BulkApprovalResult bulkApprove(List<String> workflowIds, String approverId, String notes) {
        if (StringUtils.isBlank(approverId)) {
            throw AppException.invalidInput("Approver is required");
        }
        Set<String> uniqueIds = new LinkedHashSet<>();
        if (workflowIds != null) {
            for (String workflowId : workflowIds) {
                if (StringUtils.isNotBlank(workflowId)) {
                    uniqueIds.add(workflowId.trim());
                }
            }
        }
        if (uniqueIds.isEmpty()) {
            throw AppException.invalidInput("At least one workflow ID is required");
        }
        String reasoning = StringUtils.defaultIfBlank(StringUtils.trimToNull(notes), BULK_APPROVAL_NOTES);
        List<String> approvedIds = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (String workflowId : uniqueIds) {
            try {
                approve(workflowId, approverId, reasoning);
                approvedIds.add(workflowId);
            } catch (AppException ex) {
                failures.put(workflowId, StringUtils.defaultString(ex.getInfo(), ex.getCode()));
                log.warn("Bulk approval skipped workflow. workflowId={}, errorCode={}, error={}",
                        workflowId, ex.getCode(), ex.getInfo());
            }
        }
        log.info("Bulk approval finished. approvedBy={}, requested={}, approved={}, failed={}",
                approverId.trim(), uniqueIds.size(), approvedIds.size(), failures.size());
        return new BulkApprovalResult(approverId.trim(), uniqueIds.size(),
                ImmutableList.copyOf(approvedIds), ImmutableMap.copyOf(failures));
    }

    /**
     * 人工驳回：AWAITING_APPROVAL → REJECTED（终态），原因必填
     */
    public WorkflowEntity reject(String workflowId, String rejectorId, String reason) {
        if (StringUtils.isBlank(reason)) {
            throw AppException.missingReason("Rejection reason is required");
        }
        if (StringUtils.isBlank(rejectorId)) {
            throw AppException.invalidInput("Rejector is required");
        }
        WorkflowEntity workflow = requireWorkflow(workflowId);
        try {
            workflow.reject(rejectorId.trim(), reason.trim());
        } catch (IllegalStateException ex) {
            throw AppException.invalidTransition(ex.getMessage());
        }
        WorkflowEntity rejected = workflowRepository.update(workflow);
        log.info("Workflow rejected. workflowId={}, rejectedBy={}, reason={}",
                rejected.getId(), rejected.getRejectedBy(), rejected.getRejectionReason());
        return rejected;
    }

    private RoutingDecision awaiting(RiskLevelEnum riskLevel, boolean riskDefaulted, String reason) {
        return RoutingDecision.builder()
                .status(WorkflowStatusEnum.AWAITING_APPROVAL)
                .requiresHumanApproval(true)
                .effectiveRiskLevel(riskLevel)
                .riskDefaulted(riskDefaulted)
                .reason(reason)
                .build();
    }

    private WorkflowEntity requireWorkflow(String workflowId) {
        if (StringUtils.isBlank(workflowId)) {
            throw AppException.invalidInput("Workflow ID is required");
        }
        WorkflowEntity workflow = workflowRepository.findById(workflowId);
        if (workflow == null) {
            throw AppException.invalidInput("Workflow not found: " + workflowId);
        }
        return workflow;
    }
}
