package com.callflow.trigger.application.query;

import com.callflow.api.dto.ExecutionStatisticsDTO;
import com.callflow.domain.workflow.adapter.repository.IExecutionStepRepository;
import com.callflow.domain.workflow.adapter.repository.IWorkflowRepository;
import com.callflow.domain.workflow.model.entity.ExecutionStepEntity;
import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.types.enums.RiskLevelEnum;
import com.callflow.types.enums.StepStatusEnum;
import com.callflow.types.enums.WorkflowStatusEnum;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 审批与执行统计：按状态统计工作流与步骤，并汇总人工审批情况。
 */
@Service
public class ExecutionStatisticsQueryService {

    private static final String UNKNOWN_RISK = "unknown";

    private final IWorkflowRepository workflowRepository;
    private final IExecutionStepRepository executionStepRepository;

    public ExecutionStatisticsQueryService(IWorkflowRepository workflowRepository,
                                           IExecutionStepRepository executionStepRepository) {
        this.workflowRepository = workflowRepository;
        this.executionStepRepository = executionStepRepository;
    }

    public ExecutionStatisticsDTO getStatistics() {
        Map<String, Integer> workflowsByStatus = new LinkedHashMap<>();
        for (WorkflowStatusEnum status : WorkflowStatusEnum.values()) {
            workflowsByStatus.put(status.getCode(), 0);
        }
        Map<String, Integer> workflowsByRisk = new LinkedHashMap<>();
        for (RiskLevelEnum riskLevel : RiskLevelEnum.values()) {
            workflowsByRisk.put(riskLevel.getCode(), 0);
        }
        workflowsByRisk.put(UNKNOWN_RISK, 0);
        Map<String, Integer> stepsByStatus = new LinkedHashMap<>();
        for (StepStatusEnum status : StepStatusEnum.values()) {
            stepsByStatus.put(status.getCode(), 0);
        }

        List<WorkflowEntity> workflows = workflowRepository.findAll();
        int totalSteps = 0;
        int humanApproved = 0;
        int humanRejected = 0;
        long approvalMinutesTotal = 0L;
        for (WorkflowEntity workflow : workflows) {
            if (workflow.getStatus() != null) {
                workflowsByStatus.merge(workflow.getStatus().getCode(), 1, Integer::sum);
            }
            String riskKey = workflow.getRiskLevel() == null || workflow.isRiskDefaulted()
                    ? UNKNOWN_RISK
                    : workflow.getRiskLevel().getCode();
            workflowsByRisk.merge(riskKey, 1, Integer::sum);
            if (workflow.getApprovedAt() != null) {
                humanApproved++;
                if (workflow.getCreatedAt() != null) {
                    approvalMinutesTotal += Duration.between(workflow.getCreatedAt(), workflow.getApprovedAt()).toMinutes();
                }
            }
            if (workflow.getRejectedAt() != null) {
                humanRejected++;
            }
            for (ExecutionStepEntity step : executionStepRepository.findByWorkflowId(workflow.getId())) {
                totalSteps++;
                if (step.getStatus() != null) {
                    stepsByStatus.merge(step.getStatus().getCode(), 1, Integer::sum);
                }
            }
        }

        ExecutionStatisticsDTO dto = new ExecutionStatisticsDTO();
        dto.setTotalWorkflows(workflows.size());
        dto.setWorkflowsByStatus(workflowsByStatus);
        dto.setWorkflowsByRiskLevel(workflowsByRisk);
        dto.setTotalSteps(totalSteps);
        dto.setStepsByStatus(stepsByStatus);
        dto.setPendingApprovals(workflowsByStatus.get(WorkflowStatusEnum.AWAITING_APPROVAL.getCode()));
        dto.setHumanApproved(humanApproved);
        dto.setHumanRejected(humanRejected);
        int decisions = humanApproved + humanRejected;
        dto.setApprovalRate(decisions == 0 ? 0D : Math.round(humanApproved * 1000D / decisions) / 1000D);
        dto.setAvgApprovalMinutes(humanApproved == 0
                ? null
                : Math.round(approvalMinutesTotal * 100D / humanApproved) / 100D);
        return dto;
    }
}
