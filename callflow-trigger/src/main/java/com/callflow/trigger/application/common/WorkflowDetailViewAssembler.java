package com.callflow.trigger.application.common;

import com.callflow.api.dto.ExecutionStepDTO;
import com.callflow.api.dto.WorkflowBulkApproveResponseDTO;
import com.callflow.api.dto.WorkflowDetailDTO;
import com.callflow.api.dto.WorkflowExecutionResultDTO;
import com.callflow.domain.workflow.adapter.repository.IExecutionStepRepository;
import com.callflow.domain.workflow.model.entity.ExecutionStepEntity;
import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.domain.workflow.model.valobj.BulkApprovalResult;
import com.callflow.domain.workflow.model.valobj.WorkflowExecutionResult;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作流详情视图组装器：统一 WorkflowDetailDTO 映射与执行步骤加载。
 */
@Component
public class WorkflowDetailViewAssembler {

    private final IExecutionStepRepository executionStepRepository;

    public WorkflowDetailViewAssembler(IExecutionStepRepository executionStepRepository) {
        this.executionStepRepository = executionStepRepository;
    }

    public WorkflowDetailDTO toWorkflowDetailDTO(WorkflowEntity workflow) {
        if (workflow == null) {
            return null;
        }
        return toWorkflowDetailDTO(workflow, executionStepRepository.findByWorkflowId(workflow.getId()));
    }

    public WorkflowDetailDTO toWorkflowDetailDTO(WorkflowEntity workflow, List<ExecutionStepEntity> steps) {
        if (workflow == null) {
            return null;
        }
        WorkflowDetailDTO dto = new WorkflowDetailDTO();
        dto.setWorkflowId(workflow.getId());
        dto.setPlanId(workflow.getPlanId());
        dto.setAnalysisId(workflow.getAnalysisId());
        dto.setTranscriptId(workflow.getTranscriptId());
        dto.setRunId(workflow.getRunId());
        dto.setWorkflowType(workflow.getWorkflowType() == null ? null : workflow.getWorkflowType().getCode());
        dto.setRiskLevel(workflow.getRiskLevel() == null ? null : workflow.getRiskLevel().getCode());
        dto.setRiskDefaulted(workflow.isRiskDefaulted());
        dto.setActionItem(workflow.getActionItem());
        dto.setPriority(workflow.getPriority());
        dto.setStatus(workflow.getStatus() == null ? null : workflow.getStatus().getCode());
        dto.setRequiresHumanApproval(workflow.isRequiresHumanApproval());
        dto.setRoutingReason(workflow.getRoutingReason());
        dto.setApprovedBy(workflow.getApprovedBy());
        dto.setApprovedAt(workflow.getApprovedAt());
        dto.setApprovalReasoning(workflow.getApprovalReasoning());
        dto.setRejectedBy(workflow.getRejectedBy());
        dto.setRejectedAt(workflow.getRejectedAt());
        dto.setRejectionReason(workflow.getRejectionReason());
        dto.setFailedBy(workflow.getFailedBy());
        dto.setFailedAt(workflow.getFailedAt());
        dto.setFailureReason(workflow.getFailureReason());
        dto.setExecutedAt(workflow.getExecutedAt());
        dto.setVersion(workflow.getVersion());
        dto.setCreatedAt(workflow.getCreatedAt());
        dto.setUpdatedAt(workflow.getUpdatedAt());
        dto.setExecutionSteps(toExecutionStepDTOs(steps));
        return dto;
    }

    public List<ExecutionStepDTO> toExecutionStepDTOs(List<ExecutionStepEntity> steps) {
        if (steps == null || steps.isEmpty()) {
            return Collections.emptyList();
        }
        return steps.stream().map(this::toExecutionStepDTO).collect(Collectors.toList());
    }

    public ExecutionStepDTO toExecutionStepDTO(ExecutionStepEntity step) {
        if (step == null) {
            return null;
        }
        ExecutionStepDTO dto = new ExecutionStepDTO();
        dto.setWorkflowId(step.getWorkflowId());
        dto.setStepNumber(step.getStepNumber());
        dto.setAction(step.getAction());
        dto.setDetails(step.getDetails());
        dto.setToolNeeded(step.getToolNeeded());
        dto.setValidationCriteria(step.getValidationCriteria());
        dto.setStatus(step.getStatus() == null ? null : step.getStatus().getCode());
        dto.setResult(step.getResult());
        dto.setErrorMessage(step.getErrorMessage());
        dto.setAttemptCount(step.getAttemptCount());
        dto.setStartedAt(step.getStartedAt());
        dto.setExecutedAt(step.getExecutedAt());
        return dto;
    }

    public WorkflowExecutionResultDTO toExecutionResultDTO(WorkflowExecutionResult result) {
        if (result == null) {
            return null;
        }
        WorkflowExecutionResultDTO dto = new WorkflowExecutionResultDTO();
        dto.setWorkflowId(result.workflowId());
        dto.setStatus(result.status() == null ? null : result.status().getCode());
        dto.setTotalSteps(result.totalSteps());
        dto.setExecutedSteps(result.executedSteps());
        dto.setFailedStep(result.failedStep());
        dto.setError(result.error());
        return dto;
    }

    public WorkflowBulkApproveResponseDTO toBulkApproveResponseDTO(BulkApprovalResult result) {
        WorkflowBulkApproveResponseDTO dto = new WorkflowBulkApproveResponseDTO();
        dto.setApprovedCount(result.approvedCount());
        dto.setFailedCount(result.failedCount());
        dto.setTotalRequested(result.totalRequested());
        dto.setApprovedBy(result.approvedBy());
        dto.setApprovedIds(result.approvedIds());
        dto.setFailures(result.failures());
        return dto;
    }
}
