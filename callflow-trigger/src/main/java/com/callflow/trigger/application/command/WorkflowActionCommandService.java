package com.callflow.trigger.application.command;

import com.callflow.api.dto.ExecutionStepDTO;
import com.callflow.api.dto.WorkflowBulkApproveResponseDTO;
import com.callflow.api.dto.WorkflowDetailDTO;
import com.callflow.api.dto.WorkflowExecutionResultDTO;
import com.callflow.domain.workflow.model.entity.ExecutionStepEntity;
import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.domain.workflow.model.valobj.BulkApprovalResult;
import com.callflow.domain.workflow.model.valobj.WorkflowExecutionResult;
import com.callflow.domain.workflow.service.ApprovalGateDomainService;
import com.callflow.domain.workflow.service.ExecutionTrackerDomainService;
import com.callflow.trigger.application.common.WorkflowDetailViewAssembler;
import com.callflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 工作流写用例：人工审批（含批量）、驳回、逐步执行、整体执行与失败标记。
 */
@Slf4j
@Service
public class WorkflowActionCommandService {

    private final ApprovalGateDomainService approvalGateDomainService;
    private final ExecutionTrackerDomainService executionTrackerDomainService;
    private final WorkflowDetailViewAssembler workflowDetailViewAssembler;
    private final Executor pipelineWorker;
    private final long actuatorTimeoutMs;
    private final boolean executeOnApprove;

    public WorkflowActionCommandService(ApprovalGateDomainService approvalGateDomainService,
                                        ExecutionTrackerDomainService executionTrackerDomainService,
                                        WorkflowDetailViewAssembler workflowDetailViewAssembler,
                                        @Qualifier("pipelineWorker") Executor pipelineWorker,
                                        @Value("${callflow.pipeline.actuator-timeout-ms:10000}") long actuatorTimeoutMs,
                                        @Value("${callflow.approval.execute-on-approve:false}") boolean executeOnApprove) {
        this.approvalGateDomainService = approvalGateDomainService;
        this.executionTrackerDomainService = executionTrackerDomainService;
        this.workflowDetailViewAssembler = workflowDetailViewAssembler;
        this.pipelineWorker = pipelineWorker;
        this.actuatorTimeoutMs = actuatorTimeoutMs > 0 ? actuatorTimeoutMs : 10000L;
        this.executeOnApprove = executeOnApprove;
    }

    public WorkflowDetailDTO approve(String workflowId, String approvedBy, String reasoning) {
        WorkflowEntity approved = approvalGateDomainService.approve(workflowId, approvedBy, reasoning);
        if (executeOnApprove) {
            submitExecution(approved.getId());
        }
        return workflowDetailViewAssembler.toWorkflowDetailDTO(approved);
    }

    public WorkflowBulkApproveResponseDTO bulkApprove(List<String> workflowIds, String approvedBy, String notes) {
        BulkApprovalResult result = approvalGateDomainService.bulkApprove(workflowIds, approvedBy, notes);
        if (executeOnApprove) {
            result.approvedIds().forEach(this::submitExecution);
        }
        return workflowDetailViewAssembler.toBulkApproveResponseDTO(result);
    }

    public WorkflowDetailDTO reject(String workflowId, String rejectedBy, String reason) {
        return workflowDetailViewAssembler.toWorkflowDetailDTO(
                approvalGateDomainService.reject(workflowId, rejectedBy, reason));
    }

    public ExecutionStepDTO executeStep(String workflowId, Integer stepNumber) {
        ExecutionStepEntity step = executionTrackerDomainService.executeStep(workflowId, stepNumber, actuatorTimeoutMs);
        return workflowDetailViewAssembler.toExecutionStepDTO(step);
    }

    public WorkflowExecutionResultDTO executeWorkflow(String workflowId) {
        WorkflowExecutionResult result = executionTrackerDomainService.executeWorkflow(workflowId, actuatorTimeoutMs);
        return workflowDetailViewAssembler.toExecutionResultDTO(result);
    }

    public WorkflowDetailDTO markFailed(String workflowId, String failedBy, String reason) {
        return workflowDetailViewAssembler.toWorkflowDetailDTO(
                executionTrackerDomainService.markWorkflowFailed(workflowId, failedBy, reason));
    }

    private void submitExecution(String workflowId) {
        try {
            pipelineWorker.execute(() -> {
                try {
                    WorkflowExecutionResult result = executionTrackerDomainService.executeWorkflow(workflowId, actuatorTimeoutMs);
                    log.info("Approved workflow executed. workflowId={}, status={}, executedSteps={}/{}",
                            workflowId, result.status(), result.executedSteps(), result.totalSteps());
                } catch (AppException ex) {
                    log.warn("Approved workflow execution failed. workflowId={}, errorCode={}, error={}",
                            workflowId, ex.getCode(), ex.getInfo());
                }
            });
        } catch (RejectedExecutionException ex) {
            log.warn("Approved workflow execution rejected by pipeline worker. workflowId={}", workflowId);
        }
    }
}
