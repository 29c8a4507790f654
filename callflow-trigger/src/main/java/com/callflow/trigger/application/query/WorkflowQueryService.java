package com.callflow.trigger.application.query;

import com.callflow.api.dto.ExecutionStepDTO;
import com.callflow.api.dto.WorkflowDetailDTO;
import com.callflow.domain.workflow.adapter.repository.IWorkflowRepository;
import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.domain.workflow.service.ExecutionTrackerDomainService;
import com.callflow.trigger.application.common.WorkflowDetailViewAssembler;
import com.callflow.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 工作流读用例。
 */
@Service
public class WorkflowQueryService {

    private final IWorkflowRepository workflowRepository;
    private final ExecutionTrackerDomainService executionTrackerDomainService;
    private final WorkflowDetailViewAssembler workflowDetailViewAssembler;

    public WorkflowQueryService(IWorkflowRepository workflowRepository,
                                ExecutionTrackerDomainService executionTrackerDomainService,
                                WorkflowDetailViewAssembler workflowDetailViewAssembler) {
        this.workflowRepository = workflowRepository;
        this.executionTrackerDomainService = executionTrackerDomainService;
        this.workflowDetailViewAssembler = workflowDetailViewAssembler;
    }

    public WorkflowDetailDTO getWorkflow(String workflowId) {
        return workflowDetailViewAssembler.toWorkflowDetailDTO(requireWorkflow(workflowId));
    }

    public List<ExecutionStepDTO> listSteps(String workflowId) {
        requireWorkflow(workflowId);
        return workflowDetailViewAssembler.toExecutionStepDTOs(executionTrackerDomainService.listSteps(workflowId.trim()));
    }

    private WorkflowEntity requireWorkflow(String workflowId) {
        if (StringUtils.isBlank(workflowId)) {
            throw AppException.invalidInput("workflowId 不能为空");
        }
        WorkflowEntity workflow = workflowRepository.findById(workflowId.trim());
        if (workflow == null) {
            throw AppException.invalidInput("工作流不存在: " + workflowId);
        }
        return workflow;
    }
}
