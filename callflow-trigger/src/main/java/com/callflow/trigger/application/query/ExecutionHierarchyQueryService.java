package com.callflow.trigger.application.query;

import com.callflow.api.dto.WorkflowDetailDTO;
import com.callflow.domain.workflow.adapter.repository.IExecutionStepRepository;
import com.callflow.domain.workflow.adapter.repository.IWorkflowRepository;
import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.trigger.application.common.WorkflowDetailViewAssembler;
import com.callflow.types.enums.WorkflowStatusEnum;
import com.callflow.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 层级执行视图：工作流 → 执行步骤，按创建时间倒序。
 */
@Service
public class ExecutionHierarchyQueryService {

    private static final Comparator<WorkflowEntity> NEWEST_FIRST = Comparator
            .comparing(WorkflowEntity::getCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
            .thenComparing(WorkflowEntity::getId, Comparator.nullsLast(Comparator.<String>reverseOrder()));

    private final IWorkflowRepository workflowRepository;
    private final IExecutionStepRepository executionStepRepository;
    private final WorkflowDetailViewAssembler workflowDetailViewAssembler;

    @Value("${callflow.query.hierarchy-max-limit:200}")
    private int maxLimit = 200;

    public ExecutionHierarchyQueryService(IWorkflowRepository workflowRepository,
                                          IExecutionStepRepository executionStepRepository,
                                          WorkflowDetailViewAssembler workflowDetailViewAssembler) {
        this.workflowRepository = workflowRepository;
        this.executionStepRepository = executionStepRepository;
        this.workflowDetailViewAssembler = workflowDetailViewAssembler;
    }

    public List<WorkflowDetailDTO> listHierarchical(String status, Integer limit) {
        int safeLimit = normalizeLimit(limit);
        List<WorkflowEntity> workflows;
        if (StringUtils.isBlank(status)) {
            workflows = workflowRepository.findAll();
        } else {
            workflows = workflowRepository.findByStatus(parseStatus(status));
        }
        return workflows.stream()
                .sorted(NEWEST_FIRST)
                .limit(safeLimit)
                .map(workflow -> workflowDetailViewAssembler.toWorkflowDetailDTO(workflow,
                        executionStepRepository.findByWorkflowId(workflow.getId())))
                .collect(Collectors.toList());
    }

    private WorkflowStatusEnum parseStatus(String status) {
        try {
            return WorkflowStatusEnum.fromCode(status.trim());
        } catch (IllegalArgumentException ex) {
            throw AppException.invalidInput("status 不合法: " + status);
        }
    }

    private int normalizeLimit(Integer limit) {
        if (limit == null) {
            return 50;
        }
        if (limit <= 0) {
            throw AppException.invalidInput("limit 必须大于 0");
        }
        return Math.min(limit, maxLimit);
    }
}
