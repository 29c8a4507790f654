package com.callflow.infrastructure.repository.workflow;

import com.callflow.domain.workflow.adapter.repository.IWorkflowRepository;
import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.domain.workflow.model.valobj.StepDefinition;
import com.callflow.infrastructure.dao.WorkflowDao;
import com.callflow.infrastructure.dao.po.WorkflowPO;
import com.callflow.infrastructure.util.JsonCodec;
import com.callflow.types.enums.WorkflowStatusEnum;
import com.callflow.types.exception.AppException;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作流仓储实现类。
 * <p>
 * 负责工作流的持久化操作，包括：
 * <ul>
 *   <li>工作流的增删改查（带乐观锁，状态迁移即比较并交换）</li>
 *   <li>按计划、运行、状态查询</li>
 *   <li>步骤定义的 JSON 序列化/反序列化</li>
 * </ul>
 * </p>
 *
 * @author callflow
 * @since 2026-10-01
 */
@Slf4j
@Repository
public class WorkflowRepositoryImpl implements IWorkflowRepository {

    private static final TypeReference<List<StepDefinition>> STEP_DEFINITIONS_REF = new TypeReference<List<StepDefinition>>() {};

    private final WorkflowDao workflowDao;
    private final JsonCodec jsonCodec;

    public WorkflowRepositoryImpl(WorkflowDao workflowDao, JsonCodec jsonCodec) {
        this.workflowDao = workflowDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public WorkflowEntity save(WorkflowEntity entity) {
        entity.validate();
        if (workflowDao.insert(toPO(entity)) == 0) {
            throw AppException.invalidInput("Workflow already exists: " + entity.getId());
        }
        return findById(entity.getId());
    }

    @Override
    public WorkflowEntity update(WorkflowEntity entity) {
        entity.validate();
        Integer oldVersion = entity.getVersion();
        if (oldVersion == null) {
            throw new IllegalStateException("Version cannot be null for Workflow update: " + entity.getId());
        }
        int affected = workflowDao.updateWithVersion(toPO(entity));
        if (affected == 0) {
            log.warn("Workflow optimistic lock conflict. workflowId={}, expectedVersion={}", entity.getId(), oldVersion);
            throw AppException.invalidTransition("Optimistic lock failed for Workflow: " + entity.getId());
        }
        entity.setVersion(oldVersion + 1);
        return findById(entity.getId());
    }

    @Override
    public WorkflowEntity findById(String id) {
        return toEntity(workflowDao.selectByKey(id));
    }

    @Override
    public List<WorkflowEntity> findByPlanId(String planId) {
        return toEntities(workflowDao.selectByPlanId(planId));
    }

    @Override
    public List<WorkflowEntity> findByRunId(String runId) {
        return toEntities(workflowDao.selectByRunId(runId));
    }

    @Override
    public List<WorkflowEntity> findByStatus(WorkflowStatusEnum status) {
        return toEntities(workflowDao.selectByStatus(status));
    }

    @Override
    public List<WorkflowEntity> findAll() {
        return toEntities(workflowDao.selectAll());
    }

    @Override
    public boolean deleteById(String id) {
        return workflowDao.deleteByKey(id) > 0;
    }

    private List<WorkflowEntity> toEntities(List<WorkflowPO> rows) {
        return rows.stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    /**
     * PO 转换为 Entity
     */
    private WorkflowEntity toEntity(WorkflowPO po) {
        if (po == null) {
            return null;
        }
        WorkflowEntity entity = new WorkflowEntity();
        entity.setId(po.getId());
        entity.setPlanId(po.getPlanId());
        entity.setAnalysisId(po.getAnalysisId());
        entity.setTranscriptId(po.getTranscriptId());
        entity.setRunId(po.getRunId());
        entity.setWorkflowType(po.getWorkflowType());
        entity.setRiskLevel(po.getRiskLevel());
        entity.setRiskDefaulted(Boolean.TRUE.equals(po.getRiskDefaulted()));
        entity.setActionItem(po.getActionItem());
        entity.setPriority(po.getPriority());
        List<StepDefinition> definitions = jsonCodec.readValue(po.getStepDefinitions(), STEP_DEFINITIONS_REF);
        entity.setStepDefinitions(definitions == null ? new ArrayList<>() : definitions);
        entity.setStatus(po.getStatus());
        entity.setRequiresHumanApproval(Boolean.TRUE.equals(po.getRequiresHumanApproval()));
        entity.setRoutingReason(po.getRoutingReason());
        entity.setApprovedBy(po.getApprovedBy());
        entity.setApprovedAt(po.getApprovedAt());
        entity.setApprovalReasoning(po.getApprovalReasoning());
        entity.setRejectedBy(po.getRejectedBy());
        entity.setRejectedAt(po.getRejectedAt());
        entity.setRejectionReason(po.getRejectionReason());
        entity.setFailedBy(po.getFailedBy());
        entity.setFailedAt(po.getFailedAt());
        entity.setFailureReason(po.getFailureReason());
        entity.setExecutedAt(po.getExecutedAt());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    /**
     * Entity 转换为 PO
     */
    private WorkflowPO toPO(WorkflowEntity entity) {
        return WorkflowPO.builder()
                .id(entity.getId())
                .planId(entity.getPlanId())
                .analysisId(entity.getAnalysisId())
                .transcriptId(entity.getTranscriptId())
                .runId(entity.getRunId())
                .workflowType(entity.getWorkflowType())
                .riskLevel(entity.getRiskLevel())
                .riskDefaulted(entity.isRiskDefaulted())
                .actionItem(entity.getActionItem())
                .priority(entity.getPriority())
                .stepDefinitions(jsonCodec.writeValue(entity.getStepDefinitions()))
                .status(entity.getStatus())
                .requiresHumanApproval(entity.isRequiresHumanApproval())
                .routingReason(entity.getRoutingReason())
                .approvedBy(entity.getApprovedBy())
                .approvedAt(entity.getApprovedAt())
                .approvalReasoning(entity.getApprovalReasoning())
                .rejectedBy(entity.getRejectedBy())
                .rejectedAt(entity.getRejectedAt())
                .rejectionReason(entity.getRejectionReason())
                .failedBy(entity.getFailedBy())
                .failedAt(entity.getFailedAt())
                .failureReason(entity.getFailureReason())
                .executedAt(entity.getExecutedAt())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
