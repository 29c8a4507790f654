package com.callflow.infrastructure.repository.planning;

import com.callflow.domain.planning.adapter.repository.IActionPlanRepository;
import com.callflow.domain.planning.model.entity.ActionPlanEntity;
import com.callflow.domain.planning.model.valobj.RolePlan;
import com.callflow.infrastructure.dao.ActionPlanDao;
import com.callflow.infrastructure.dao.po.ActionPlanPO;
import com.callflow.infrastructure.util.JsonCodec;
import com.callflow.types.exception.AppException;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 行动计划仓储实现类，四个角色子计划以 JSON 存储，更新带乐观锁。
 *
 * @author callflow
 * @since 2026-10-01
 */
@Repository
public class ActionPlanRepositoryImpl implements IActionPlanRepository {

    private final ActionPlanDao actionPlanDao;
    private final JsonCodec jsonCodec;

    public ActionPlanRepositoryImpl(ActionPlanDao actionPlanDao, JsonCodec jsonCodec) {
        this.actionPlanDao = actionPlanDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public ActionPlanEntity save(ActionPlanEntity entity) {
        entity.validate();
        ActionPlanPO po = toPO(entity);
        if (actionPlanDao.insert(po) == 0) {
            throw AppException.invalidInput("Plan already exists: " + entity.getId());
        }
        return toEntity(actionPlanDao.selectByKey(entity.getId()));
    }

    @Override
    public ActionPlanEntity update(ActionPlanEntity entity) {
        entity.validate();
        if (entity.getVersion() == null) {
            throw new IllegalStateException("Version cannot be null for Plan update: " + entity.getId());
        }
        ActionPlanPO po = toPO(entity);
        if (actionPlanDao.updateWithVersion(po) == 0) {
            throw AppException.invalidTransition("Optimistic lock failed for Plan: " + entity.getId());
        }
        return toEntity(actionPlanDao.selectByKey(entity.getId()));
    }

    @Override
    public ActionPlanEntity findById(String id) {
        return toEntity(actionPlanDao.selectByKey(id));
    }

    @Override
    public ActionPlanEntity findByAnalysisId(String analysisId) {
        return toEntity(actionPlanDao.selectByAnalysisId(analysisId));
    }

    @Override
    public List<ActionPlanEntity> findAll() {
        return actionPlanDao.selectAll().stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private ActionPlanEntity toEntity(ActionPlanPO po) {
        if (po == null) {
            return null;
        }
        ActionPlanEntity entity = new ActionPlanEntity();
        entity.setId(po.getId());
        entity.setAnalysisId(po.getAnalysisId());
        entity.setTranscriptId(po.getTranscriptId());
        entity.setRunId(po.getRunId());
        entity.setBorrowerPlan(jsonCodec.readValue(po.getBorrowerPlan(), RolePlan.class));
        entity.setAdvisorPlan(jsonCodec.readValue(po.getAdvisorPlan(), RolePlan.class));
        entity.setSupervisorPlan(jsonCodec.readValue(po.getSupervisorPlan(), RolePlan.class));
        entity.setLeadershipPlan(jsonCodec.readValue(po.getLeadershipPlan(), RolePlan.class));
        entity.setRiskLevel(po.getRiskLevel());
        entity.setApprovalRoute(po.getApprovalRoute());
        entity.setAutoExecutable(po.getAutoExecutable());
        entity.setQueueStatus(po.getQueueStatus());
        entity.setApprovedBy(po.getApprovedBy());
        entity.setApprovedAt(po.getApprovedAt());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private ActionPlanPO toPO(ActionPlanEntity entity) {
        return ActionPlanPO.builder()
                .id(entity.getId())
                .analysisId(entity.getAnalysisId())
                .transcriptId(entity.getTranscriptId())
                .runId(entity.getRunId())
                .borrowerPlan(jsonCodec.writeValue(entity.getBorrowerPlan()))
                .advisorPlan(jsonCodec.writeValue(entity.getAdvisorPlan()))
                .supervisorPlan(jsonCodec.writeValue(entity.getSupervisorPlan()))
                .leadershipPlan(jsonCodec.writeValue(entity.getLeadershipPlan()))
                .riskLevel(entity.getRiskLevel())
                .approvalRoute(entity.getApprovalRoute())
                .autoExecutable(entity.getAutoExecutable())
                .queueStatus(entity.getQueueStatus())
                .approvedBy(entity.getApprovedBy())
                .approvedAt(entity.getApprovedAt())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
