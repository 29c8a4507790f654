package com.callflow.trigger.application.command;

import com.callflow.api.dto.PlanSummaryDTO;
import com.callflow.domain.planning.adapter.repository.IActionPlanRepository;
import com.callflow.domain.planning.model.entity.ActionPlanEntity;
import com.callflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * 计划级审批用例：只记录审批人与审批时间，不改变工作流状态。
 */
@Slf4j
@Service
public class PlanApprovalCommandService {

    private final IActionPlanRepository actionPlanRepository;

    public PlanApprovalCommandService(IActionPlanRepository actionPlanRepository) {
        this.actionPlanRepository = actionPlanRepository;
    }

    public PlanSummaryDTO approve(String planId, String approvedBy) {
        if (StringUtils.isBlank(planId)) {
            throw AppException.invalidInput("planId 不能为空");
        }
        if (StringUtils.isBlank(approvedBy)) {
            throw AppException.invalidInput("approved_by 不能为空");
        }
        ActionPlanEntity plan = actionPlanRepository.findById(planId.trim());
        if (plan == null) {
            throw AppException.invalidInput("计划不存在: " + planId);
        }
        try {
            plan.recordApproval(approvedBy.trim());
        } catch (IllegalStateException ex) {
            throw AppException.invalidTransition(ex.getMessage());
        }
        ActionPlanEntity updated = actionPlanRepository.update(plan);
        log.info("Plan approved. planId={}, approvedBy={}", updated.getId(), updated.getApprovedBy());
        return toDTO(updated);
    }

    private PlanSummaryDTO toDTO(ActionPlanEntity plan) {
        PlanSummaryDTO dto = new PlanSummaryDTO();
        dto.setPlanId(plan.getId());
        dto.setAnalysisId(plan.getAnalysisId());
        dto.setTranscriptId(plan.getTranscriptId());
        dto.setRunId(plan.getRunId());
        dto.setRiskLevel(plan.getRiskLevel() == null ? null : plan.getRiskLevel().getCode());
        dto.setApprovalRoute(plan.getApprovalRoute());
        dto.setAutoExecutable(plan.getAutoExecutable());
        dto.setQueueStatus(plan.getQueueStatus());
        dto.setApprovedBy(plan.getApprovedBy());
        dto.setApprovedAt(plan.getApprovedAt());
        return dto;
    }
}
