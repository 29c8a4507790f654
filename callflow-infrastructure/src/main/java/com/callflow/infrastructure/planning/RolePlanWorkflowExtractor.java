package com.callflow.infrastructure.planning;

import com.callflow.domain.planning.adapter.gateway.IWorkflowExtractor;
import com.callflow.domain.planning.model.entity.ActionPlanEntity;
import com.callflow.domain.planning.model.valobj.ActionItem;
import com.callflow.domain.planning.model.valobj.RolePlan;
import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.types.enums.WorkflowStatusEnum;
import com.callflow.types.enums.WorkflowTypeEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * 按角色子计划抽取工作流：每个行动项一个工作流。
 * 行动项未给出风险等级时显式继承计划级风险；两者都缺失时保持为空，交由审批闸门按 HIGH 处理。
 *
 * @author callflow
 * @since 2026-10-01
 */
@Component
public class RolePlanWorkflowExtractor implements IWorkflowExtractor {

    @Override
    public List<WorkflowEntity> extract(ActionPlanEntity plan) {
        List<WorkflowEntity> workflows = new ArrayList<>();
        for (WorkflowTypeEnum role : WorkflowTypeEnum.values()) {
            RolePlan rolePlan = plan.rolePlan(role);
            if (rolePlan == null || rolePlan.getActionItems() == null) {
                continue;
            }
            for (ActionItem item : rolePlan.getActionItems()) {
                if (item == null || StringUtils.isBlank(item.getAction())) {
                    continue;
                }
                workflows.add(toWorkflow(plan, role, item));
            }
        }
        return workflows;
    }

    private WorkflowEntity toWorkflow(ActionPlanEntity plan, WorkflowTypeEnum role, ActionItem item) {
        WorkflowEntity workflow = new WorkflowEntity();
        workflow.setId("WF_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase(Locale.ROOT));
        workflow.setPlanId(plan.getId());
        workflow.setAnalysisId(plan.getAnalysisId());
        workflow.setTranscriptId(plan.getTranscriptId());
        workflow.setWorkflowType(role);
        workflow.setRiskLevel(item.getRiskLevel() != null ? item.getRiskLevel() : plan.getRiskLevel());
        workflow.setActionItem(item.getAction().trim());
        workflow.setPriority(item.getPriority());
        workflow.setStepDefinitions(item.getSteps() == null ? new ArrayList<>() : new ArrayList<>(item.getSteps()));
        workflow.setStatus(WorkflowStatusEnum.PENDING_ASSESSMENT);
        return workflow;
    }
}
