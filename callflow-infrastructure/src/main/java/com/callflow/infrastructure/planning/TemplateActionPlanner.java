package com.callflow.infrastructure.planning;

import com.callflow.domain.analysis.model.entity.AnalysisEntity;
import com.callflow.domain.analysis.model.valobj.RiskAssessment;
import com.callflow.domain.planning.adapter.gateway.IActionPlanner;
import com.callflow.domain.planning.model.entity.ActionPlanEntity;
import com.callflow.domain.planning.model.valobj.ActionItem;
import com.callflow.domain.planning.model.valobj.RolePlan;
import com.callflow.domain.workflow.model.valobj.StepDefinition;
import com.callflow.types.enums.RiskLevelEnum;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * 模板化行动计划生成器：按分析意图拼装四角色子计划。
 * 涉及资金、合规的行动项自带风险等级，其余行动项继承计划级风险。
 *
 * @author callflow
 * @since 2026-10-01
 */
@Component
public class TemplateActionPlanner implements IActionPlanner {

    @Override
    public ActionPlanEntity plan(AnalysisEntity analysis, RiskAssessment assessment) {
        String intent = analysis.getIntent() == null ? "general_inquiry" : analysis.getIntent();
        RiskLevelEnum planRisk = assessment.getRiskLevel();

        ActionPlanEntity plan = new ActionPlanEntity();
        plan.setId("PLAN_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase(Locale.ROOT));
        plan.setAnalysisId(analysis.getId());
        plan.setTranscriptId(analysis.getTranscriptId());
        plan.setBorrowerPlan(borrowerPlan(intent));
        plan.setAdvisorPlan(advisorPlan(intent));
        plan.setSupervisorPlan(supervisorPlan(intent, planRisk));
        plan.setLeadershipPlan(leadershipPlan(intent));
        plan.setRiskLevel(planRisk);
        plan.setApprovalRoute(assessment.getApprovalRoute());
        plan.setAutoExecutable(planRisk == RiskLevelEnum.LOW);
        plan.setQueueStatus("pending");
        LocalDateTime now = LocalDateTime.now();
        plan.setCreatedAt(now);
        plan.setUpdatedAt(now);
        return plan;
    }

    private RolePlan borrowerPlan(String intent) {
        List<ActionItem> items = new ArrayList<>();
        items.add(item("Send call summary email to borrower", "normal", null,
                step("Draft call summary", "Summarize agreed next steps", "email", "Summary lists every commitment"),
                step("Send summary email", "Deliver to borrower's email of record", "email", "Delivery receipt recorded")));
        switch (intent) {
            case "hardship_assistance" -> items.add(item("Send hardship program disclosure", "high", RiskLevelEnum.HIGH,
                    step("Check hardship eligibility", "Query hardship program rules", "hardship_api", "Eligibility decision returned"),
                    step("Generate disclosure", "Prepare regulatory disclosure package", "disclosure", "All required fields populated"),
                    step("Compliance review", "Validate disclosure timing and content", "compliance_api", "No regulatory flags")));
            case "refinance_inquiry" -> items.add(item("Provide refinance rate quote", "normal", RiskLevelEnum.MEDIUM,
                    step("Price refinance options", "Fetch current rate sheet", "pricing_api", "Quote returned"),
                    step("Prepare quote document", "Render quote for borrower", "document_api", "Document generated")));
            default -> {
            }
        }
        return RolePlan.builder().summary("Borrower follow-up for " + intent).actionItems(items).build();
    }

    private RolePlan advisorPlan(String intent) {
        List<ActionItem> items = new ArrayList<>();
        items.add(item("Log call notes in CRM", "normal", RiskLevelEnum.LOW,
                step("Update CRM record", "Record intent " + intent + " and outcome", "crm", "CRM interaction saved")));
        items.add(item("Schedule follow-up call", "normal", null));
        return RolePlan.builder().summary("Advisor tasks").actionItems(items).build();
    }

    private RolePlan supervisorPlan(String intent, RiskLevelEnum planRisk) {
        List<ActionItem> items = new ArrayList<>();
        if ("complaint".equals(intent) || planRisk == RiskLevelEnum.HIGH) {
            items.add(item("Escalate call for supervisor callback", "high", RiskLevelEnum.MEDIUM,
                    step("Create escalation task", "Assign to on-duty supervisor", "task", "Task assigned"),
                    step("Flag account", "Mark account for escalation", "crm", "Flag visible on account")));
        }
        items.add(item("Review call for coaching opportunities", "low", RiskLevelEnum.LOW,
                step("Assign coaching module", "Pick module matching call topic", "training", "Module assigned")));
        return RolePlan.builder().summary("Supervisor review").actionItems(items).build();
    }

    private RolePlan leadershipPlan(String intent) {
        List<ActionItem> items = new ArrayList<>();
        items.add(item("Track " + intent + " trend in weekly report", "low", RiskLevelEnum.LOW));
        return RolePlan.builder().summary("Portfolio insight").actionItems(items).build();
    }

    private ActionItem item(String action, String priority, RiskLevelEnum riskLevel, StepDefinition... steps) {
        return ActionItem.builder()
                .action(action)
                .priority(priority)
                .riskLevel(riskLevel)
                .steps(new ArrayList<>(List.of(steps)))
                .build();
    }

    private StepDefinition step(String action, String details, String tool, String validationCriteria) {
        return StepDefinition.builder()
                .action(action)
                .details(details)
                .toolNeeded(tool)
                .validationCriteria(validationCriteria)
                .build();
    }
}
