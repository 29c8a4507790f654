package com.callflow.test.support;

import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.domain.workflow.model.valobj.StepDefinition;
import com.callflow.types.enums.RiskLevelEnum;
import com.callflow.types.enums.WorkflowStatusEnum;
import com.callflow.types.enums.WorkflowTypeEnum;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public final class WorkflowFixtures {

    private WorkflowFixtures() {
    }

    public static WorkflowEntity pendingWorkflow(String id, RiskLevelEnum riskLevel, StepDefinition... steps) {
        WorkflowEntity workflow = new WorkflowEntity();
        workflow.setId(id);
        workflow.setPlanId("PLAN_TEST");
        workflow.setAnalysisId("ANALYSIS_TEST");
        workflow.setTranscriptId("TX_TEST");
        workflow.setRunId("RUN_TEST");
        workflow.setWorkflowType(WorkflowTypeEnum.ADVISOR);
        workflow.setRiskLevel(riskLevel);
        workflow.setActionItem("Log call notes in CRM");
        workflow.setPriority("normal");
        workflow.setStepDefinitions(new ArrayList<>(List.of(steps)));
        workflow.setStatus(WorkflowStatusEnum.PENDING_ASSESSMENT);
        workflow.setCreatedAt(LocalDateTime.now());
        workflow.setUpdatedAt(LocalDateTime.now());
        return workflow;
    }

    public static StepDefinition step(String action, String tool) {
        return StepDefinition.builder()
                .action(action)
                .details(action + " details")
                .toolNeeded(tool)
                .validationCriteria(action + " done")
                .build();
    }
}
