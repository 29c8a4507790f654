package com.callflow.test;

import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.domain.workflow.model.valobj.RoutingContext;
import com.callflow.domain.workflow.service.ApprovalGateDomainService;
import com.callflow.test.support.PipelineTestContext;
import com.callflow.test.support.WorkflowFixtures;
import com.callflow.trigger.application.common.WorkflowDetailViewAssembler;
import com.callflow.trigger.application.query.ExecutionHierarchyQueryService;
import com.callflow.trigger.application.query.ExecutionStatisticsQueryService;
import com.callflow.trigger.http.ExecutionQueryController;
import com.callflow.trigger.http.GlobalApiExceptionHandler;
import com.callflow.types.enums.RiskLevelEnum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;

public class ExecutionQueryControllerTest {

    private PipelineTestContext context;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        context = new PipelineTestContext();
        LocalDateTime now = LocalDateTime.now();
        saveWorkflow("WF_A", RiskLevelEnum.MEDIUM, now.minusMinutes(2));
        saveWorkflow("WF_B", RiskLevelEnum.LOW, now.minusMinutes(1));
        saveWorkflow("WF_C", RiskLevelEnum.HIGH, now);

        ApprovalGateDomainService approvalGate = context.approvalGate();
        approvalGate.applyRouting("WF_A", RoutingContext.of(false));
        approvalGate.applyRouting("WF_B", RoutingContext.of(true));
        approvalGate.approve("WF_A", "sup_1", "reviewed");

        ExecutionHierarchyQueryService queryService = new ExecutionHierarchyQueryService(context.workflowRepository,
                context.executionStepRepository, new WorkflowDetailViewAssembler(context.executionStepRepository));
        ExecutionStatisticsQueryService statisticsService = new ExecutionStatisticsQueryService(context.workflowRepository,
                context.executionStepRepository);
        this.mockMvc = MockMvcBuilders.standaloneSetup(new ExecutionQueryController(queryService, statisticsService))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @AfterEach
    public void tearDown() {
        context.close();
    }

    @Test
    public void shouldListNewestFirstWithNestedSteps() throws Exception {
        mockMvc.perform(get("/api/v1/executions/hierarchical"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.length()").value(3))
                .andExpect(jsonPath("$.data[0].workflow_id").value("WF_C"))
                .andExpect(jsonPath("$.data[0].status").value("pending_assessment"))
                .andExpect(jsonPath("$.data[1].workflow_id").value("WF_B"))
                .andExpect(jsonPath("$.data[1].status").value("auto_approved"))
                .andExpect(jsonPath("$.data[2].workflow_id").value("WF_A"))
                .andExpect(jsonPath("$.data[2].execution_steps.length()").value(1))
                .andExpect(jsonPath("$.data[2].execution_steps[0].tool_needed").value("crm"));
    }

    @Test
    public void shouldFilterByStatusAndApplyLimit() throws Exception {
        mockMvc.perform(get("/api/v1/executions/hierarchical").param("status", "approved"))
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].workflow_id").value("WF_A"))
                .andExpect(jsonPath("$.data[0].approved_by").value("sup_1"));

        mockMvc.perform(get("/api/v1/executions/hierarchical").param("limit", "1"))
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].workflow_id").value("WF_C"));
    }

    @Test
    public void shouldRejectInvalidStatusOrLimit() throws Exception {
        mockMvc.perform(get("/api/v1/executions/hierarchical").param("status", "archived"))
                .andExpect(jsonPath("$.code").value("0002"));
        mockMvc.perform(get("/api/v1/executions/hierarchical").param("limit", "0"))
                .andExpect(jsonPath("$.code").value("0002"));
        mockMvc.perform(get("/api/v1/executions/hierarchical").param("limit", "many"))
                .andExpect(jsonPath("$.code").value("0002"));
    }

    @Test
    public void shouldCountWorkflowsAndStepsByStatus() throws Exception {
        saveWorkflow("WF_D", RiskLevelEnum.HIGH, LocalDateTime.now());
        ApprovalGateDomainService approvalGate = context.approvalGate();
        approvalGate.applyRouting("WF_D", RoutingContext.of(false));
        approvalGate.reject("WF_D", "sup_2", "Duplicate request");

        mockMvc.perform(get("/api/v1/executions/statistics"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.total_workflows").value(4))
                .andExpect(jsonPath("$.data.workflows_by_status.pending_assessment").value(1))
                .andExpect(jsonPath("$.data.workflows_by_status.auto_approved").value(1))
                .andExpect(jsonPath("$.data.workflows_by_status.approved").value(1))
                .andExpect(jsonPath("$.data.workflows_by_status.rejected").value(1))
                .andExpect(jsonPath("$.data.workflows_by_status.executed").value(0))
                .andExpect(jsonPath("$.data.workflows_by_risk_level.high").value(2))
                .andExpect(jsonPath("$.data.workflows_by_risk_level.low").value(1))
                .andExpect(jsonPath("$.data.workflows_by_risk_level.unknown").value(0))
                .andExpect(jsonPath("$.data.total_steps").value(1))
                .andExpect(jsonPath("$.data.steps_by_status.pending").value(1))
                .andExpect(jsonPath("$.data.steps_by_status.error").value(0))
                .andExpect(jsonPath("$.data.pending_approvals").value(0))
                .andExpect(jsonPath("$.data.human_approved").value(1))
                .andExpect(jsonPath("$.data.human_rejected").value(1))
                .andExpect(jsonPath("$.data.approval_rate").value(0.5))
                .andExpect(jsonPath("$.data.avg_approval_minutes").value(2.0));
    }

    private void saveWorkflow(String id, RiskLevelEnum riskLevel, LocalDateTime createdAt) {
        WorkflowEntity workflow = WorkflowFixtures.pendingWorkflow(id, riskLevel,
                WorkflowFixtures.step("Update CRM record", "crm"));
        workflow.setCreatedAt(createdAt);
        workflow.setUpdatedAt(createdAt);
        context.workflowRepository.save(workflow);
    }
}
