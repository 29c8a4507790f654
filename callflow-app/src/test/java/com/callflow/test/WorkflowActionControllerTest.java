package com.callflow.test;

import com.callflow.domain.workflow.model.valobj.RoutingContext;
import com.callflow.domain.workflow.service.ApprovalGateDomainService;
import com.callflow.domain.workflow.service.ExecutionTrackerDomainService;
import com.callflow.infrastructure.execution.SimulatedStepActuator;
import com.callflow.test.support.PipelineTestContext;
import com.callflow.test.support.WorkflowFixtures;
import com.callflow.trigger.application.command.WorkflowActionCommandService;
import com.callflow.trigger.application.common.WorkflowDetailViewAssembler;
import com.callflow.trigger.application.query.WorkflowQueryService;
import com.callflow.trigger.http.GlobalApiExceptionHandler;
import com.callflow.trigger.http.WorkflowActionController;
import com.callflow.types.enums.RiskLevelEnum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class WorkflowActionControllerTest {

    private PipelineTestContext context;

    @BeforeEach
    public void setUp() {
        context = new PipelineTestContext();
        context.workflowRepository.save(WorkflowFixtures.pendingWorkflow("WF_1", RiskLevelEnum.MEDIUM,
                WorkflowFixtures.step("Update CRM record", "crm"),
                WorkflowFixtures.step("Send summary email", "email")));
    }

    @AfterEach
    public void tearDown() {
        context.close();
    }

    @Test
    public void shouldApproveAndExecuteStepsInOrder() throws Exception {
        MockMvc mockMvc = buildMockMvc();

        mockMvc.perform(get("/api/v1/workflows/{id}", "WF_1"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.status").value("awaiting_approval"))
                .andExpect(jsonPath("$.data.risk_level").value("medium"))
                .andExpect(jsonPath("$.data.requires_human_approval").value(true));

        mockMvc.perform(post("/api/v1/workflows/{id}/approve", "WF_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved_by\":\"sup_1\",\"reasoning\":\"verified with borrower\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.status").value("approved"))
                .andExpect(jsonPath("$.data.approved_by").value("sup_1"))
                .andExpect(jsonPath("$.data.execution_steps.length()").value(2))
                .andExpect(jsonPath("$.data.execution_steps[0].status").value("pending"));

        mockMvc.perform(post("/api/v1/workflows/{id}/steps/{stepNumber}/execute", "WF_1", 2))
                .andExpect(jsonPath("$.code").value("0003"));

        mockMvc.perform(post("/api/v1/workflows/{id}/steps/{stepNumber}/execute", "WF_1", 1))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.status").value("executed"))
                .andExpect(jsonPath("$.data.tool_needed").value("crm"))
                .andExpect(jsonPath("$.data.attempt_count").value(1));

        mockMvc.perform(post("/api/v1/workflows/{id}/execute", "WF_1"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.status").value("executed"))
                .andExpect(jsonPath("$.data.total_steps").value(2))
                .andExpect(jsonPath("$.data.executed_steps").value(2));

        mockMvc.perform(get("/api/v1/workflows/{id}/steps", "WF_1"))
                .andExpect(jsonPath("$.data[1].status").value("executed"))
                .andExpect(jsonPath("$.data[1].result.adapter").value("email"));
    }

    @Test
    public void shouldRequireReasonToReject() throws Exception {
        MockMvc mockMvc = buildMockMvc();

        mockMvc.perform(post("/api/v1/workflows/{id}/reject", "WF_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rejected_by\":\"sup_1\",\"reason\":\"  \"}"))
                .andExpect(jsonPath("$.code").value("0004"));

        mockMvc.perform(post("/api/v1/workflows/{id}/reject", "WF_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rejected_by\":\"sup_1\",\"reason\":\"Borrower declined follow-up\"}"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.status").value("rejected"))
                .andExpect(jsonPath("$.data.rejection_reason").value("Borrower declined follow-up"));

        mockMvc.perform(post("/api/v1/workflows/{id}/approve", "WF_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved_by\":\"sup_2\"}"))
                .andExpect(jsonPath("$.code").value("0003"));
    }

    @Test
    public void shouldStopAtFailedStepAndAllowMarkingWorkflowFailed() throws Exception {
        SimulatedStepActuator simulated = new SimulatedStepActuator();
        context.stepActuator = step -> {
            if ("crm".equals(step.getToolNeeded())) {
                throw new IllegalStateException("CRM unavailable");
            }
            return simulated.execute(step);
        };
        MockMvc mockMvc = buildMockMvc();
        mockMvc.perform(post("/api/v1/workflows/{id}/approve", "WF_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approved_by\":\"sup_1\"}"))
                .andExpect(jsonPath("$.code").value("0000"));

        mockMvc.perform(post("/api/v1/workflows/{id}/execute", "WF_1"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.status").value("approved"))
                .andExpect(jsonPath("$.data.executed_steps").value(0))
                .andExpect(jsonPath("$.data.failed_step").value(1));

        mockMvc.perform(get("/api/v1/workflows/{id}/steps", "WF_1"))
                .andExpect(jsonPath("$.data[0].status").value("error"))
                .andExpect(jsonPath("$.data[1].status").value("pending"));

        mockMvc.perform(post("/api/v1/workflows/{id}/fail", "WF_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"failed_by\":\"ops_1\",\"reason\":\"CRM outage\"}"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.status").value("failed"))
                .andExpect(jsonPath("$.data.failed_by").value("ops_1"));
    }

    @Test
    public void shouldReturnIllegalParameterForUnknownWorkflow() throws Exception {
        buildMockMvc().perform(get("/api/v1/workflows/{id}", "WF_MISSING"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0002"));
    }

    @Test
    public void shouldBulkApproveAndIsolateFailures() throws Exception {
        context.workflowRepository.save(WorkflowFixtures.pendingWorkflow("WF_2", RiskLevelEnum.HIGH));
        context.workflowRepository.save(WorkflowFixtures.pendingWorkflow("WF_3", RiskLevelEnum.LOW));
        ApprovalGateDomainService approvalGate = context.approvalGate();
        approvalGate.applyRouting("WF_2", RoutingContext.of(false));
        approvalGate.applyRouting("WF_3", RoutingContext.of(true));
        MockMvc mockMvc = buildMockMvc();

        mockMvc.perform(post("/api/v1/workflows/approve/bulk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workflow_ids\":[\"WF_1\",\"WF_2\",\"WF_3\",\"WF_MISSING\",\"WF_1\",\" \"],"
                                + "\"approved_by\":\"sup_1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.total_requested").value(4))
                .andExpect(jsonPath("$.data.approved_count").value(2))
                .andExpect(jsonPath("$.data.failed_count").value(2))
                .andExpect(jsonPath("$.data.approved_by").value("sup_1"))
                .andExpect(jsonPath("$.data.approved_ids[0]").value("WF_1"))
                .andExpect(jsonPath("$.data.approved_ids[1]").value("WF_2"))
                .andExpect(jsonPath("$.data.failures.WF_3").exists())
                .andExpect(jsonPath("$.data.failures.WF_MISSING").value("Workflow not found: WF_MISSING"));

        mockMvc.perform(get("/api/v1/workflows/{id}", "WF_2"))
                .andExpect(jsonPath("$.data.status").value("approved"))
                .andExpect(jsonPath("$.data.approval_reasoning").value("Bulk approval"));
        mockMvc.perform(get("/api/v1/workflows/{id}", "WF_3"))
                .andExpect(jsonPath("$.data.status").value("auto_approved"));
    }

    @Test
    public void shouldRejectBulkApproveWithoutApproverOrIds() throws Exception {
        MockMvc mockMvc = buildMockMvc();

        mockMvc.perform(post("/api/v1/workflows/approve/bulk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workflow_ids\":[\"WF_1\"]}"))
                .andExpect(jsonPath("$.code").value("0002"));
        mockMvc.perform(post("/api/v1/workflows/approve/bulk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workflow_ids\":[],\"approved_by\":\"sup_1\"}"))
                .andExpect(jsonPath("$.code").value("0002"));
        mockMvc.perform(get("/api/v1/workflows/{id}", "WF_1"))
                .andExpect(jsonPath("$.data.status").value("awaiting_approval"));
    }

    private MockMvc buildMockMvc() {
        ExecutionTrackerDomainService executionTracker = context.executionTracker();
        ApprovalGateDomainService approvalGate = new ApprovalGateDomainService(context.workflowRepository, executionTracker);
        approvalGate.applyRouting("WF_1", RoutingContext.of(false));
        WorkflowDetailViewAssembler assembler = new WorkflowDetailViewAssembler(context.executionStepRepository);
        WorkflowActionController controller = new WorkflowActionController(
                new WorkflowActionCommandService(approvalGate, executionTracker, assembler, context.pipelineWorker,
                        10000L, false),
                new WorkflowQueryService(context.workflowRepository, executionTracker, assembler));
        return MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }
}
