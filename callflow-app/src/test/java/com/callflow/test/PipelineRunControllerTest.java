package com.callflow.test;

import com.callflow.test.support.PipelineTestContext;
import com.callflow.trigger.application.common.RunStatusViewAssembler;
import com.callflow.trigger.application.query.RunStatusQueryService;
import com.callflow.trigger.http.GlobalApiExceptionHandler;
import com.callflow.trigger.http.PipelineRunController;
import com.callflow.trigger.service.PipelineOrchestratorService;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class PipelineRunControllerTest {

    private PipelineTestContext context;
    private PipelineOrchestratorService orchestrator;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        context = new PipelineTestContext();
        context.saveTranscript("TX_1", "Borrower asked when the next statement will arrive.");
        orchestrator = context.orchestrator();
        RunStatusViewAssembler assembler = new RunStatusViewAssembler();
        PipelineRunController controller = new PipelineRunController(orchestrator,
                new RunStatusQueryService(orchestrator, assembler), assembler);
        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @AfterEach
    public void tearDown() {
        context.close();
    }

    @Test
    public void shouldStartRunAndPollUntilCompleted() throws Exception {
        String body = mockMvc.perform(post("/api/v1/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transcript_ids\":[\"TX_1\"],\"auto_approve\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.run_id").isNotEmpty())
                .andExpect(jsonPath("$.data.status").value("started"))
                .andExpect(jsonPath("$.data.message").value("Pipeline started for 1 transcript(s)"))
                .andReturn().getResponse().getContentAsString();
        String runId = JsonPath.read(body, "$.data.run_id");

        orchestrator.awaitRun(runId, Duration.ofSeconds(10));

        mockMvc.perform(get("/api/v1/runs/{id}/status", runId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.status").value("completed"))
                .andExpect(jsonPath("$.data.stage").value("complete"))
                .andExpect(jsonPath("$.data.auto_approve").value(true))
                .andExpect(jsonPath("$.data.summary.total").value(1))
                .andExpect(jsonPath("$.data.summary.successful").value(1))
                .andExpect(jsonPath("$.data.summary.success_rate").value(1.0D))
                .andExpect(jsonPath("$.data.results[0].transcript_id").value("TX_1"))
                .andExpect(jsonPath("$.data.errors").isEmpty());

        mockMvc.perform(get("/api/v1/runs"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data[0].run_id").value(runId));
    }

    @Test
    public void shouldReportFailedRunWhenNothingResolves() throws Exception {
        mockMvc.perform(post("/api/v1/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transcript_ids\":[\"MISSING\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.status").value("failed"))
                .andExpect(jsonPath("$.data.message").value("No transcript could be resolved, run failed"));
    }

    @Test
    public void shouldRejectEmptyTranscriptList() throws Exception {
        mockMvc.perform(post("/api/v1/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transcript_ids\":[]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0002"));
    }

    @Test
    public void shouldRejectUnknownRunAndCancelOfFinishedRun() throws Exception {
        mockMvc.perform(get("/api/v1/runs/{id}/status", "RUN_UNKNOWN"))
                .andExpect(jsonPath("$.code").value("0002"));

        String runId = orchestrator.runPipeline(List.of("TX_1"), false, null, null).getRunId();
        orchestrator.awaitRun(runId, Duration.ofSeconds(10));

        mockMvc.perform(post("/api/v1/runs/{id}/cancel", runId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0003"));
    }
}
