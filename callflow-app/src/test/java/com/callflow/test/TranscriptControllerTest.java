package com.callflow.test;

import com.callflow.test.support.PipelineTestContext;
import com.callflow.trigger.application.command.TranscriptCommandService;
import com.callflow.trigger.http.GlobalApiExceptionHandler;
import com.callflow.trigger.http.TranscriptController;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class TranscriptControllerTest {

    private PipelineTestContext context;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        context = new PipelineTestContext();
        this.mockMvc = MockMvcBuilders.standaloneSetup(
                        new TranscriptController(new TranscriptCommandService(context.transcriptRepository)))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @AfterEach
    public void tearDown() {
        context.close();
    }

    @Test
    public void shouldStoreAndReadTranscript() throws Exception {
        mockMvc.perform(post("/api/v1/transcripts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transcript_id\":\"TX_100\",\"customer_id\":\"CUST_9\",\"topic\":\"escrow\","
                                + "\"content\":\"Borrower asked about the escrow shortage.\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.transcript_id").value("TX_100"));

        mockMvc.perform(get("/api/v1/transcripts/{id}", "TX_100"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.customer_id").value("CUST_9"))
                .andExpect(jsonPath("$.data.content").value("Borrower asked about the escrow shortage."));
    }

    @Test
    public void shouldGenerateIdWhenAbsent() throws Exception {
        mockMvc.perform(post("/api/v1/transcripts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"Borrower confirmed the payment date.\"}"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.transcript_id").value(startsWith("TX_")));
    }

    @Test
    public void shouldRejectBlankContentAndDuplicateId() throws Exception {
        mockMvc.perform(post("/api/v1/transcripts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transcript_id\":\"TX_1\",\"content\":\" \"}"))
                .andExpect(jsonPath("$.code").value("0002"));

        context.saveTranscript("TX_1", "Existing call.");
        mockMvc.perform(post("/api/v1/transcripts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transcript_id\":\"TX_1\",\"content\":\"Another call.\"}"))
                .andExpect(jsonPath("$.code").value("0002"));

        mockMvc.perform(get("/api/v1/transcripts/{id}", "TX_MISSING"))
                .andExpect(jsonPath("$.code").value("0002"));
    }
}
