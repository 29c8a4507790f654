package com.callflow.test;

import com.callflow.api.response.Response;
import com.callflow.trigger.http.GlobalApiExceptionHandler;
import com.callflow.types.enums.ResponseCode;
import com.callflow.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class GlobalApiExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(new ErrorController())
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldPassThroughAppExceptionCode() throws Exception {
        mockMvc.perform(get("/api/test/missing-reason"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.MISSING_REASON.getCode()))
                .andExpect(jsonPath("$.info").value("Rejection reason is required"));
    }

    @Test
    public void shouldMapIllegalStateToInvalidTransition() throws Exception {
        mockMvc.perform(get("/api/test/illegal-state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.INVALID_TRANSITION.getCode()))
                .andExpect(jsonPath("$.info").value("Step is already executed"));
    }

    @Test
    public void shouldHideUnknownExceptionMessage() throws Exception {
        mockMvc.perform(get("/api/test/runtime-error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.UN_ERROR.getCode()))
                .andExpect(jsonPath("$.info").value(ResponseCode.UN_ERROR.getInfo()));
    }

    @Test
    public void shouldHandleTypeMismatchAndMissingParameterAsIllegalParameter() throws Exception {
        mockMvc.perform(get("/api/test/type-error/not-number"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
        mockMvc.perform(get("/api/test/required-param"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldTruncateLongMessages() throws Exception {
        mockMvc.perform(get("/api/test/long-message"))
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()))
                .andExpect(jsonPath("$.info").value(StringUtils.repeat('x', 300)));
    }

    @RestController
    private static class ErrorController {

        @GetMapping("/api/test/missing-reason")
        public Response<Void> missingReason() {
            throw AppException.missingReason("Rejection reason is required");
        }

        @GetMapping("/api/test/illegal-state")
        public Response<Void> illegalState() {
            throw new IllegalStateException("Step is already executed");
        }

        @GetMapping("/api/test/runtime-error")
        public Response<Void> runtimeError() {
            throw new RuntimeException("boom");
        }

        @GetMapping("/api/test/long-message")
        public Response<Void> longMessage() {
            throw AppException.invalidInput(StringUtils.repeat('x', 500));
        }

        @GetMapping("/api/test/type-error/{id}")
        public Response<String> typeError(@PathVariable("id") Long id) {
            return success(String.valueOf(id));
        }

        @GetMapping("/api/test/required-param")
        public Response<String> requiredParam(@RequestParam("status") String status) {
            return success(status);
        }

        private Response<String> success(String data) {
            return Response.<String>builder()
                    .code(ResponseCode.SUCCESS.getCode())
                    .info(ResponseCode.SUCCESS.getInfo())
                    .data(data)
                    .build();
        }
    }
}
