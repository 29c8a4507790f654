package com.callflow.trigger.http;

import com.callflow.api.dto.ExecutionStepDTO;
import com.callflow.api.dto.WorkflowApproveRequestDTO;
import com.callflow.api.dto.WorkflowBulkApproveRequestDTO;
import com.callflow.api.dto.WorkflowBulkApproveResponseDTO;
import com.callflow.api.dto.WorkflowDetailDTO;
import com.callflow.api.dto.WorkflowExecutionResultDTO;
import com.callflow.api.dto.WorkflowFailRequestDTO;
import com.callflow.api.dto.WorkflowRejectRequestDTO;
import com.callflow.api.response.Response;
import com.callflow.trigger.application.command.WorkflowActionCommandService;
import com.callflow.trigger.application.query.WorkflowQueryService;
import com.callflow.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 工作流审批与执行 API。
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowActionController {

    private final WorkflowActionCommandService workflowActionCommandService;
    private final WorkflowQueryService workflowQueryService;

    public WorkflowActionController(WorkflowActionCommandService workflowActionCommandService,
                                    WorkflowQueryService workflowQueryService) {
        this.workflowActionCommandService = workflowActionCommandService;
        this.workflowQueryService = workflowQueryService;
    }

    @GetMapping("/{id}")
    public Response<WorkflowDetailDTO> getWorkflow(@PathVariable("id") String workflowId) {
        return success(workflowQueryService.getWorkflow(workflowId));
    }

    @GetMapping("/{id}/steps")
    public Response<List<ExecutionStepDTO>> listSteps(@PathVariable("id") String workflowId) {
        return success(workflowQueryService.listSteps(workflowId));
    }

    @PostMapping("/{id}/approve")
    public Response<WorkflowDetailDTO> approve(@PathVariable("id") String workflowId,
                                               @RequestBody WorkflowApproveRequestDTO request) {
        return success(workflowActionCommandService.approve(workflowId,
                request == null ? null : request.getApprovedBy(),
                request == null ? null : request.getReasoning()));
    }

    @PostMapping("/approve/bulk")
    public Response<WorkflowBulkApproveResponseDTO> bulkApprove(@RequestBody WorkflowBulkApproveRequestDTO request) {
        return success(workflowActionCommandService.bulkApprove(
                request == null ? null : request.getWorkflowIds(),
                request == null ? null : request.getApprovedBy(),
                request == null ? null : request.getNotes()));
    }

    @PostMapping("/{id}/reject")
    public Response<WorkflowDetailDTO> reject(@PathVariable("id") String workflowId,
                                              @RequestBody WorkflowRejectRequestDTO request) {
        return success(workflowActionCommandService.reject(workflowId,
                request == null ? null : request.getRejectedBy(),
                request == null ? null : request.getReason()));
    }

    @PostMapping("/{id}/steps/{stepNumber}/execute")
    public Response<ExecutionStepDTO> executeStep(@PathVariable("id") String workflowId,
                                                  @PathVariable("stepNumber") Integer stepNumber) {
        return success(workflowActionCommandService.executeStep(workflowId, stepNumber));
    }

    @PostMapping("/{id}/execute")
    public Response<WorkflowExecutionResultDTO> execute(@PathVariable("id") String workflowId) {
        return success(workflowActionCommandService.executeWorkflow(workflowId));
    }

    @PostMapping("/{id}/fail")
    public Response<WorkflowDetailDTO> markFailed(@PathVariable("id") String workflowId,
                                                  @RequestBody WorkflowFailRequestDTO request) {
        return success(workflowActionCommandService.markFailed(workflowId,
                request == null ? null : request.getFailedBy(),
                request == null ? null : request.getReason()));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
