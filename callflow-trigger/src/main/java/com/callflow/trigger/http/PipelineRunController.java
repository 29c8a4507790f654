package com.callflow.trigger.http;

import com.callflow.api.dto.RunCreateRequestDTO;
import com.callflow.api.dto.RunCreateResponseDTO;
import com.callflow.api.dto.RunStatusDTO;
import com.callflow.api.response.Response;
import com.callflow.domain.run.model.valobj.RunSnapshot;
import com.callflow.trigger.application.common.RunStatusViewAssembler;
import com.callflow.trigger.application.query.RunStatusQueryService;
import com.callflow.trigger.service.PipelineOrchestratorService;
import com.callflow.types.enums.ResponseCode;
import com.callflow.types.enums.RunStatusEnum;
import com.callflow.types.exception.AppException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 流水线运行 API：创建运行、轮询状态、取消。
 */
@RestController
@RequestMapping("/api/v1/runs")
public class PipelineRunController {

    private final PipelineOrchestratorService pipelineOrchestratorService;
    private final RunStatusQueryService runStatusQueryService;
    private final RunStatusViewAssembler runStatusViewAssembler;

    public PipelineRunController(PipelineOrchestratorService pipelineOrchestratorService,
                                 RunStatusQueryService runStatusQueryService,
                                 RunStatusViewAssembler runStatusViewAssembler) {
        this.pipelineOrchestratorService = pipelineOrchestratorService;
        this.runStatusQueryService = runStatusQueryService;
        this.runStatusViewAssembler = runStatusViewAssembler;
    }

    @PostMapping
    public Response<RunCreateResponseDTO> createRun(@RequestBody RunCreateRequestDTO request) {
        if (request == null) {
            throw AppException.invalidInput("请求体不能为空");
        }
        RunSnapshot snapshot = pipelineOrchestratorService.runPipeline(request.getTranscriptIds(),
                Boolean.TRUE.equals(request.getAutoApprove()),
                request.getStageTimeoutMs(),
                request.getActuatorTimeoutMs());
        RunCreateResponseDTO dto = new RunCreateResponseDTO();
        dto.setRunId(snapshot.getRunId());
        dto.setStatus(snapshot.getStatus().getCode());
        if (snapshot.getStatus() == RunStatusEnum.FAILED) {
            dto.setMessage("No transcript could be resolved, run failed");
        } else {
            dto.setMessage("Pipeline started for " + snapshot.getTranscriptIds().size() + " transcript(s)");
        }
        return success(dto);
    }

    @GetMapping
    public Response<List<RunStatusDTO>> listRuns() {
        return success(runStatusQueryService.listRuns());
    }

    @GetMapping("/{id}/status")
    public Response<RunStatusDTO> getStatus(@PathVariable("id") String runId) {
        return success(runStatusQueryService.getStatus(runId));
    }

    @PostMapping("/{id}/cancel")
    public Response<RunStatusDTO> cancel(@PathVariable("id") String runId) {
        return success(runStatusViewAssembler.toRunStatusDTO(pipelineOrchestratorService.cancelRun(runId)));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
