package com.callflow.trigger.application.query;

import com.callflow.api.dto.RunStatusDTO;
import com.callflow.trigger.application.common.RunStatusViewAssembler;
import com.callflow.trigger.service.PipelineOrchestratorService;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 运行状态读用例，只读取快照，不等待在途任务。
 */
@Service
public class RunStatusQueryService {

    private final PipelineOrchestratorService pipelineOrchestratorService;
    private final RunStatusViewAssembler runStatusViewAssembler;

    public RunStatusQueryService(PipelineOrchestratorService pipelineOrchestratorService,
                                 RunStatusViewAssembler runStatusViewAssembler) {
        this.pipelineOrchestratorService = pipelineOrchestratorService;
        this.runStatusViewAssembler = runStatusViewAssembler;
    }

    public RunStatusDTO getStatus(String runId) {
        return runStatusViewAssembler.toRunStatusDTO(pipelineOrchestratorService.getStatus(runId));
    }

    public List<RunStatusDTO> listRuns() {
        return pipelineOrchestratorService.listRuns().stream()
                .map(runStatusViewAssembler::toRunStatusDTO)
                .collect(Collectors.toList());
    }
}
