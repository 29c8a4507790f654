package com.callflow.trigger.http;

import com.callflow.api.dto.ExecutionStatisticsDTO;
import com.callflow.api.dto.WorkflowDetailDTO;
import com.callflow.api.response.Response;
import com.callflow.trigger.application.query.ExecutionHierarchyQueryService;
import com.callflow.trigger.application.query.ExecutionStatisticsQueryService;
import com.callflow.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 执行层级与统计查询 API。
 */
@RestController
@RequestMapping("/api/v1/executions")
public class ExecutionQueryController {

    private final ExecutionHierarchyQueryService executionHierarchyQueryService;
    private final ExecutionStatisticsQueryService executionStatisticsQueryService;

    public ExecutionQueryController(ExecutionHierarchyQueryService executionHierarchyQueryService,
                                    ExecutionStatisticsQueryService executionStatisticsQueryService) {
        this.executionHierarchyQueryService = executionHierarchyQueryService;
        this.executionStatisticsQueryService = executionStatisticsQueryService;
    }

    @GetMapping("/hierarchical")
    public Response<List<WorkflowDetailDTO>> listHierarchical(@RequestParam(value = "status", required = false) String status,
                                                              @RequestParam(value = "limit", required = false) Integer limit) {
        return Response.<List<WorkflowDetailDTO>>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(executionHierarchyQueryService.listHierarchical(status, limit))
                .build();
    }

    @GetMapping("/statistics")
    public Response<ExecutionStatisticsDTO> statistics() {
        return Response.<ExecutionStatisticsDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(executionStatisticsQueryService.getStatistics())
                .build();
    }
}
