package com.callflow.trigger.http;

import com.callflow.api.dto.PlanApproveRequestDTO;
import com.callflow.api.dto.PlanSummaryDTO;
import com.callflow.api.response.Response;
import com.callflow.trigger.application.command.PlanApprovalCommandService;
import com.callflow.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/plans")
public class PlanController {

    private final PlanApprovalCommandService planApprovalCommandService;

    public PlanController(PlanApprovalCommandService planApprovalCommandService) {
        this.planApprovalCommandService = planApprovalCommandService;
    }

    @PostMapping("/{id}/approve")
    public Response<PlanSummaryDTO> approve(@PathVariable("id") String planId,
                                            @RequestBody PlanApproveRequestDTO request) {
        PlanSummaryDTO data = planApprovalCommandService.approve(planId, request == null ? null : request.getApprovedBy());
        return Response.<PlanSummaryDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
