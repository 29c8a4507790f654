package com.callflow.trigger.http;

import com.callflow.api.dto.TranscriptCreateRequestDTO;
import com.callflow.api.dto.TranscriptDTO;
import com.callflow.api.response.Response;
import com.callflow.trigger.application.command.TranscriptCommandService;
import com.callflow.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 通话记录写入与查询 API。
 */
@RestController
@RequestMapping("/api/v1/transcripts")
public class TranscriptController {

    private final TranscriptCommandService transcriptCommandService;

    public TranscriptController(TranscriptCommandService transcriptCommandService) {
        this.transcriptCommandService = transcriptCommandService;
    }

    @PostMapping
    public Response<TranscriptDTO> create(@RequestBody TranscriptCreateRequestDTO request) {
        return success(transcriptCommandService.create(request));
    }

    @GetMapping("/{id}")
    public Response<TranscriptDTO> get(@PathVariable("id") String transcriptId) {
        return success(transcriptCommandService.get(transcriptId));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
