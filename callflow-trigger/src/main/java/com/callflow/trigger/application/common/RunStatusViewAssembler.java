package com.callflow.trigger.application.common;

import com.callflow.api.dto.RunErrorDTO;
import com.callflow.api.dto.RunStatusDTO;
import com.callflow.api.dto.RunSummaryDTO;
import com.callflow.api.dto.TranscriptResultDTO;
import com.callflow.domain.run.model.valobj.RunSnapshot;
import com.callflow.domain.run.model.valobj.RunSummary;
import com.callflow.domain.run.model.valobj.TranscriptError;
import com.callflow.domain.run.model.valobj.TranscriptResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 运行快照视图组装器：RunSnapshot → RunStatusDTO。
 */
@Component
public class RunStatusViewAssembler {

    public RunStatusDTO toRunStatusDTO(RunSnapshot snapshot) {
        if (snapshot == null) {
            return null;
        }
        RunStatusDTO dto = new RunStatusDTO();
        dto.setRunId(snapshot.getRunId());
        dto.setStatus(snapshot.getStatus() == null ? null : snapshot.getStatus().getCode());
        dto.setStage(snapshot.getStage() == null ? null : snapshot.getStage().getCode());
        dto.setAutoApprove(snapshot.isAutoApprove());
        dto.setCancelRequested(snapshot.isCancelRequested());
        dto.setTranscriptIds(snapshot.getTranscriptIds() == null
                ? Collections.emptyList() : new ArrayList<>(snapshot.getTranscriptIds()));
        Map<String, String> progress = new LinkedHashMap<>();
        if (snapshot.getProgress() != null) {
            snapshot.getProgress().forEach((transcriptId, stage) -> progress.put(transcriptId, stage.getCode()));
        }
        dto.setProgress(progress);
        dto.setResults(snapshot.getResults() == null ? Collections.emptyList()
                : snapshot.getResults().stream().map(this::toTranscriptResultDTO).collect(Collectors.toList()));
        dto.setErrors(snapshot.getErrors() == null ? Collections.emptyList()
                : snapshot.getErrors().stream().map(this::toRunErrorDTO).collect(Collectors.toList()));
        dto.setSummary(toRunSummaryDTO(snapshot.getSummary()));
        dto.setCreatedAt(snapshot.getCreatedAt());
        dto.setUpdatedAt(snapshot.getUpdatedAt());
        dto.setCompletedAt(snapshot.getCompletedAt());
        return dto;
    }

    private TranscriptResultDTO toTranscriptResultDTO(TranscriptResult result) {
        TranscriptResultDTO dto = new TranscriptResultDTO();
        dto.setTranscriptId(result.getTranscriptId());
        dto.setSuccess(result.isSuccess());
        dto.setStage(result.getStage() == null ? null : result.getStage().getCode());
        dto.setAnalysisId(result.getAnalysisId());
        dto.setPlanId(result.getPlanId());
        dto.setWorkflowCount(result.getWorkflowCount());
        dto.setAutoApprovedCount(result.getAutoApprovedCount());
        dto.setAwaitingApprovalCount(result.getAwaitingApprovalCount());
        dto.setExecutedCount(result.getExecutedCount());
        dto.setFailedCount(result.getFailedCount());
        dto.setWorkflowIds(result.getWorkflowIds() == null
                ? Collections.emptyList() : new ArrayList<>(result.getWorkflowIds()));
        dto.setError(result.getError());
        dto.setFinishedAt(result.getFinishedAt());
        return dto;
    }

    private RunErrorDTO toRunErrorDTO(TranscriptError error) {
        RunErrorDTO dto = new RunErrorDTO();
        dto.setTranscriptId(error.getTranscriptId());
        dto.setError(error.getError());
        dto.setErrorCode(error.getErrorCode());
        dto.setStage(error.getStage());
        dto.setTimestamp(error.getTimestamp());
        return dto;
    }

    private RunSummaryDTO toRunSummaryDTO(RunSummary summary) {
        if (summary == null) {
            return null;
        }
        RunSummaryDTO dto = new RunSummaryDTO();
        dto.setTotal(summary.getTotal());
        dto.setSuccessful(summary.getSuccessful());
        dto.setFailed(summary.getFailed());
        dto.setSuccessRate(summary.getSuccessRate());
        return dto;
    }
}
