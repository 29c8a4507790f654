package com.callflow.trigger.application.command;

import com.callflow.api.dto.TranscriptCreateRequestDTO;
import com.callflow.api.dto.TranscriptDTO;
import com.callflow.domain.transcript.adapter.repository.ITranscriptRepository;
import com.callflow.domain.transcript.model.entity.TranscriptEntity;
import com.callflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * 通话记录写入用例，流水线按 ID 读取这里写入的记录。
 */
@Slf4j
@Service
public class TranscriptCommandService {

    private final ITranscriptRepository transcriptRepository;

    public TranscriptCommandService(ITranscriptRepository transcriptRepository) {
        this.transcriptRepository = transcriptRepository;
    }

    public TranscriptDTO create(TranscriptCreateRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getContent())) {
            throw AppException.invalidInput("content 不能为空");
        }
        String transcriptId = StringUtils.isBlank(request.getTranscriptId())
                ? "TX_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase(Locale.ROOT)
                : request.getTranscriptId().trim();
        if (transcriptRepository.findById(transcriptId) != null) {
            throw AppException.invalidInput("通话记录已存在: " + transcriptId);
        }
        TranscriptEntity entity = new TranscriptEntity();
        entity.setId(transcriptId);
        entity.setCustomerId(StringUtils.trimToNull(request.getCustomerId()));
        entity.setAdvisorId(StringUtils.trimToNull(request.getAdvisorId()));
        entity.setTopic(StringUtils.trimToNull(request.getTopic()));
        entity.setContent(request.getContent());
        entity.setCreatedAt(LocalDateTime.now());
        TranscriptEntity saved = transcriptRepository.save(entity);
        log.info("Transcript stored. transcriptId={}, customerId={}, topic={}",
                saved.getId(), saved.getCustomerId(), saved.getTopic());
        return toDTO(saved);
    }

    public TranscriptDTO get(String transcriptId) {
        if (StringUtils.isBlank(transcriptId)) {
            throw AppException.invalidInput("transcriptId 不能为空");
        }
        TranscriptEntity entity = transcriptRepository.findById(transcriptId.trim());
        if (entity == null) {
            throw AppException.invalidInput("通话记录不存在: " + transcriptId);
        }
        return toDTO(entity);
    }

    private TranscriptDTO toDTO(TranscriptEntity entity) {
        TranscriptDTO dto = new TranscriptDTO();
        dto.setTranscriptId(entity.getId());
        dto.setCustomerId(entity.getCustomerId());
        dto.setAdvisorId(entity.getAdvisorId());
        dto.setTopic(entity.getTopic());
        dto.setContent(entity.getContent());
        dto.setCreatedAt(entity.getCreatedAt());
        return dto;
    }
}
