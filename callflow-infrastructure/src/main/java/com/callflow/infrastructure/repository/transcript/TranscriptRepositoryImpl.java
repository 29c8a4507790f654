package com.callflow.infrastructure.repository.transcript;

import com.callflow.domain.transcript.adapter.repository.ITranscriptRepository;
import com.callflow.domain.transcript.model.entity.TranscriptEntity;
import com.callflow.infrastructure.dao.TranscriptDao;
import com.callflow.infrastructure.dao.po.TranscriptPO;
import com.callflow.types.exception.AppException;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 通话记录仓储实现类
 *
 * @author callflow
 * @since 2026-10-01
 */
@Repository
public class TranscriptRepositoryImpl implements ITranscriptRepository {

    private final TranscriptDao transcriptDao;

    public TranscriptRepositoryImpl(TranscriptDao transcriptDao) {
        this.transcriptDao = transcriptDao;
    }

    @Override
    public TranscriptEntity save(TranscriptEntity entity) {
        entity.validate();
        TranscriptPO po = toPO(entity);
        if (transcriptDao.insert(po) == 0) {
            throw AppException.invalidInput("Transcript already exists: " + entity.getId());
        }
        return toEntity(po);
    }

    @Override
    public TranscriptEntity findById(String id) {
        return toEntity(transcriptDao.selectByKey(id));
    }

    @Override
    public List<TranscriptEntity> findAll() {
        return transcriptDao.selectAll().stream()
                .sorted(Comparator.comparing(TranscriptPO::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public boolean deleteById(String id) {
        return transcriptDao.deleteByKey(id) > 0;
    }

    private TranscriptEntity toEntity(TranscriptPO po) {
        if (po == null) {
            return null;
        }
        TranscriptEntity entity = new TranscriptEntity();
        entity.setId(po.getId());
        entity.setCustomerId(po.getCustomerId());
        entity.setAdvisorId(po.getAdvisorId());
        entity.setTopic(po.getTopic());
        entity.setContent(po.getContent());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private TranscriptPO toPO(TranscriptEntity entity) {
        return TranscriptPO.builder()
                .id(entity.getId())
                .customerId(entity.getCustomerId())
                .advisorId(entity.getAdvisorId())
                .topic(entity.getTopic())
                .content(entity.getContent())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
