package com.callflow.infrastructure.repository.analysis;

import com.callflow.domain.analysis.adapter.repository.IAnalysisRepository;
import com.callflow.domain.analysis.model.entity.AnalysisEntity;
import com.callflow.domain.analysis.model.valobj.RiskScores;
import com.callflow.infrastructure.dao.AnalysisDao;
import com.callflow.infrastructure.dao.po.AnalysisPO;
import com.callflow.infrastructure.util.JsonCodec;
import com.callflow.types.exception.AppException;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 分析结果仓储实现类，风险评分以 JSON 存储。
 *
 * @author callflow
 * @since 2026-10-01
 */
@Repository
public class AnalysisRepositoryImpl implements IAnalysisRepository {

    private final AnalysisDao analysisDao;
    private final JsonCodec jsonCodec;

    public AnalysisRepositoryImpl(AnalysisDao analysisDao, JsonCodec jsonCodec) {
        this.analysisDao = analysisDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public AnalysisEntity save(AnalysisEntity entity) {
        entity.validate();
        AnalysisPO po = toPO(entity);
        if (analysisDao.insert(po) == 0) {
            throw AppException.invalidInput("Analysis already exists: " + entity.getId());
        }
        return toEntity(po);
    }

    @Override
    public AnalysisEntity findById(String id) {
        return toEntity(analysisDao.selectByKey(id));
    }

    @Override
    public List<AnalysisEntity> findByTranscriptId(String transcriptId) {
        return analysisDao.selectByTranscriptId(transcriptId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<AnalysisEntity> findAll() {
        return analysisDao.selectAll().stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public boolean deleteById(String id) {
        return analysisDao.deleteByKey(id) > 0;
    }

    private AnalysisEntity toEntity(AnalysisPO po) {
        if (po == null) {
            return null;
        }
        AnalysisEntity entity = new AnalysisEntity();
        entity.setId(po.getId());
        entity.setTranscriptId(po.getTranscriptId());
        entity.setRunId(po.getRunId());
        entity.setIntent(po.getIntent());
        entity.setSentiment(po.getSentiment());
        entity.setUrgency(po.getUrgency());
        entity.setSummary(po.getSummary());
        entity.setRiskScores(jsonCodec.readValue(po.getRiskScores(), RiskScores.class));
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private AnalysisPO toPO(AnalysisEntity entity) {
        return AnalysisPO.builder()
                .id(entity.getId())
                .transcriptId(entity.getTranscriptId())
                .runId(entity.getRunId())
                .intent(entity.getIntent())
                .sentiment(entity.getSentiment())
                .urgency(entity.getUrgency())
                .summary(entity.getSummary())
                .riskScores(jsonCodec.writeValue(entity.getRiskScores()))
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
