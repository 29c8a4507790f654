package com.callflow.domain.analysis.adapter.repository;

import com.callflow.domain.analysis.model.entity.AnalysisEntity;

import java.util.List;

/**
 * 分析结果仓储接口
 *
 * @author callflow
 * @since 2026-10-01
 */
public interface IAnalysisRepository {

    /**
     * 保存分析结果
     */
    AnalysisEntity save(AnalysisEntity entity);

    /**
     * 根据 ID 查询
     */
    AnalysisEntity findById(String id);

    /**
     * 根据通话记录 ID 查询
     */
    List<AnalysisEntity> findByTranscriptId(String transcriptId);

    /**
     * 查询所有分析结果
     */
    List<AnalysisEntity> findAll();

    /**
     * 根据 ID 删除
     */
    boolean deleteById(String id);
}
