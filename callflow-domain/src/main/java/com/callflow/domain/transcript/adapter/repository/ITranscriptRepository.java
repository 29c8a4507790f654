package com.callflow.domain.transcript.adapter.repository;

import com.callflow.domain.transcript.model.entity.TranscriptEntity;

import java.util.List;

/**
 * 通话记录仓储接口
 *
 * @author callflow
 * @since 2026-10-01
 */
public interface ITranscriptRepository {

    /**
     * 保存通话记录
     */
    TranscriptEntity save(TranscriptEntity entity);

    /**
     * 根据 ID 查询
     */
    TranscriptEntity findById(String id);

    /**
     * 查询所有通话记录
     */
    List<TranscriptEntity> findAll();

    /**
     * 根据 ID 删除
     */
    boolean deleteById(String id);
}
