package com.callflow.domain.run.adapter.repository;

import com.callflow.domain.run.model.entity.PipelineRunEntity;

import java.util.List;

/**
 * 流水线运行仓储接口。
 * 运行实体自身保证并发安全，仓储只负责按 ID 保存与查找同一实例。
 *
 * @author callflow
 * @since 2026-10-01
 */
public interface IPipelineRunRepository {

    PipelineRunEntity save(PipelineRunEntity run);

    PipelineRunEntity findById(String runId);

    /**
     * 按创建时间倒序
     */
    List<PipelineRunEntity> findAll();

    boolean deleteById(String runId);
}
