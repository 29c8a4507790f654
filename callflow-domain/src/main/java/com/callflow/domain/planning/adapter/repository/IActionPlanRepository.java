package com.callflow.domain.planning.adapter.repository;

import com.callflow.domain.planning.model.entity.ActionPlanEntity;

import java.util.List;

/**
 * 行动计划仓储接口
 *
 * @author callflow
 * @since 2026-10-01
 */
public interface IActionPlanRepository {

    /**
     * 保存计划
     */
    ActionPlanEntity save(ActionPlanEntity entity);

    /**
     * 更新计划
     */
    ActionPlanEntity update(ActionPlanEntity entity);

    /**
     * 根据 ID 查询
     */
    ActionPlanEntity findById(String id);

    /**
     * 根据分析结果 ID 查询
     */
    ActionPlanEntity findByAnalysisId(String analysisId);

    /**
     * 查询所有计划
     */
    List<ActionPlanEntity> findAll();
}
