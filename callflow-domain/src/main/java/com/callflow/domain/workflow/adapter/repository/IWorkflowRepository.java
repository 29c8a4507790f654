package com.callflow.domain.workflow.adapter.repository;

import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.types.enums.WorkflowStatusEnum;

import java.util.List;

/**
 * 工作流仓储接口
 *
 * @author callflow
 * @since 2026-10-01
 */
public interface IWorkflowRepository {

    /**
     * 保存工作流，版本号初始化为 0
     */
    WorkflowEntity save(WorkflowEntity entity);

    /**
     * 更新工作流（乐观锁）。
     * 存储中的版本号与实体版本号不一致时抛出 INVALID_TRANSITION。
     */
    WorkflowEntity update(WorkflowEntity entity);

    /**
     * 根据 ID 查询，返回副本
     */
    WorkflowEntity findById(String id);

    /**
     * 根据计划 ID 查询
     */
    List<WorkflowEntity> findByPlanId(String planId);

    /**
     * 根据运行 ID 查询
     */
    List<WorkflowEntity> findByRunId(String runId);

    /**
     * 根据状态查询
     */
    List<WorkflowEntity> findByStatus(WorkflowStatusEnum status);

    /**
     * 查询所有工作流
     */
    List<WorkflowEntity> findAll();

    /**
     * 根据 ID 删除
     */
    boolean deleteById(String id);
}
