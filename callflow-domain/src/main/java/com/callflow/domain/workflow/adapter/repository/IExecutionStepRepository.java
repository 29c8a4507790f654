package com.callflow.domain.workflow.adapter.repository;

import com.callflow.domain.workflow.model.entity.ExecutionStepEntity;

import java.util.List;

/**
 * 执行步骤仓储接口
 *
 * @author callflow
 * @since 2026-10-01
 */
public interface IExecutionStepRepository {

    /**
     * 工作流尚无步骤时整体写入并返回写入结果；已有步骤时不做修改，返回已有步骤。
     */
    List<ExecutionStepEntity> saveAllIfAbsent(String workflowId, List<ExecutionStepEntity> steps);

    /**
     * 更新步骤（乐观锁），版本冲突时抛出 INVALID_TRANSITION
     */
    ExecutionStepEntity update(ExecutionStepEntity step);

    /**
     * 按步骤序号升序返回工作流的全部步骤
     */
    List<ExecutionStepEntity> findByWorkflowId(String workflowId);

    /**
     * 查询单个步骤
     */
    ExecutionStepEntity findByWorkflowIdAndStepNumber(String workflowId, Integer stepNumber);

    /**
     * 删除工作流的全部步骤
     */
    boolean deleteByWorkflowId(String workflowId);
}
