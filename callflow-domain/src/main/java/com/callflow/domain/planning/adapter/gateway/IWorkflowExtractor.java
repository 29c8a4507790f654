package com.callflow.domain.planning.adapter.gateway;

import com.callflow.domain.planning.model.entity.ActionPlanEntity;
import com.callflow.domain.workflow.model.entity.WorkflowEntity;

import java.util.List;

/**
 * 工作流抽取器：把计划中的行动项拆成独立工作流。
 */
public interface IWorkflowExtractor {

    /**
     * 返回的工作流状态均为 PENDING_ASSESSMENT，尚未持久化。
     */
    List<WorkflowEntity> extract(ActionPlanEntity plan);
}
