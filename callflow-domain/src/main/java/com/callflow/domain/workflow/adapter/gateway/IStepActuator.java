package com.callflow.domain.workflow.adapter.gateway;

import com.callflow.domain.workflow.model.entity.ExecutionStepEntity;

import java.util.Map;

/**
 * 步骤执行器：按工具类型把步骤派发到外部系统。
 * 执行失败时抛出异常，由调用方记录为步骤错误。
 */
public interface IStepActuator {

    /**
     * 执行步骤并返回结果载荷
     */
    Map<String, Object> execute(ExecutionStepEntity step);
}
