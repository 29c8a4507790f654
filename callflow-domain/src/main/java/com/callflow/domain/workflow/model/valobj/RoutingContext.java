package com.callflow.domain.workflow.model.valobj;

/**
 * 路由上下文：运行级自动审批开关与计划级自动执行标记。
 *
 * @param autoApprove        运行是否允许低风险工作流自动审批
 * @param planAutoExecutable 计划是否允许自动执行，null 表示未声明
 */
public record RoutingContext(boolean autoApprove, Boolean planAutoExecutable) {

    public static RoutingContext of(boolean autoApprove) {
        return new RoutingContext(autoApprove, null);
    }

    public boolean planForbidsAutoExecution() {
        return Boolean.FALSE.equals(planAutoExecutable);
    }
}
