package com.callflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 流水线阶段枚举，按推进顺序声明。
 *
 * @author callflow
 * @since 2026-10-01
 */
public enum PipelineStageEnum {

    /**
     * 未开始
     */
    PENDING("pending"),

    /**
     * 分析完成
     */
    ANALYSIS_COMPLETED("analysis_completed"),

    /**
     * 行动计划完成
     */
    PLAN_COMPLETED("plan_completed"),

    /**
     * 工作流抽取与审批路由完成
     */
    WORKFLOWS_COMPLETED("workflows_completed"),

    /**
     * 自动审批工作流执行完成
     */
    EXECUTION_COMPLETED("execution_completed"),

    /**
     * 运行结束
     */
    COMPLETE("complete");

    private final String code;

    PipelineStageEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isAfter(PipelineStageEnum other) {
        return other == null || this.ordinal() > other.ordinal();
    }

    public static PipelineStageEnum earliest(PipelineStageEnum left, PipelineStageEnum right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return left.ordinal() <= right.ordinal() ? left : right;
    }

    public static PipelineStageEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (PipelineStageEnum stage : PipelineStageEnum.values()) {
            if (stage.code.equalsIgnoreCase(code) || stage.name().equalsIgnoreCase(code)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown pipeline stage code: " + code);
    }
}
