package com.callflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工作流状态枚举
 *
 * @author callflow
 * @since 2026-10-01
 */
public enum WorkflowStatusEnum {

    /**
     * 待评估 - 刚从计划中抽取，尚未经过审批路由
     */
    PENDING_ASSESSMENT("pending_assessment"),

    /**
     * 待审批 - 需要人工审批
     */
    AWAITING_APPROVAL("awaiting_approval"),

    /**
     * 自动审批 - 低风险且运行允许自动审批
     */
    AUTO_APPROVED("auto_approved"),

    /**
     * 已审批 - 人工审批通过，可交由执行跟踪器执行
     */
    APPROVED("approved"),

    /**
     * 已驳回 - 终态
     */
    REJECTED("rejected"),

    /**
     * 已执行 - 所有步骤执行完成，终态
     */
    EXECUTED("executed"),

    /**
     * 已失败 - 调用方在步骤失败后显式标记，终态
     */
    FAILED("failed");

    private final String code;

    WorkflowStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == REJECTED || this == EXECUTED || this == FAILED;
    }

    /**
     * 是否可进入执行阶段
     */
    public boolean isExecutable() {
        return this == AUTO_APPROVED || this == APPROVED;
    }

    public static WorkflowStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (WorkflowStatusEnum status : WorkflowStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code) || status.name().equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown workflow status code: " + code);
    }
}
