package com.callflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工作流受众类型枚举，对应行动计划的四个角色子计划。
 *
 * @author callflow
 * @since 2026-10-01
 */
public enum WorkflowTypeEnum {

    /**
     * 借款人
     */
    BORROWER("borrower"),

    /**
     * 客服顾问
     */
    ADVISOR("advisor"),

    /**
     * 主管
     */
    SUPERVISOR("supervisor"),

    /**
     * 管理层
     */
    LEADERSHIP("leadership");

    private final String code;

    WorkflowTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static WorkflowTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (WorkflowTypeEnum type : WorkflowTypeEnum.values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown workflow type code: " + code);
    }
}
