package com.callflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 执行步骤状态枚举
 *
 * @author callflow
 * @since 2026-10-01
 */
public enum StepStatusEnum {

    /**
     * 待执行
     */
    PENDING("pending"),

    /**
     * 执行中
     */
    IN_PROGRESS("in_progress"),

    /**
     * 已执行 - 终态
     */
    EXECUTED("executed"),

    /**
     * 执行失败 - 只能由调用方显式重试
     */
    ERROR("error");

    private final String code;

    StepStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static StepStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (StepStatusEnum status : StepStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code) || status.name().equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown step status code: " + code);
    }
}
