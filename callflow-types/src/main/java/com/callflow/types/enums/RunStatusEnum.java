package com.callflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 流水线运行状态枚举
 *
 * @author callflow
 * @since 2026-10-01
 */
public enum RunStatusEnum {

    /**
     * 已创建 - 批次已受理，尚未开始处理
     */
    STARTED("started"),

    /**
     * 运行中
     */
    RUNNING("running"),

    /**
     * 已完成 - 所有通话记录处理结束（允许部分失败）
     */
    COMPLETED("completed"),

    /**
     * 失败 - 编排器自身无法启动
     */
    FAILED("failed");

    private final String code;

    RunStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static RunStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (RunStatusEnum status : RunStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code) || status.name().equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status code: " + code);
    }
}
