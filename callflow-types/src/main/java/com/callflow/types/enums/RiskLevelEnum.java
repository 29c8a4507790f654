package com.callflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 风险等级枚举
 *
 * @author callflow
 * @since 2026-10-01
 */
public enum RiskLevelEnum {

    LOW("low"),

    MEDIUM("medium"),

    HIGH("high");

    private final String code;

    RiskLevelEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static RiskLevelEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (RiskLevelEnum level : RiskLevelEnum.values()) {
            if (level.code.equalsIgnoreCase(code) || level.name().equalsIgnoreCase(code)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown risk level code: " + code);
    }

    /**
     * 宽松解析：无法识别时返回 null，由调用方决定兜底策略。
     */
    public static RiskLevelEnum parseOrNull(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        try {
            return fromCode(code.trim());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
