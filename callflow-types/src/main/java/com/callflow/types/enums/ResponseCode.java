package com.callflow.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有API响应的响应码和对应描述信息，同时作为流水线错误分类：
 * 非法输入、非法状态迁移、缺少原因、阶段失败、运行取消。
 * </p>
 *
 * @author callflow
 * @since 2026-10-01
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数（InvalidInput） */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 非法状态迁移（InvalidTransition） */
    INVALID_TRANSITION("0003", "非法状态迁移"),

    /** 驳回缺少原因（MissingReason） */
    MISSING_REASON("0004", "缺少原因"),

    /** 阶段执行失败（StageFailure） */
    STAGE_FAILURE("0005", "阶段执行失败"),

    /** 运行已取消 */
    CANCELLED("0006", "运行已取消");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
