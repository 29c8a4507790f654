package com.callflow.types.exception;

import com.callflow.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 统一承载流水线中的业务异常，包含异常码和异常描述信息。
 * 调用方错误（非法输入、非法状态迁移、缺少原因）与阶段失败均通过此类抛出，
 * 由上层按异常码区分处理。
 * </p>
 *
 * @author callflow
 * @since 2026-10-01
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 5317680961212299217L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    /**
     * 创建包含异常码的 AppException。
     *
     * @param code 异常码
     */
    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    /**
     * 创建包含异常码和原因的 AppException。
     *
     * @param code 异常码
     * @param cause 异常原因
     */
    public AppException(String code, Throwable cause) {
        super(cause == null ? null : cause.getMessage(), cause);
        this.code = code;
        this.info = cause == null ? null : cause.getMessage();
    }

    /**
     * 创建包含异常码和描述信息的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     */
    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    /**
     * 创建包含异常码、描述信息和原因的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    public static AppException invalidInput(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), message);
    }

    public static AppException invalidTransition(String message) {
        return new AppException(ResponseCode.INVALID_TRANSITION.getCode(), message);
    }

    public static AppException missingReason(String message) {
        return new AppException(ResponseCode.MISSING_REASON.getCode(), message);
    }

    public static AppException stageFailure(String message, Throwable cause) {
        return new AppException(ResponseCode.STAGE_FAILURE.getCode(), message, cause);
    }

    /**
     * 判断异常码是否与给定响应码一致。
     */
    public boolean is(ResponseCode responseCode) {
        return responseCode != null && responseCode.getCode().equals(this.code);
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    /**
     * 将异常转换为字符串表示。
     *
     * @return 包含异常码和描述信息的字符串
     */
    @Override
    public String toString() {
        return "com.callflow.types.exception.AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
