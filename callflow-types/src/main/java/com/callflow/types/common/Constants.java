package com.callflow.types.common;

/**
 * 全局常量定义类。
 *
 * @author callflow
 * @since 2026-10-01
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 系统自动操作人 */
    public final static String SYSTEM_ACTOR = "system";

    /** 未声明工具时的默认执行工具 */
    public final static String DEFAULT_TOOL = "task";

    /** MDC：运行 ID */
    public final static String MDC_RUN_ID = "runId";

    /** MDC：通话记录 ID */
    public final static String MDC_TRANSCRIPT_ID = "transcriptId";

}
