package com.voicetutor.types.common;

/**
 * 全局常量定义类。
 *
 * @author voicetutor
 * @since 2026-03-02
 */
public class Constants {

    /** 逗号分隔符 */
    public final static String SPLIT = ",";

    /** 会话 ID 前缀 */
    public final static String SESSION_ID_PREFIX = "S_";

    /** 链路追踪请求头 */
    public final static String HEADER_TRACE_ID = "X-Trace-Id";

    /** 请求 ID 请求头 */
    public final static String HEADER_REQUEST_ID = "X-Request-Id";

    /** MDC 中的 traceId 键 */
    public final static String MDC_TRACE_ID = "traceId";

    /** MDC 中的 requestId 键 */
    public final static String MDC_REQUEST_ID = "requestId";

    /** MDC 中的 sessionId 键 */
    public final static String MDC_SESSION_ID = "sessionId";

}
