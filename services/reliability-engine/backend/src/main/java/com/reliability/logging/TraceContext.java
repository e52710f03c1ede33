package com.reliability.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * 요청 단위 trace_id 관리
 */
public final class TraceContext {

    public static final String TRACE_ID_KEY = "trace_id";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    // 외부 전달 trace_id 허용 길이 (로그 오염 방지)
    private static final int MAX_LENGTH = 64;

    private TraceContext() {
    }

    /**
     * 외부에서 전달된 값이 유효하면 재사용, 아니면 새로 생성
     */
    public static String resolve(String candidate) {
        if (candidate == null || candidate.isBlank() || candidate.length() > MAX_LENGTH) {
            return generate();
        }
        return candidate.trim();
    }

    public static void put(String traceId) {
        MDC.put(TRACE_ID_KEY, traceId);
    }

    public static String current() {
        return MDC.get(TRACE_ID_KEY);
    }

    /**
     * trace_id 제거 (요청 종료 시)
     */
    public static void clear() {
        MDC.remove(TRACE_ID_KEY);
    }

    private static String generate() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
