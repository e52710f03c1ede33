package com.reliability.logging;

public final class LogEvent {

    private LogEvent() {
        // 인스턴스 생성 방지
    }

    /** CircuitBreaker 생성/등록 */
    public static final String CIRCUIT_REGISTERED = "CIRCUIT_REGISTERED";

    /** CircuitBreaker 상태가 OPEN으로 전환됨 */
    public static final String CIRCUIT_OPENED = "CIRCUIT_OPENED";

    /** recoveryTimeout 경과 후 trial 진입 */
    public static final String CIRCUIT_HALF_OPEN = "CIRCUIT_HALF_OPEN";

    /** trial 성공으로 정상 복귀 */
    public static final String CIRCUIT_CLOSED = "CIRCUIT_CLOSED";

    /** OPEN 상태로 호출 거부 */
    public static final String CIRCUIT_REJECTED = "CIRCUIT_REJECTED";

    /** 실패 집계 대상이 아닌 예외 */
    public static final String CIRCUIT_IGNORED_ERROR = "CIRCUIT_IGNORED_ERROR";

    /** 거부된 호출을 fallback 결과로 대체 */
    public static final String FALLBACK = "FALLBACK";

    /** 응답 코드 기준 CIRCUIT_OPEN (503) */
    public static final String CIRCUIT_OPEN = "CIRCUIT_OPEN";

    /** SLO 평가 결과 alert 발생 */
    public static final String SLO_ALERT = "SLO_ALERT";

    /** 보관 기간이 지난 metric bucket 제거 */
    public static final String BUCKET_EVICTED = "BUCKET_EVICTED";

    /** 비즈니스 예외(ApiException) 발생 */
    public static final String BUSINESS_EXCEPTION = "BUSINESS_EXCEPTION";

    /** 예상하지 못한 시스템 예외 */
    public static final String UNHANDLED_EXCEPTION = "UNHANDLED_EXCEPTION";

}
