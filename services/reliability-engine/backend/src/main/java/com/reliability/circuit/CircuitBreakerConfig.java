package com.reliability.circuit;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 개별 CircuitBreaker 설정
 *
 * @param failureThreshold OPEN 전환 기준 연속 실패 횟수
 * @param recoveryTimeout  OPEN 이후 trial 호출까지 대기 시간
 * @param recordFailure    실패로 집계할 예외 판별 (미집계 예외는 그대로 전파만 됨)
 */
public record CircuitBreakerConfig(
        int failureThreshold,
        Duration recoveryTimeout,
        Predicate<Throwable> recordFailure
) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(60);

    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0: " + failureThreshold);
        }
        if (recoveryTimeout == null || recoveryTimeout.isZero() || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must be positive: " + recoveryTimeout);
        }
        if (recordFailure == null) {
            recordFailure = t -> true;
        }
    }

    public static CircuitBreakerConfig of(int failureThreshold, Duration recoveryTimeout) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, t -> true);
    }

    public static CircuitBreakerConfig ofDefaults() {
        return of(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT);
    }

    /**
     * 지정한 예외 타입(하위 타입 포함)만 실패로 집계
     */
    public CircuitBreakerConfig recordingOnly(Class<? extends Throwable> failureType) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, failureType::isInstance);
    }
}
