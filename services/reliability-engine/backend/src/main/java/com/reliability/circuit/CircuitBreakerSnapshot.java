package com.reliability.circuit;

import java.time.Instant;

/**
 * CircuitBreaker 상태 조회용 읽기 전용 스냅샷
 * - 상태 판단 없이 Raw 값만 담는다
 */
public record CircuitBreakerSnapshot(
        String name,
        CircuitState state,
        int failureCount,
        Instant lastFailureTimestamp,   // 실패 이력 없으면 null
        int failureThreshold,
        long recoveryTimeoutSeconds
) {}
