package com.reliability.dto;

import java.time.Instant;

/**
 * 최근 1시간 요청 성능 요약 (판단 없이 Raw 값만 반환)
 */
public record PerformanceSummary(
        Instant timestamp,
        String timeRange,
        long requestCount,
        long errorCount,
        double avgLatencyMs,
        double p95LatencyMs
) {}
