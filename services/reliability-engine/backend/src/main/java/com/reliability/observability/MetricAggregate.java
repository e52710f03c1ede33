package com.reliability.observability;

import java.util.List;

/**
 * 구간 집계 결과 (bucket 1개 또는 여러 시간 bucket 합산)
 */
public record MetricAggregate(
        long totalRequests,
        long successfulRequests,
        long errorCount,
        List<Double> latencySamples
) {

    public static MetricAggregate empty() {
        return new MetricAggregate(0, 0, 0, List.of());
    }

    public boolean isEmpty() {
        return totalRequests == 0;
    }

    public double averageLatencyMs() {
        return latencySamples.stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
    }
}
