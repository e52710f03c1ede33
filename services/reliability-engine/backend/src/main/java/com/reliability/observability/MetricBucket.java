package com.reliability.observability;

import java.util.ArrayList;
import java.util.List;

/**
 * 1시간 단위 요청 집계
 * - totalRequests = successfulRequests + errorCount 항상 유지
 * - 같은 bucket 동시 기록은 synchronized로 직렬화
 */
public class MetricBucket {

    private long successfulRequests;
    private long errorCount;
    private final List<Double> latencySamples = new ArrayList<>();

    public synchronized void add(boolean success, double latencyMs) {
        if (success) {
            successfulRequests++;
        } else {
            errorCount++;
        }
        latencySamples.add(latencyMs);
    }

    /**
     * 읽기용 시점 스냅샷
     */
    public synchronized MetricAggregate snapshot() {
        return new MetricAggregate(
                successfulRequests + errorCount,
                successfulRequests,
                errorCount,
                List.copyOf(latencySamples)
        );
    }

    /**
     * 건수만 담은 스냅샷 (latencySamples 복사 없음)
     */
    public synchronized MetricAggregate countSnapshot() {
        return new MetricAggregate(
                successfulRequests + errorCount,
                successfulRequests,
                errorCount,
                List.of()
        );
    }
}
