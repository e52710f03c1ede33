package com.reliability.slo;

import com.reliability.observability.MetricAggregate;
import com.reliability.observability.RequestRecorder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * RequestRecorder 집계로부터 SLI(%) 계산
 *
 * - 트래픽이 없는 구간은 장애가 아니라 100%로 취급
 * - latency SLI는 percentile 값이 아니라 threshold 미만 요청 비율
 * - freshness SLI는 실제 staleness 계측 전까지 고정값
 */
public class SliEvaluator {

    public static final double DEFAULT_LATENCY_THRESHOLD_MS = 200.0;
    public static final double FRESHNESS_SLI = 99.5;

    private static final double FULL = 100.0;

    private final RequestRecorder requestRecorder;
    private final double latencyThresholdMs;

    public SliEvaluator(RequestRecorder requestRecorder) {
        this(requestRecorder, DEFAULT_LATENCY_THRESHOLD_MS);
    }

    public SliEvaluator(RequestRecorder requestRecorder, double latencyThresholdMs) {
        this.requestRecorder = requestRecorder;
        this.latencyThresholdMs = latencyThresholdMs;
    }

    public double evaluate(SliType type, Instant start, Instant end) {
        return evaluate(type, RequestRecorder.ALL_SCOPE, start, end);
    }

    public double evaluate(SliType type, String scope, Instant start, Instant end) {
        return switch (type) {
            case AVAILABILITY -> availability(scope, start, end);
            case LATENCY -> latency(scope, start, end);
            case ERROR_RATE -> errorRate(scope, start, end);
            case FRESHNESS -> freshness(start, end);
        };
    }

    public double availability(Instant start, Instant end) {
        return availability(RequestRecorder.ALL_SCOPE, start, end);
    }

    /**
     * successfulRequests / totalRequests * 100
     */
    public double availability(String scope, Instant start, Instant end) {
        MetricAggregate aggregate = requestRecorder.aggregateCounts(scope, start, end);

        if (aggregate.totalRequests() == 0) {
            return FULL;
        }
        return (double) aggregate.successfulRequests() / aggregate.totalRequests() * 100;
    }

    public double latency(Instant start, Instant end) {
        return latency(RequestRecorder.ALL_SCOPE, start, end);
    }

    /**
     * latencyThresholdMs 미만 요청 비율
     */
    public double latency(String scope, Instant start, Instant end) {
        List<Double> samples = requestRecorder.aggregate(scope, start, end).latencySamples();

        if (samples.isEmpty()) {
            return FULL;
        }

        long underThreshold = samples.stream()
                .filter(latency -> latency < latencyThresholdMs)
                .count();

        return (double) underThreshold / samples.size() * 100;
    }

    public double errorRate(Instant start, Instant end) {
        return errorRate(RequestRecorder.ALL_SCOPE, start, end);
    }

    /**
     * (totalRequests - errorCount) / totalRequests * 100
     */
    public double errorRate(String scope, Instant start, Instant end) {
        MetricAggregate aggregate = requestRecorder.aggregateCounts(scope, start, end);

        if (aggregate.totalRequests() == 0) {
            return FULL;
        }
        return (double) (aggregate.totalRequests() - aggregate.errorCount()) / aggregate.totalRequests() * 100;
    }

    public double freshness(Instant start, Instant end) {
        return FRESHNESS_SLI;
    }

    /**
     * 구간 latency의 percentile 값 (ms)
     * - SLI가 아니라 참고용 수치 (성능 요약에 사용)
     */
    public double latencyPercentile(String scope, Instant start, Instant end, double percentile) {
        return percentile(requestRecorder.aggregate(scope, start, end).latencySamples(), percentile);
    }

    /**
     * 정렬된 samples[floor(p / 100 * n)] (마지막 index로 clamp)
     * - nearest-rank(ceil(p / 100 * n) - 1)보다 한 칸 위를 고를 수 있다
     *   (n = 20, p = 95 이면 최댓값)
     */
    public static double percentile(List<Double> samples, double percentile) {
        if (samples.isEmpty()) {
            return 0.0;
        }

        List<Double> sorted = new ArrayList<>(samples);
        Collections.sort(sorted);

        int index = (int) (percentile / 100 * sorted.size());
        return sorted.get(Math.max(0, Math.min(index, sorted.size() - 1)));
    }
}
