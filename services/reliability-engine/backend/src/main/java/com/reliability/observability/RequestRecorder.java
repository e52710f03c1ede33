package com.reliability.observability;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.reliability.logging.LogEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * 요청 결과를 시간(hour) 단위 bucket으로 집계
 *
 * - record 1회당 (endpoint, hour) + ("all", hour) 두 bucket 갱신
 * - status 200 ~ 399 성공, 그 외 전부 실패
 * - 입력값 검증 없음 (음수 latency 등도 그대로 집계)
 * - bucket은 생성 후 retention 경과 시 제거 (Caffeine expireAfterWrite)
 */
@Slf4j
public class RequestRecorder {

    public static final String ALL_SCOPE = "all";
    public static final String UNKNOWN_ENDPOINT = "unknown";

    private final Clock clock;
    private final Cache<BucketKey, MetricBucket> buckets;

    private final Counter successCounter;
    private final Counter errorCounter;

    public RequestRecorder(Clock clock, Duration retention, MeterRegistry meterRegistry) {
        this(clock, retention, Ticker.systemTicker(), meterRegistry);
    }

    public RequestRecorder(Clock clock, Duration retention, Ticker ticker, MeterRegistry meterRegistry) {
        this.clock = clock;
        this.buckets = Caffeine.newBuilder()
                .expireAfterWrite(retention)
                .ticker(ticker)
                // 정리 작업을 호출 스레드에서 바로 수행 (별도 스레드풀 불필요)
                .executor(Runnable::run)
                .removalListener((BucketKey key, MetricBucket bucket, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED) {
                        log.debug("event={} scope={} hour={}", LogEvent.BUCKET_EVICTED, key.scope(), key.hour());
                    }
                })
                .build();

        this.successCounter = Counter.builder("reliability.requests.recorded")
                .description("Recorded request outcomes")
                .tag("outcome", "success")
                .register(meterRegistry);
        this.errorCounter = Counter.builder("reliability.requests.recorded")
                .description("Recorded request outcomes")
                .tag("outcome", "error")
                .register(meterRegistry);

        log.info("RequestRecorder configured: retention={}", retention);
    }

    public void record(String endpoint, int statusCode, double latencyMs) {
        record(endpoint, statusCode, latencyMs, clock.instant());
    }

    public void record(String endpoint, int statusCode, double latencyMs, Instant timestamp) {
        String scope = endpoint == null || endpoint.isBlank() ? UNKNOWN_ENDPOINT : endpoint;
        Instant hour = hourOf(timestamp);
        boolean success = isSuccess(statusCode);

        bucketFor(scope, hour).add(success, latencyMs);

        // endpoint 이름이 "all"이면 같은 bucket을 두 번 세지 않는다
        if (!ALL_SCOPE.equals(scope)) {
            bucketFor(ALL_SCOPE, hour).add(success, latencyMs);
        }

        if (success) {
            successCounter.increment();
        } else {
            errorCounter.increment();
        }
    }

    /**
     * [start, end] 구간의 시간 bucket 합산
     * - hourOf(start)부터 end까지 1시간씩 순회
     * - 구간 내 bucket이 없으면 0 집계 반환
     */
    public MetricAggregate aggregate(String scope, Instant start, Instant end) {
        long total = 0;
        long successful = 0;
        long errors = 0;
        List<Double> samples = new ArrayList<>();

        for (Instant hour = hourOf(start); !hour.isAfter(end); hour = hour.plus(1, ChronoUnit.HOURS)) {
            MetricBucket bucket = buckets.getIfPresent(new BucketKey(scope, hour));
            if (bucket == null) {
                continue;
            }

            MetricAggregate snapshot = bucket.snapshot();
            total += snapshot.totalRequests();
            successful += snapshot.successfulRequests();
            errors += snapshot.errorCount();
            samples.addAll(snapshot.latencySamples());
        }

        if (total == 0 && samples.isEmpty()) {
            return MetricAggregate.empty();
        }
        return new MetricAggregate(total, successful, errors, samples);
    }

    /**
     * [start, end] 구간의 건수만 합산 (latencySamples는 항상 비어 있음)
     * - availability / error-rate처럼 건수만 필요한 SLI용
     */
    public MetricAggregate aggregateCounts(String scope, Instant start, Instant end) {
        long total = 0;
        long successful = 0;
        long errors = 0;

        for (Instant hour = hourOf(start); !hour.isAfter(end); hour = hour.plus(1, ChronoUnit.HOURS)) {
            MetricBucket bucket = buckets.getIfPresent(new BucketKey(scope, hour));
            if (bucket == null) {
                continue;
            }

            MetricAggregate counts = bucket.countSnapshot();
            total += counts.totalRequests();
            successful += counts.successfulRequests();
            errors += counts.errorCount();
        }

        if (total == 0) {
            return MetricAggregate.empty();
        }
        return new MetricAggregate(total, successful, errors, List.of());
    }

    /**
     * 단일 bucket 스냅샷 (없으면 empty)
     */
    public MetricAggregate bucket(String scope, Instant timestamp) {
        MetricBucket bucket = buckets.getIfPresent(new BucketKey(scope, hourOf(timestamp)));
        return bucket == null ? MetricAggregate.empty() : bucket.snapshot();
    }

    public long bucketCount() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    /**
     * 보관 기간이 지난 bucket 즉시 정리
     */
    public void evictExpired() {
        buckets.cleanUp();
    }

    static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 400;
    }

    static Instant hourOf(Instant timestamp) {
        return timestamp.truncatedTo(ChronoUnit.HOURS);
    }

    private MetricBucket bucketFor(String scope, Instant hour) {
        return buckets.get(new BucketKey(scope, hour), key -> new MetricBucket());
    }
}
