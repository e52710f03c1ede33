package com.reliability.observability;

import com.reliability.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class RequestRecorderTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:15:00Z");

    private MutableClock clock;
    private AtomicLong tickerNanos;
    private SimpleMeterRegistry meterRegistry;
    private RequestRecorder recorder;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        tickerNanos = new AtomicLong();
        meterRegistry = new SimpleMeterRegistry();
        recorder = new RequestRecorder(clock, Duration.ofDays(31), tickerNanos::get, meterRegistry);
    }

    @Test
    void updatesEndpointAndAllBuckets() {
        recorder.record("GET /users", 200, 45.0);

        MetricAggregate endpoint = recorder.bucket("GET /users", T0);
        MetricAggregate all = recorder.bucket(RequestRecorder.ALL_SCOPE, T0);

        assertThat(endpoint.totalRequests()).isEqualTo(1);
        assertThat(endpoint.successfulRequests()).isEqualTo(1);
        assertThat(endpoint.latencySamples()).containsExactly(45.0);
        assertThat(all.totalRequests()).isEqualTo(1);
        assertThat(recorder.bucketCount()).isEqualTo(2);
    }

    @Test
    void classifiesOnlyTwoAndThreeHundredsAsSuccess() {
        recorder.record("api", 200, 10);
        recorder.record("api", 302, 10);
        recorder.record("api", 399, 10);
        recorder.record("api", 199, 10);
        recorder.record("api", 404, 10);
        recorder.record("api", 503, 10);

        MetricAggregate bucket = recorder.bucket("api", T0);
        assertThat(bucket.successfulRequests()).isEqualTo(3);
        assertThat(bucket.errorCount()).isEqualTo(3);
        assertThat(bucket.totalRequests()).isEqualTo(bucket.successfulRequests() + bucket.errorCount());
    }

    @Test
    void allEndpointIsCountedOnce() {
        recorder.record(RequestRecorder.ALL_SCOPE, 200, 10);

        assertThat(recorder.bucket(RequestRecorder.ALL_SCOPE, T0).totalRequests()).isEqualTo(1);
        assertThat(recorder.bucketCount()).isEqualTo(1);
    }

    @Test
    void blankEndpointIsRecordedAsUnknown() {
        recorder.record(null, 200, 10);
        recorder.record(" ", 500, 10);

        assertThat(recorder.bucket(RequestRecorder.UNKNOWN_ENDPOINT, T0).totalRequests()).isEqualTo(2);
    }

    @Test
    void aggregatesHourlyBucketsWithinRange() {
        recorder.record("api", 200, 10, T0);
        recorder.record("api", 500, 20, T0.plus(Duration.ofHours(1)));
        recorder.record("api", 200, 30, T0.plus(Duration.ofHours(5)));

        MetricAggregate firstTwoHours = recorder.aggregate("api", T0, T0.plus(Duration.ofHours(1)));
        assertThat(firstTwoHours.totalRequests()).isEqualTo(2);
        assertThat(firstTwoHours.errorCount()).isEqualTo(1);
        assertThat(firstTwoHours.latencySamples()).containsExactlyInAnyOrder(10.0, 20.0);

        MetricAggregate everything = recorder.aggregate("api", T0.minus(Duration.ofDays(1)), T0.plus(Duration.ofDays(1)));
        assertThat(everything.totalRequests()).isEqualTo(3);
        assertThat(everything.averageLatencyMs()).isEqualTo(20.0);
    }

    @Test
    void aggregateIncludesPartialStartHour() {
        recorder.record("api", 200, 10, Instant.parse("2024-05-01T10:05:00Z"));

        MetricAggregate aggregate = recorder.aggregate(
                "api",
                Instant.parse("2024-05-01T10:30:00Z"),
                Instant.parse("2024-05-01T11:30:00Z")
        );

        assertThat(aggregate.totalRequests()).isEqualTo(1);
    }

    @Test
    void emptyRangeReturnsZeroAggregate() {
        MetricAggregate aggregate = recorder.aggregate("api", T0.minus(Duration.ofDays(30)), T0);

        assertThat(aggregate.isEmpty()).isTrue();
        assertThat(aggregate.latencySamples()).isEmpty();
        assertThat(aggregate.averageLatencyMs()).isZero();
    }

    @Test
    void bucketsExpireAfterRetention() {
        recorder.record("api", 200, 10);
        assertThat(recorder.bucketCount()).isEqualTo(2);

        tickerNanos.addAndGet(TimeUnit.DAYS.toNanos(31) + 1);
        recorder.evictExpired();

        assertThat(recorder.bucketCount()).isZero();
        assertThat(recorder.bucket("api", T0).isEmpty()).isTrue();
    }

    @Test
    void countsOutcomesInMeterRegistry() {
        recorder.record("api", 200, 10);
        recorder.record("api", 201, 10);
        recorder.record("api", 500, 10);

        assertThat(meterRegistry.get("reliability.requests.recorded").tag("outcome", "success").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("reliability.requests.recorded").tag("outcome", "error").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void concurrentRecordsIntoSameHourLoseNoUpdates() throws Exception {
        int threads = 8;
        int perThread = 5000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                String endpoint = t % 2 == 0 ? "GET /users" : "GET /orders";
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        recorder.record(endpoint, i % 10 == 0 ? 500 : 200, 5.0, T0);
                    }
                    return null;
                }));
            }

            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        MetricAggregate all = recorder.bucket(RequestRecorder.ALL_SCOPE, T0);
        assertThat(all.totalRequests()).isEqualTo(40_000);
        assertThat(all.successfulRequests()).isEqualTo(36_000);
        assertThat(all.errorCount()).isEqualTo(4_000);
        assertThat(all.latencySamples()).hasSize(40_000);
        assertThat(all.totalRequests()).isEqualTo(all.successfulRequests() + all.errorCount());

        MetricAggregate users = recorder.bucket("GET /users", T0);
        MetricAggregate orders = recorder.bucket("GET /orders", T0);
        assertThat(users.totalRequests()).isEqualTo(20_000);
        assertThat(orders.totalRequests()).isEqualTo(20_000);
        assertThat(users.totalRequests()).isEqualTo(users.successfulRequests() + users.errorCount());
    }

    @Test
    void countAggregationMatchesFullAggregationWithoutSamples() {
        recorder.record("api", 200, 10, T0);
        recorder.record("api", 500, 20, T0.plus(Duration.ofHours(2)));
        recorder.record("api", 302, 30, T0.plus(Duration.ofHours(3)));

        Instant end = T0.plus(Duration.ofHours(3));
        MetricAggregate full = recorder.aggregate("api", T0, end);
        MetricAggregate counts = recorder.aggregateCounts("api", T0, end);

        assertThat(counts.totalRequests()).isEqualTo(full.totalRequests()).isEqualTo(3);
        assertThat(counts.successfulRequests()).isEqualTo(full.successfulRequests());
        assertThat(counts.errorCount()).isEqualTo(full.errorCount());
        assertThat(counts.latencySamples()).isEmpty();
        assertThat(recorder.aggregateCounts("api", T0.minus(Duration.ofDays(2)), T0.minus(Duration.ofDays(1))).isEmpty())
                .isTrue();
    }

    @Test
    void hourOfTruncatesToUtcHour() {
        assertThat(RequestRecorder.hourOf(Instant.parse("2024-05-01T10:59:59.999Z")))
                .isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }
}
