package com.reliability.circuit;

import com.reliability.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerRegistryTest {

    private MutableClock clock;
    private CircuitBreakerRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        registry = new CircuitBreakerRegistry(clock);
    }

    @Test
    void rejectsSecondBreakerWithSameName() {
        registry.register(new CircuitBreaker("database", CircuitBreakerConfig.ofDefaults(), clock));

        assertThatThrownBy(() ->
                registry.register(new CircuitBreaker("database", CircuitBreakerConfig.ofDefaults(), clock)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("database");
    }

    @Test
    void reRegisteringSameInstanceIsNoOp() {
        CircuitBreaker breaker = new CircuitBreaker("database", CircuitBreakerConfig.ofDefaults(), clock);

        registry.register(breaker);
        registry.register(breaker);

        assertThat(registry.all()).containsExactly(breaker);
    }

    @Test
    void circuitBreakerReturnsExistingInstance() {
        CircuitBreaker first = registry.circuitBreaker("database", CircuitBreakerConfig.of(3, Duration.ofSeconds(30)));
        CircuitBreaker second = registry.circuitBreaker("database", CircuitBreakerConfig.ofDefaults());

        assertThat(second).isSameAs(first);
        assertThat(second.getConfig().failureThreshold()).isEqualTo(3);
        assertThat(registry.find("database")).containsSame(first);
        assertThat(registry.find("missing")).isEmpty();
    }

    @Test
    void listsOpenAndStuckOpenBreakers() {
        CircuitBreaker database = registry.circuitBreaker("database", CircuitBreakerConfig.of(1, Duration.ofSeconds(30)));
        CircuitBreaker external = registry.circuitBreaker("external-service", CircuitBreakerConfig.of(1, Duration.ofSeconds(60)));
        registry.circuitBreaker("cache", CircuitBreakerConfig.ofDefaults());

        trip(database);
        trip(external);

        assertThat(registry.listOpen()).containsExactly("database", "external-service");
        assertThat(registry.listCritical()).isEmpty();

        // database: 61s > 2 x 30s, external-service: 61s < 2 x 60s
        clock.advance(Duration.ofSeconds(61));

        assertThat(registry.listCritical()).containsExactly("database");
        assertThat(registry.snapshotAll()).containsOnlyKeys("cache", "database", "external-service");
        assertThat(registry.snapshotAll().get("cache").state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void registrationHookAppliesToExistingAndFutureBreakers() {
        registry.circuitBreaker("database", CircuitBreakerConfig.ofDefaults());

        List<String> seen = new ArrayList<>();
        registry.onRegister(breaker -> seen.add(breaker.getName()));
        registry.circuitBreaker("external-service", CircuitBreakerConfig.ofDefaults());
        registry.circuitBreaker("database", CircuitBreakerConfig.ofDefaults());

        assertThat(seen).containsExactly("database", "external-service");
    }

    @Test
    void hookAddedDuringConcurrentRegistrationRunsOncePerBreaker() throws Exception {
        int breakerCount = 200;
        Map<String, AtomicInteger> applied = new ConcurrentHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 3; t++) {
                int offset = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = offset; i < breakerCount; i += 3) {
                        if (i % 2 == 0) {
                            registry.circuitBreaker("breaker-" + i, CircuitBreakerConfig.ofDefaults());
                        } else {
                            registry.register(new CircuitBreaker("breaker-" + i, CircuitBreakerConfig.ofDefaults(), clock));
                        }
                    }
                    return null;
                }));
            }
            futures.add(executor.submit(() -> {
                start.await();
                registry.onRegister(breaker ->
                        applied.computeIfAbsent(breaker.getName(), name -> new AtomicInteger()).incrementAndGet());
                return null;
            }));

            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(applied).hasSize(breakerCount);
        assertThat(applied.values()).allSatisfy(count -> assertThat(count).hasValue(1));
    }

    private static void trip(CircuitBreaker breaker) {
        assertThatThrownBy(() -> breaker.run(() -> {
            throw new IllegalStateException("down");
        })).isInstanceOf(IllegalStateException.class);
    }
}
