package com.reliability.observability;

import com.reliability.circuit.CircuitBreaker;
import com.reliability.circuit.CircuitBreakerConfig;
import com.reliability.circuit.CircuitBreakerRegistry;
import com.reliability.circuit.CircuitOpenException;
import com.reliability.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerMetricsTest {

    @Test
    void exposesStateTransitionsAndRejections() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(clock);
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

        CircuitBreaker database = registry.circuitBreaker("database", CircuitBreakerConfig.of(1, Duration.ofSeconds(30)));
        new CircuitBreakerMetrics(registry).bindTo(meterRegistry);
        // 바인딩 이후 등록된 breaker
        registry.circuitBreaker("external-service", CircuitBreakerConfig.ofDefaults());

        assertThatThrownBy(() -> database.run(() -> {
            throw new IllegalStateException("down");
        })).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> database.run(() -> { })).isInstanceOf(CircuitOpenException.class);

        assertThat(meterRegistry.get("reliability.circuit.state").tag("name", "database").gauge().value())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("reliability.circuit.state").tag("name", "external-service").gauge().value())
                .isEqualTo(0.0);
        assertThat(meterRegistry.get("reliability.circuit.transitions")
                .tag("name", "database").tag("to", "OPEN").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("reliability.circuit.rejected").tag("name", "database").counter().count())
                .isEqualTo(1.0);
    }
}
