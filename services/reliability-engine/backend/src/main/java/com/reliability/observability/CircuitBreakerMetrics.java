package com.reliability.observability;

import com.reliability.circuit.CircuitBreaker;
import com.reliability.circuit.CircuitBreakerListener;
import com.reliability.circuit.CircuitBreakerRegistry;
import com.reliability.circuit.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;

/**
 * CircuitBreakerRegistry → Micrometer 바인딩
 *
 * - reliability.circuit.state       : 0=CLOSED, 1=OPEN, 2=HALF_OPEN
 * - reliability.circuit.transitions : 상태 전환 누적
 * - reliability.circuit.rejected    : OPEN 거부 누적
 *
 * 바인딩 이후 등록되는 breaker에도 자동 적용된다.
 */
@RequiredArgsConstructor
public class CircuitBreakerMetrics implements MeterBinder {

    private final CircuitBreakerRegistry circuitBreakerRegistry;

    @Override
    public void bindTo(MeterRegistry registry) {
        circuitBreakerRegistry.onRegister(breaker -> bind(breaker, registry));
    }

    private void bind(CircuitBreaker breaker, MeterRegistry registry) {
        Gauge.builder("reliability.circuit.state", breaker, b -> b.getCurrentState().ordinal())
                .description("Circuit breaker state (0=CLOSED, 1=OPEN, 2=HALF_OPEN)")
                .tag("name", breaker.getName())
                .register(registry);

        Counter rejected = Counter.builder("reliability.circuit.rejected")
                .description("Calls rejected while the circuit was open")
                .tag("name", breaker.getName())
                .register(registry);

        breaker.addListener(new CircuitBreakerListener() {
            @Override
            public void onStateTransition(CircuitBreaker source, CircuitState from, CircuitState to) {
                Counter.builder("reliability.circuit.transitions")
                        .tag("name", source.getName())
                        .tag("to", to.name())
                        .register(registry)
                        .increment();
            }

            @Override
            public void onCallRejected(CircuitBreaker source) {
                rejected.increment();
            }
        });
    }
}
