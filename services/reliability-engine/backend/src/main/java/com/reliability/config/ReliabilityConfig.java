package com.reliability.config;

import com.reliability.circuit.CircuitBreakerConfig;
import com.reliability.circuit.CircuitBreakerRegistry;
import com.reliability.observability.RequestRecorder;
import com.reliability.slo.ErrorBudgetTracker;
import com.reliability.slo.SliEvaluator;
import com.reliability.slo.SloDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * 신뢰성 엔진 구성 요소 생성
 *
 * 전역 싱글톤 대신 여기서 한 번 생성하여 필요한 곳에 주입한다.
 * 핵심 클래스는 Spring 없이도 생성자만으로 테스트 가능하다.
 */
@Slf4j
@Configuration
public class ReliabilityConfig {

    private static final Duration RETENTION_MARGIN = Duration.ofHours(1);
    private static final int DEFAULT_RETENTION_DAYS = 30;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public List<SloDefinition> sloDefinitions(ReliabilityProperties properties) {
        List<SloDefinition> slos = properties.toSloDefinitions();
        slos.forEach(slo -> log.info("SLO configured: key={} {}", slo.key(), slo.description()));
        return slos;
    }

    /**
     * 설정된 breaker 인스턴스를 시작 시점에 미리 등록
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ReliabilityProperties properties, Clock clock) {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(clock);

        properties.getCircuitBreakers().forEach((name, breaker) ->
                registry.circuitBreaker(
                        name,
                        CircuitBreakerConfig.of(breaker.getFailureThreshold(), breaker.getRecoveryTimeout())
                ));

        return registry;
    }

    @Bean
    public RequestRecorder requestRecorder(
            ReliabilityProperties properties,
            List<SloDefinition> sloDefinitions,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        return new RequestRecorder(clock, retention(properties, sloDefinitions), meterRegistry);
    }

    @Bean
    public SliEvaluator sliEvaluator(RequestRecorder requestRecorder, ReliabilityProperties properties) {
        return new SliEvaluator(requestRecorder, properties.getLatencyThresholdMs());
    }

    @Bean
    public ErrorBudgetTracker errorBudgetTracker(
            List<SloDefinition> sloDefinitions,
            ReliabilityProperties properties
    ) {
        return new ErrorBudgetTracker(sloDefinitions, properties.getBudgetCriticalThreshold());
    }

    /**
     * bucket 보관 기간: 명시값 우선, 없으면 가장 긴 SLO window + 1시간
     */
    static Duration retention(ReliabilityProperties properties, List<SloDefinition> sloDefinitions) {
        if (properties.getRecorderRetention() != null) {
            return properties.getRecorderRetention();
        }

        int longestWindow = sloDefinitions.stream()
                .mapToInt(SloDefinition::windowDays)
                .max()
                .orElse(DEFAULT_RETENTION_DAYS);

        return Duration.ofDays(longestWindow).plus(RETENTION_MARGIN);
    }
}
