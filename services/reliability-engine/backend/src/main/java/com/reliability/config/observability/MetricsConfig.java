package com.reliability.config.observability;

import com.reliability.circuit.CircuitBreakerRegistry;
import com.reliability.observability.CircuitBreakerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 관측 메트릭 정의
 * - 요청 집계 Counter는 RequestRecorder, SLI Gauge는 ReliabilityReportService에서 등록
 * - CircuitBreaker 상태/전환/거부 메트릭은 MeterBinder로 바인딩
 */
@Configuration
public class MetricsConfig {

    /**
     * 모든 메트릭에 공통 tag 부여
     * Grafana에서 서비스 단위 필터링 가능
     */
    @Bean
    MeterRegistryCustomizer<MeterRegistry> metricsCommonTags(
            @Value("${spring.application.name}") String applicationName) {
        return registry -> registry.config()
                .commonTags("service", applicationName);
    }

    /**
     * breaker 이름별 state gauge + transition/rejected counter
     * label은 breaker 이름만 두어 cardinality를 breaker 수로 제한
     */
    @Bean
    public CircuitBreakerMetrics circuitBreakerMetrics(CircuitBreakerRegistry circuitBreakerRegistry) {
        return new CircuitBreakerMetrics(circuitBreakerRegistry);
    }
}
