package com.reliability.config;

import com.reliability.slo.SliType;
import com.reliability.slo.SloDefinition;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * reliability.* 설정 바인딩
 * - 기본값은 application.yml에 정의
 */
@Configuration
@ConfigurationProperties(prefix = "reliability")
@Data
@Validated
public class ReliabilityProperties {

    @Valid
    private List<Slo> slos = new ArrayList<>();

    @Valid
    private Map<String, Breaker> circuitBreakers = new LinkedHashMap<>();

    @Positive
    private double latencyThresholdMs = 200.0;

    // remaining < total * threshold 이면 critical
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double budgetCriticalThreshold = 0.5;

    // 미지정 시 가장 긴 SLO window + 1시간
    private Duration recorderRetention;

    public List<SloDefinition> toSloDefinitions() {
        return slos.stream()
                .map(slo -> new SloDefinition(
                        slo.getKey(),
                        slo.getName(),
                        slo.getSli(),
                        slo.getTarget(),
                        slo.getWindowDays()
                ))
                .toList();
    }

    @Data
    public static class Slo {

        @NotBlank
        private String key;

        private String name;

        @NotNull
        private SliType sli;

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double target;

        @Positive
        private int windowDays = 30;
    }

    @Data
    public static class Breaker {

        @Positive
        private int failureThreshold = 5;

        @NotNull
        private Duration recoveryTimeout = Duration.ofSeconds(60);
    }
}
