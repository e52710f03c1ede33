package com.reliability.service;

import com.reliability.circuit.CircuitBreakerRegistry;
import com.reliability.dto.AlertView;
import com.reliability.dto.AlertsResponse;
import com.reliability.dto.CircuitBreakerSummary;
import com.reliability.dto.OverallStatus;
import com.reliability.dto.PerformanceSummary;
import com.reliability.dto.ReliabilityReportPayload;
import com.reliability.dto.SloResult;
import com.reliability.dto.SloStatus;
import com.reliability.logging.LogEvent;
import com.reliability.observability.MetricAggregate;
import com.reliability.observability.RequestRecorder;
import com.reliability.slo.ErrorBudget;
import com.reliability.slo.ErrorBudgetTracker;
import com.reliability.slo.SliEvaluator;
import com.reliability.slo.SloDefinition;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SLO 평가 + error budget 소모 + breaker 상태를 묶은 통합 리포트
 *
 * evaluate() 호출마다 실패한 SLO의 budget이 누적 소모된다.
 * (조회 API라도 budget 상태를 변경하므로 호출 빈도에 주의)
 */
@Slf4j
@Service
public class ReliabilityReportService {

    private static final Duration PERFORMANCE_RANGE = Duration.ofHours(1);

    private final List<SloDefinition> sloDefinitions;
    private final SliEvaluator sliEvaluator;
    private final ErrorBudgetTracker errorBudgetTracker;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RequestRecorder requestRecorder;
    private final Clock clock;

    // 마지막 평가 SLI 값 (Micrometer gauge 노출용)
    private final Map<String, Double> lastSliValues = new ConcurrentHashMap<>();

    public ReliabilityReportService(
            List<SloDefinition> sloDefinitions,
            SliEvaluator sliEvaluator,
            ErrorBudgetTracker errorBudgetTracker,
            CircuitBreakerRegistry circuitBreakerRegistry,
            RequestRecorder requestRecorder,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.sloDefinitions = List.copyOf(sloDefinitions);
        this.sliEvaluator = sliEvaluator;
        this.errorBudgetTracker = errorBudgetTracker;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.requestRecorder = requestRecorder;
        this.clock = clock;

        for (SloDefinition slo : this.sloDefinitions) {
            Gauge.builder("reliability.sli", lastSliValues, values -> values.getOrDefault(slo.key(), Double.NaN))
                    .description("Last evaluated SLI value (%)")
                    .tag("slo", slo.key())
                    .register(meterRegistry);
        }
    }

    public ReliabilityReportPayload evaluate() {
        return evaluate(clock.instant());
    }

    public ReliabilityReportPayload evaluate(Instant now) {
        Map<String, SloResult> results = evaluateSlos(now);
        List<String> alerts = collectAlerts(results);

        List<String> openCircuits = circuitBreakerRegistry.listOpen();
        List<String> criticalCircuits = circuitBreakerRegistry.listCritical();
        CircuitBreakerSummary breakers = new CircuitBreakerSummary(
                circuitBreakerRegistry.all().size(),
                openCircuits.size(),
                criticalCircuits.size(),
                openCircuits,
                criticalCircuits
        );

        OverallStatus overallStatus = decideOverallStatus(results, breakers);

        if (!alerts.isEmpty()) {
            log.warn(
                    "event={} status={} alerts={} openCircuits={}",
                    LogEvent.SLO_ALERT,
                    overallStatus,
                    alerts.size(),
                    openCircuits
            );
        }

        return new ReliabilityReportPayload(
                now,
                longestWindowDays() + " days",
                results,
                alerts,
                breakers,
                overallStatus,
                recommendations(results)
        );
    }

    /**
     * severity 포함 alert 목록
     * - critical(stuck open) breaker → CRITICAL
     * - open breaker → WARNING
     * - SLO alert → INFO
     */
    public AlertsResponse alerts(Instant now) {
        ReliabilityReportPayload report = evaluate(now);
        List<AlertView> alerts = new ArrayList<>();

        List<String> critical = report.circuitBreakers().criticalCircuits();
        for (String name : report.circuitBreakers().openCircuits()) {
            if (critical.contains(name)) {
                alerts.add(new AlertView("CRITICAL", name, name + " is in CRITICAL state", now));
            } else {
                alerts.add(new AlertView("WARNING", name, name + " is in DEGRADED state", now));
            }
        }

        for (String message : report.alerts()) {
            alerts.add(new AlertView("INFO", "SLO", message, now));
        }

        int criticalCount = (int) alerts.stream().filter(a -> "CRITICAL".equals(a.severity())).count();
        int warningCount = (int) alerts.stream().filter(a -> "WARNING".equals(a.severity())).count();

        return new AlertsResponse(alerts, alerts.size(), criticalCount, warningCount);
    }

    /**
     * 최근 1시간 요청 성능 (budget 소모 없음)
     */
    public PerformanceSummary performance(Instant now) {
        MetricAggregate aggregate = requestRecorder.aggregate(
                RequestRecorder.ALL_SCOPE,
                now.minus(PERFORMANCE_RANGE),
                now
        );

        return new PerformanceSummary(
                now,
                "1 hour",
                aggregate.totalRequests(),
                aggregate.errorCount(),
                aggregate.averageLatencyMs(),
                SliEvaluator.percentile(aggregate.latencySamples(), 95.0)
        );
    }

    private Map<String, SloResult> evaluateSlos(Instant now) {
        Map<String, SloResult> results = new LinkedHashMap<>();

        for (SloDefinition slo : sloDefinitions) {
            Instant start = now.minus(Duration.ofDays(slo.windowDays()));
            double sliValue = sliEvaluator.evaluate(slo.sliType(), start, now);

            double consumed = errorBudgetTracker.consume(slo.key(), sliValue);
            ErrorBudget budget = errorBudgetTracker.budget(slo.key());

            results.put(slo.key(), new SloResult(
                    slo.name(),
                    slo.description(),
                    slo.target(),
                    sliValue,
                    sliValue >= slo.target() ? SloStatus.PASS : SloStatus.FAIL,
                    consumed,
                    budget.remaining(),
                    budget.remainingDays(budget.getBudgetTotal() / slo.windowDays()),
                    errorBudgetTracker.isCritical(slo.key())
            ));

            lastSliValues.put(slo.key(), sliValue);
        }

        return results;
    }

    private static List<String> collectAlerts(Map<String, SloResult> results) {
        List<String> alerts = new ArrayList<>();

        results.forEach((key, result) -> {
            if (result.status() == SloStatus.FAIL) {
                alerts.add(String.format(
                        Locale.ROOT,
                        "SLO VIOLATION: %s - %.2f%% < %.2f%%",
                        key,
                        result.sliValue(),
                        result.target()
                ));
            }
            if (result.critical()) {
                alerts.add(String.format(
                        Locale.ROOT,
                        "ERROR BUDGET CRITICAL: %s - %.2f%% remaining",
                        key,
                        result.budgetRemaining()
                ));
            }
        });

        return alerts;
    }

    private static OverallStatus decideOverallStatus(
            Map<String, SloResult> results,
            CircuitBreakerSummary breakers
    ) {
        boolean budgetCritical = results.values().stream().anyMatch(SloResult::critical);
        if (breakers.critical() > 0 || budgetCritical) {
            return OverallStatus.CRITICAL;
        }

        boolean sloFailed = results.values().stream().anyMatch(r -> r.status() == SloStatus.FAIL);
        if (breakers.open() > 0 || sloFailed) {
            return OverallStatus.DEGRADED;
        }

        return OverallStatus.HEALTHY;
    }

    private List<String> recommendations(Map<String, SloResult> results) {
        List<String> recommendations = new ArrayList<>();

        for (SloDefinition slo : sloDefinitions) {
            SloResult result = results.get(slo.key());
            String recommendation = slo.sliType().getRecommendation();

            if (result.status() == SloStatus.FAIL && !recommendations.contains(recommendation)) {
                recommendations.add(recommendation);
            }
        }

        return recommendations;
    }

    private int longestWindowDays() {
        return sloDefinitions.stream()
                .mapToInt(SloDefinition::windowDays)
                .max()
                .orElse(0);
    }
}
