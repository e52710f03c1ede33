package com.reliability.slo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SLO별 ErrorBudget 보유 및 소모 처리
 * - budget 인스턴스는 이 tracker만 소유한다
 */
public class ErrorBudgetTracker {

    private final Map<String, ErrorBudget> budgets;
    private final double criticalThreshold;

    public ErrorBudgetTracker(List<SloDefinition> slos) {
        this(slos, ErrorBudget.DEFAULT_CRITICAL_THRESHOLD);
    }

    public ErrorBudgetTracker(List<SloDefinition> slos, double criticalThreshold) {
        Map<String, ErrorBudget> byKey = new LinkedHashMap<>();
        for (SloDefinition slo : slos) {
            if (byKey.putIfAbsent(slo.key(), new ErrorBudget(slo)) != null) {
                throw new IllegalArgumentException("duplicate slo key: " + slo.key());
            }
        }
        this.budgets = Collections.unmodifiableMap(byKey);
        this.criticalThreshold = criticalThreshold;
    }

    public double consume(String sloKey, double sliValue) {
        return budget(sloKey).consume(sliValue);
    }

    public double remaining(String sloKey) {
        return budget(sloKey).remaining();
    }

    public boolean isCritical(String sloKey) {
        return budget(sloKey).isCritical(criticalThreshold);
    }

    public ErrorBudget budget(String sloKey) {
        ErrorBudget budget = budgets.get(sloKey);
        if (budget == null) {
            throw new IllegalArgumentException("unknown slo: " + sloKey);
        }
        return budget;
    }
}
