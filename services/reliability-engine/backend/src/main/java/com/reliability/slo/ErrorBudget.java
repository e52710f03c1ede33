package com.reliability.slo;

import lombok.Getter;

/**
 * SLO 1개에 대한 error budget
 *
 * - budgetTotal = 100 - target (허용 실패 %p)
 * - budgetConsumed는 프로세스 수명 동안 누적만 된다 (감소/초기화 없음)
 */
public class ErrorBudget {

    public static final double DEFAULT_CRITICAL_THRESHOLD = 0.5;

    @Getter
    private final SloDefinition slo;

    @Getter
    private final double budgetTotal;

    private double budgetConsumed;

    public ErrorBudget(SloDefinition slo) {
        this.slo = slo;
        this.budgetTotal = 100.0 - slo.target();
    }

    /**
     * SLI가 target 미만이면 (target - SLI)만큼 소모하고 소모량 반환, 아니면 0
     */
    public synchronized double consume(double sliValue) {
        if (sliValue < slo.target()) {
            double consumed = slo.target() - sliValue;
            budgetConsumed += consumed;
            return consumed;
        }
        return 0.0;
    }

    public synchronized double getBudgetConsumed() {
        return budgetConsumed;
    }

    public synchronized double remaining() {
        return Math.max(0.0, budgetTotal - budgetConsumed);
    }

    /**
     * 일일 소모량 기준 남은 일수 (dailyBudget <= 0 이면 0)
     */
    public double remainingDays(double dailyBudget) {
        if (dailyBudget <= 0) {
            return 0.0;
        }
        return remaining() / dailyBudget;
    }

    public boolean isCritical() {
        return isCritical(DEFAULT_CRITICAL_THRESHOLD);
    }

    public boolean isCritical(double threshold) {
        return remaining() < budgetTotal * threshold;
    }
}
