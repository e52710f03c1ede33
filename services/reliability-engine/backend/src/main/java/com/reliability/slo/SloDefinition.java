package com.reliability.slo;

/**
 * Service Level Objective 정의 (시작 시 1회 생성, 이후 읽기 전용)
 *
 * @param key        SLO 식별자 (결과/alert/meter 태그에 사용)
 * @param name       표시 이름
 * @param sliType    평가할 SLI
 * @param target     목표 비율 (0 ~ 100, 예: 99.9)
 * @param windowDays 평가 구간 (일)
 */
public record SloDefinition(
        String key,
        String name,
        SliType sliType,
        double target,
        int windowDays
) {

    public SloDefinition {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("slo key must not be blank");
        }
        if (sliType == null) {
            throw new IllegalArgumentException("sliType must not be null: " + key);
        }
        if (target < 0 || target > 100) {
            throw new IllegalArgumentException("target must be between 0 and 100: " + target);
        }
        if (windowDays <= 0) {
            throw new IllegalArgumentException("windowDays must be > 0: " + windowDays);
        }
        if (name == null || name.isBlank()) {
            name = key;
        }
    }

    public String description() {
        return String.format("%s: %s%% over %d days", name, target, windowDays);
    }
}
