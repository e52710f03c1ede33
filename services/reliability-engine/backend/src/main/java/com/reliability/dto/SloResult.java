package com.reliability.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * SLO 1건 평가 결과
 * - 필드 구성은 대시보드 소비자와의 계약이므로 이름 변경 금지
 */
public record SloResult(
        String name,
        String description,
        double target,
        double sliValue,
        SloStatus status,
        double budgetConsumedThisCall,
        double budgetRemaining,
        double budgetRemainingDays,
        @JsonProperty("isCritical") boolean critical
) {}
