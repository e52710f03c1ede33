package com.reliability.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 통합 신뢰성 리포트 (/api/reliability/report 응답)
 *
 * - slos : SLO key → 평가 결과 (설정 순서 유지)
 * - alerts : FAIL SLO 1건당 1개 + critical budget 1건당 1개
 * - recommendations : 실패한 SLO의 SLI 종류 기준 고정 문구
 */
public record ReliabilityReportPayload(
        Instant timestamp,
        String window,
        Map<String, SloResult> slos,
        List<String> alerts,
        CircuitBreakerSummary circuitBreakers,
        OverallStatus overallStatus,
        List<String> recommendations
) {}
