package com.reliability.controller;

import com.reliability.dto.AlertsResponse;
import com.reliability.dto.DefaultResponse;
import com.reliability.dto.PerformanceSummary;
import com.reliability.dto.ReliabilityReportPayload;
import com.reliability.service.ReliabilityReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequestMapping("/api/reliability")
@RequiredArgsConstructor
public class ReliabilityController {

    private final ReliabilityReportService reliabilityReportService;
    private final Clock clock;

    /**
     * SLO / error budget / breaker 통합 리포트
     * - 호출 시마다 FAIL SLO의 error budget이 누적 소모됨
     */
    @GetMapping("/report")
    public ResponseEntity<DefaultResponse<ReliabilityReportPayload>> report() {
        return ResponseEntity.ok(
                DefaultResponse.ok(reliabilityReportService.evaluate(clock.instant()))
        );
    }

    /**
     * severity 포함 alert 목록 (breaker + SLO)
     */
    @GetMapping("/alerts")
    public ResponseEntity<DefaultResponse<AlertsResponse>> alerts() {
        return ResponseEntity.ok(
                DefaultResponse.ok(reliabilityReportService.alerts(clock.instant()))
        );
    }

    /**
     * 최근 1시간 성능 요약
     * - 상태 판단하지 않음, budget 소모 없음
     */
    @GetMapping("/performance")
    public ResponseEntity<DefaultResponse<PerformanceSummary>> performance() {
        return ResponseEntity.ok(
                DefaultResponse.ok(reliabilityReportService.performance(clock.instant()))
        );
    }
}
