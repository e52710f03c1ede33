package com.reliability.slo;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * SLI 종류와 SLO 실패 시 권고 사항 (고정 매핑)
 */
@Getter
@RequiredArgsConstructor
public enum SliType {

    AVAILABILITY(
            "availability_sli",
            "Investigate infrastructure issues and implement redundancy"
    ),
    LATENCY(
            "latency_sli",
            "Optimize database queries and implement caching"
    ),
    ERROR_RATE(
            "error_rate_sli",
            "Review error logs and implement better error handling"
    ),
    FRESHNESS(
            "freshness_sli",
            "Check database replication lag and query performance"
    );

    private final String sliName;
    private final String recommendation;
}
