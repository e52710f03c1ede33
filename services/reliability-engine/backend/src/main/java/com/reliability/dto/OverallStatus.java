package com.reliability.dto;

public enum OverallStatus {
    HEALTHY,
    DEGRADED,   // open breaker 또는 SLO FAIL
    CRITICAL    // stuck-open breaker 또는 error budget critical
}
