package com.reliability.dto;

import java.util.List;

public record CircuitBreakerSummary(
        int total,
        int open,
        int critical,
        List<String> openCircuits,
        List<String> criticalCircuits
) {}
