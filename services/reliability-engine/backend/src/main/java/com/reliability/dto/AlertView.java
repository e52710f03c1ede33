package com.reliability.dto;

import java.time.Instant;

/**
 * severity : CRITICAL / WARNING / INFO
 * component : breaker 이름 또는 "SLO"
 */
public record AlertView(
        String severity,
        String component,
        String message,
        Instant timestamp
) {}
