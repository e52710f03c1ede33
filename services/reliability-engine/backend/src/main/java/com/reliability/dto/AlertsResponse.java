package com.reliability.dto;

import java.util.List;

public record AlertsResponse(
        List<AlertView> alerts,
        int totalAlerts,
        int criticalAlerts,
        int warningAlerts
) {}
