package org.carball.queryopt.model.report;

import java.util.List;

public record ServiceHealth(
        HealthStatus status,
        List<String> issues,
        double memoryUsageMb,
        int alertCount,
        boolean isMonitoring
) {}
