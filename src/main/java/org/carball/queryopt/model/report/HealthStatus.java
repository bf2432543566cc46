package org.carball.queryopt.model.report;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL
}
