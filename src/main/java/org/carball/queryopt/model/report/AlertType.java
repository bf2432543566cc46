package org.carball.queryopt.model.report;

public enum AlertType {
    SLOW_QUERY,
    QUERY_ERROR,
    PERFORMANCE_DEGRADATION
}
