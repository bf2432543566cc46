package org.carball.queryopt.model.report;

public record MonitoringStatus(
        boolean isActive,
        int trackedQueries,
        int preparedStatements,
        int historySize
) {}
