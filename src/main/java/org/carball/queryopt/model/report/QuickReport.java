package org.carball.queryopt.model.report;

import java.time.Instant;
import java.util.List;

/**
 * Alert-based summary of the last few minutes.
 */
public record QuickReport(
        HealthStatus status,
        Instant timestamp,
        int totalAlerts,
        int slowQueries,
        int queryErrors,
        int degradationEvents,
        List<String> issues,
        List<String> recommendations
) {}
