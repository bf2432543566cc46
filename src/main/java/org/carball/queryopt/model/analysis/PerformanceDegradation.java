package org.carball.queryopt.model.analysis;

import java.time.Instant;

/**
 * Payload of performance-degradation events. Percentages are in the range 0-100.
 */
public record PerformanceDegradation(
        double slowQueryPercentage,
        double errorRate,
        double avgExecutionTime,
        Instant timestamp
) {}
