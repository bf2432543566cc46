package org.carball.queryopt.model.query;

import java.time.Instant;

/**
 * One successful execution in the performance history.
 */
public record PerformanceHistoryEntry(
        String queryId,
        long executionTime,
        Instant timestamp
) {}
