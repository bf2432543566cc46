package org.carball.queryopt.model.query;

import java.time.Instant;

/**
 * Payload of query-error events.
 */
public record QueryErrorEvent(
        String queryId,
        String sql,
        long executionTime,
        String error,
        Instant timestamp
) {}
