package org.carball.queryopt.model.query;

import java.time.Instant;
import java.util.List;

/**
 * An execution that exceeded the slow query threshold. Also the payload of slow-query events.
 */
public record SlowQueryEntry(
        String sql,
        long executionTime,
        QueryCategory category,
        QueryComplexity complexity,
        List<String> optimizations,
        Instant timestamp
) {

    public SlowQueryEntry {
        optimizations = optimizations == null ? List.of() : List.copyOf(optimizations);
    }
}
