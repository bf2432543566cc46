package org.carball.queryopt.model.report;

import org.carball.queryopt.model.analysis.Severity;

import java.time.Instant;
import java.util.Map;

public record PerformanceAlert(
        AlertType type,
        Severity severity,
        Instant timestamp,
        Map<String, Object> details
) {

    public PerformanceAlert {
        details = Map.copyOf(details);
    }
}
