package org.carball.queryopt.model.analysis;

import org.carball.queryopt.model.query.QueryCategory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view over all tracked statements. Also the payload of performance-analysis events.
 */
public record PerformanceAnalysis(
        int totalQueries,
        long totalExecutions,
        Map<QueryCategory, CategoryPerformance> categoryPerformance,
        List<ProblematicQuery> problematicQueries,
        double slowQueryPercentage,
        double errorRate,
        double avgExecutionTime,
        Instant analyzedAt
) {

    public PerformanceAnalysis {
        categoryPerformance = Map.copyOf(categoryPerformance);
        problematicQueries = List.copyOf(problematicQueries);
    }
}
