package org.carball.queryopt.model.query;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulated execution statistics for one query identity.
 * Timing fields cover successful executions only.
 */
@Data
@NoArgsConstructor
public class QueryMetrics {
    private String queryId;
    private String sql;
    // Literal-free form of the full statement; sql may be truncated
    private String shape;
    private QueryType queryType = QueryType.OTHER;
    private QueryCategory category = QueryCategory.GENERAL;
    private QueryComplexity complexity = QueryComplexity.LOW;
    private List<String> optimizations = new ArrayList<>();

    private long totalExecutions;
    private long successfulExecutions;
    private long failedExecutions;

    private long minTime;
    private long maxTime;
    private double avgTime;
    private long totalTime;

    private Instant lastExecuted;
    private String lastError;

    /**
     * Creates an empty entry seeded from the statement's analysis.
     */
    public static QueryMetrics seed(String queryId, String sqlPreview, QueryAnalysis analysis) {
        QueryMetrics metrics = new QueryMetrics();
        metrics.setQueryId(queryId);
        metrics.setSql(sqlPreview);
        metrics.setShape(analysis.shape());
        metrics.setQueryType(analysis.queryType());
        metrics.setCategory(analysis.category());
        metrics.setComplexity(analysis.complexity());
        metrics.setOptimizations(new ArrayList<>(analysis.optimizations()));
        return metrics;
    }

    public void recordSuccess(long durationMs, Instant executedAt) {
        if (successfulExecutions == 0) {
            minTime = durationMs;
            maxTime = durationMs;
        } else {
            minTime = Math.min(minTime, durationMs);
            maxTime = Math.max(maxTime, durationMs);
        }
        totalExecutions++;
        successfulExecutions++;
        totalTime += durationMs;
        avgTime = (double) totalTime / successfulExecutions;
        lastExecuted = executedAt;
    }

    public void recordFailure(String error, Instant executedAt) {
        totalExecutions++;
        failedExecutions++;
        lastError = error;
        lastExecuted = executedAt;
    }

    public boolean hasOptimizations() {
        return optimizations != null && !optimizations.isEmpty();
    }

    public QueryMetrics copy() {
        QueryMetrics copy = new QueryMetrics();
        copy.setQueryId(queryId);
        copy.setSql(sql);
        copy.setShape(shape);
        copy.setQueryType(queryType);
        copy.setCategory(category);
        copy.setComplexity(complexity);
        copy.setOptimizations(optimizations == null ? new ArrayList<>() : new ArrayList<>(optimizations));
        copy.setTotalExecutions(totalExecutions);
        copy.setSuccessfulExecutions(successfulExecutions);
        copy.setFailedExecutions(failedExecutions);
        copy.setMinTime(minTime);
        copy.setMaxTime(maxTime);
        copy.setAvgTime(avgTime);
        copy.setTotalTime(totalTime);
        copy.setLastExecuted(lastExecuted);
        copy.setLastError(lastError);
        return copy;
    }
}
