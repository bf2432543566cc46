package org.carball.queryopt.model.analysis;

import lombok.Data;

/**
 * Totals for one query category. Like per-query metrics, timing covers successful executions only.
 */
@Data
public class CategoryPerformance {
    private int count;
    private long totalExecutions;
    private long successfulExecutions;
    private long totalTime;
    private double avgTime;

    public void add(long executions, long successful, long time) {
        count++;
        totalExecutions += executions;
        successfulExecutions += successful;
        totalTime += time;
        avgTime = successfulExecutions == 0 ? 0.0 : (double) totalTime / successfulExecutions;
    }
}
