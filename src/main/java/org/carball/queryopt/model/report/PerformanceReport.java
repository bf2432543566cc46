package org.carball.queryopt.model.report;

import lombok.Builder;
import lombok.Data;
import org.carball.queryopt.model.analysis.CategoryPerformance;
import org.carball.queryopt.model.analysis.MemoryEstimate;
import org.carball.queryopt.model.analysis.OptimizationOpportunity;
import org.carball.queryopt.model.analysis.PerformanceAnalysis;
import org.carball.queryopt.model.query.QueryCategory;
import org.carball.queryopt.model.query.SlowQueryEntry;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time snapshot of everything the optimizer knows.
 */
@Data
@Builder
public class PerformanceReport {
    private Instant generatedAt;
    private MonitoringStatus monitoring;
    private PerformanceAnalysis summary;
    private Map<QueryCategory, CategoryPerformance> queryBreakdown;
    private List<SlowQueryEntry> slowQueries;
    private int totalSlowQueries;
    private List<String> indexRecommendations;
    private List<OptimizationOpportunity> optimizationOpportunities;
    private MemoryEstimate memoryUsage;
}
