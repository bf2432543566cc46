package org.carball.queryopt.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.queryopt.analyzer.DeepAnalysisEngine;
import org.carball.queryopt.config.OptimizerConfig;
import org.carball.queryopt.event.EventBus;
import org.carball.queryopt.event.EventChannel;
import org.carball.queryopt.model.analysis.CategoryPerformance;
import org.carball.queryopt.model.analysis.MemoryEstimate;
import org.carball.queryopt.model.analysis.OptimizationOpportunity;
import org.carball.queryopt.model.analysis.PerformanceAnalysis;
import org.carball.queryopt.model.analysis.ProblematicQuery;
import org.carball.queryopt.model.query.PerformanceHistoryEntry;
import org.carball.queryopt.model.query.QueryCategory;
import org.carball.queryopt.model.query.QueryMetrics;
import org.carball.queryopt.model.report.MetricsSnapshot;
import org.carball.queryopt.model.report.MonitoringStatus;
import org.carball.queryopt.model.report.PerformanceReport;
import org.carball.queryopt.store.OptimizerState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Aggregates tracked state into analyses and reports, and owns its retention, export and reset.
 */
@Slf4j
public class PerformanceReporter {

    static final int RECENT_SLOW_QUERIES = 10;

    // Approximate retained size per stored entry
    static final long METRICS_ENTRY_BYTES = 1024;
    static final long HISTORY_ENTRY_BYTES = 96;
    static final long SLOW_QUERY_ENTRY_BYTES = 512;
    static final long PREPARED_HANDLE_BYTES = 256;
    static final long INDEX_RECOMMENDATION_BYTES = 160;

    private final OptimizerState state;
    private final DeepAnalysisEngine deepAnalysisEngine;
    private final EventBus eventBus;
    private final OptimizerConfig config;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public PerformanceReporter(OptimizerState state, DeepAnalysisEngine deepAnalysisEngine, EventBus eventBus,
                               OptimizerConfig config, Clock clock) {
        this.state = state;
        this.deepAnalysisEngine = deepAnalysisEngine;
        this.eventBus = eventBus;
        this.config = config;
        this.clock = clock;
        this.objectMapper = PerformanceReportFormatter.createObjectMapper();
    }

    /**
     * Builds the aggregate view over all tracked statements and publishes it.
     */
    public PerformanceAnalysis analyzePerformance() {
        List<QueryMetrics> metrics = state.metricsSnapshot();

        long totalExecutions = 0;
        long successfulExecutions = 0;
        long failedExecutions = 0;
        long totalTime = 0;
        Map<QueryCategory, CategoryPerformance> categoryPerformance = new EnumMap<>(QueryCategory.class);
        List<ProblematicQuery> problematicQueries = new ArrayList<>();

        for (QueryMetrics m : metrics) {
            totalExecutions += m.getTotalExecutions();
            successfulExecutions += m.getSuccessfulExecutions();
            failedExecutions += m.getFailedExecutions();
            totalTime += m.getTotalTime();

            QueryCategory category = m.getCategory() != null ? m.getCategory() : QueryCategory.GENERAL;
            categoryPerformance.computeIfAbsent(category, c -> new CategoryPerformance())
                    .add(m.getTotalExecutions(), m.getSuccessfulExecutions(), m.getTotalTime());

            if (m.getAvgTime() > config.getProblematicQueryAvgMs()) {
                problematicQueries.add(new ProblematicQuery(m.getQueryId(), m.getSql(), category,
                        m.getAvgTime(), m.getTotalExecutions()));
            }
        }
        problematicQueries.sort(Comparator.comparingDouble(ProblematicQuery::avgTime).reversed());

        PerformanceAnalysis analysis = new PerformanceAnalysis(
                metrics.size(),
                totalExecutions,
                categoryPerformance,
                problematicQueries,
                slowQueryPercentage(),
                percentage(failedExecutions, totalExecutions),
                successfulExecutions == 0 ? 0.0 : (double) totalTime / successfulExecutions,
                clock.instant());

        log.debug("Performance analysis: {} queries, {} executions, {} problematic",
                analysis.totalQueries(), analysis.totalExecutions(), problematicQueries.size());
        eventBus.publish(EventChannel.PERFORMANCE_ANALYSIS, analysis);
        return analysis;
    }

    public PerformanceReport generatePerformanceReport(boolean monitoringActive) {
        PerformanceAnalysis summary = analyzePerformance();

        MonitoringStatus monitoring = new MonitoringStatus(monitoringActive, state.metricsCount(),
                state.getPreparedStatements().size(), state.getPerformanceHistory().size());

        return PerformanceReport.builder()
                .generatedAt(clock.instant())
                .monitoring(monitoring)
                .summary(summary)
                .queryBreakdown(summary.categoryPerformance())
                .slowQueries(state.getSlowQueryLog().newest(RECENT_SLOW_QUERIES))
                .totalSlowQueries(state.getSlowQueryLog().size())
                .indexRecommendations(state.indexRecommendationsSnapshot())
                .optimizationOpportunities(reportSection("optimization opportunities",
                        this::activeOpportunities, List.of()))
                .memoryUsage(reportSection("memory usage", this::estimateMemoryUsage, MemoryEstimate.ofBytes(0)))
                .build();
    }

    /**
     * Estimates retained memory from entry counts.
     */
    public MemoryEstimate estimateMemoryUsage() {
        long bytes = state.metricsCount() * METRICS_ENTRY_BYTES
                + state.getPerformanceHistory().size() * HISTORY_ENTRY_BYTES
                + state.getSlowQueryLog().size() * SLOW_QUERY_ENTRY_BYTES
                + state.getPreparedStatements().size() * PREPARED_HANDLE_BYTES
                + state.indexRecommendationsSnapshot().size() * INDEX_RECOMMENDATION_BYTES;
        return MemoryEstimate.ofBytes(bytes);
    }

    /**
     * Discards state older than the retention window, then trims the metrics store to its cap
     * by dropping the least recently executed entries.
     *
     * @return the number of metrics entries removed
     */
    public int cleanupOldMetrics() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(config.getMetricsRetentionHours()));

        int staleMetrics = state.removeMetricsIf(m -> m.getLastExecuted() != null
                && m.getLastExecuted().isBefore(cutoff));
        int staleHandles = state.getPreparedStatements().removeUnusedSince(cutoff);
        int staleSlowQueries = state.getSlowQueryLog().removeIf(e -> e.timestamp() != null
                && e.timestamp().isBefore(cutoff));
        int staleHistory = state.getPerformanceHistory().removeIf(e -> e.timestamp() != null
                && e.timestamp().isBefore(cutoff));

        int overCap = trimMetricsToCap();

        if (staleMetrics + staleHandles + staleSlowQueries + staleHistory + overCap > 0) {
            log.info("Cleaned up {} stale metrics, {} prepared statements, {} slow queries, {} history entries"
                            + " and {} metrics over the cap",
                    staleMetrics, staleHandles, staleSlowQueries, staleHistory, overCap);
        }
        return staleMetrics + overCap;
    }

    public MetricsSnapshot exportMetrics() {
        return MetricsSnapshot.builder()
                .exportedAt(clock.instant())
                .queryMetrics(state.metricsSnapshot())
                .slowQueryLog(state.getSlowQueryLog().snapshot())
                .performanceHistory(state.getPerformanceHistory().snapshot())
                .indexRecommendations(state.indexRecommendationsSnapshot())
                .preparedStatements(state.getPreparedStatements().snapshot())
                .build();
    }

    /**
     * Replaces all tracked state with the snapshot's contents.
     */
    public void importMetrics(MetricsSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");

        state.replaceMetrics(orEmpty(snapshot.getQueryMetrics()));
        state.getSlowQueryLog().replaceWith(orEmpty(snapshot.getSlowQueryLog()));
        state.getPerformanceHistory().replaceWith(orEmpty(snapshot.getPerformanceHistory()));
        state.replaceIndexRecommendations(orEmpty(snapshot.getIndexRecommendations()));
        state.getPreparedStatements().restore(orEmpty(snapshot.getPreparedStatements()));
        state.setLatestOpportunities(List.of());

        log.info("Imported metrics snapshot from {}: {} queries, {} history entries",
                snapshot.getExportedAt(), state.metricsCount(), state.getPerformanceHistory().size());
    }

    public String exportMetricsJson() {
        try {
            return objectMapper.writeValueAsString(exportMetrics());
        } catch (JsonProcessingException e) {
            log.error("Error exporting metrics", e);
            throw new RuntimeException("Failed to export metrics", e);
        }
    }

    public void importMetricsJson(String json) {
        try {
            importMetrics(objectMapper.readValue(json, MetricsSnapshot.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid metrics snapshot: " + e.getOriginalMessage(), e);
        }
    }

    public void resetMetrics() {
        state.clear();
        log.info("Performance metrics reset");
    }

    private List<OptimizationOpportunity> activeOpportunities() {
        List<OptimizationOpportunity> opportunities = new ArrayList<>(deepAnalysisEngine.getOptimizationOpportunities());
        opportunities.addAll(state.getLatestOpportunities());
        return opportunities;
    }

    private double slowQueryPercentage() {
        List<PerformanceHistoryEntry> history = state.getPerformanceHistory().snapshot();
        long slow = history.stream()
                .filter(e -> e.executionTime() > config.getSlowQueryThresholdMs())
                .count();
        return percentage(slow, history.size());
    }

    private int trimMetricsToCap() {
        int excess = state.metricsCount() - config.getMaxTrackedQueries();
        if (excess <= 0) {
            return 0;
        }
        List<String> oldest = state.metricsSnapshot().stream()
                .sorted(Comparator.comparing(QueryMetrics::getLastExecuted,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .limit(excess)
                .map(QueryMetrics::getQueryId)
                .collect(Collectors.toList());

        int removed = 0;
        for (String queryId : oldest) {
            if (state.removeMetrics(queryId)) {
                removed++;
            }
        }
        return removed;
    }

    private <T> T reportSection(String name, Supplier<T> section, T fallback) {
        try {
            return section.get();
        } catch (RuntimeException e) {
            log.warn("Failed to build report section '{}': {}", name, e.getMessage(), e);
            return fallback;
        }
    }

    private static double percentage(long part, long whole) {
        return whole == 0 ? 0.0 : part * 100.0 / whole;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }
}
