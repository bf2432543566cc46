package org.carball.queryopt.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.queryopt.config.OptimizerConfig;
import org.carball.queryopt.event.EventBus;
import org.carball.queryopt.event.EventChannel;
import org.carball.queryopt.model.analysis.DeepAnalysisResult;
import org.carball.queryopt.model.analysis.OpportunityType;
import org.carball.queryopt.model.analysis.OptimizationOpportunity;
import org.carball.queryopt.model.analysis.Severity;
import org.carball.queryopt.model.query.PerformanceHistoryEntry;
import org.carball.queryopt.model.query.QueryComplexity;
import org.carball.queryopt.model.query.QueryMetrics;
import org.carball.queryopt.model.query.QueryType;
import org.carball.queryopt.store.OptimizerState;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Looks across all tracked statements for caching, indexing and N+1 opportunities.
 */
@Slf4j
public class DeepAnalysisEngine {

    private final OptimizerState state;
    private final EventBus eventBus;
    private final OptimizerConfig config;
    private final Clock clock;

    public DeepAnalysisEngine(OptimizerState state, EventBus eventBus, OptimizerConfig config, Clock clock) {
        this.state = state;
        this.eventBus = eventBus;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Runs every detector, remembers the opportunities found and publishes the result.
     * A failing detector is logged and contributes nothing.
     */
    public DeepAnalysisResult performDeepAnalysis() {
        log.debug("Starting deep analysis");
        List<QueryMetrics> metrics = state.metricsSnapshot();

        List<OptimizationOpportunity> opportunities = new ArrayList<>();
        runDetector("caching", () -> detectCachingCandidates(metrics), opportunities);
        runDetector("indexing", () -> detectIndexingCandidates(metrics), opportunities);
        runDetector("N+1", () -> detectNPlusOnePatterns(metrics), opportunities);

        state.setLatestOpportunities(opportunities);

        DeepAnalysisResult result = new DeepAnalysisResult(clock.instant(), metrics.size(),
                opportunities, state.indexRecommendationsSnapshot());

        log.info("Deep analysis complete: {} unique queries, {} opportunities",
                result.totalUniqueQueries(), opportunities.size());
        eventBus.publish(EventChannel.DEEP_ANALYSIS, result);
        return result;
    }

    /**
     * Summarizes accumulated state: pending index recommendations, a long slow query log
     * and statements that carry rewrite suggestions.
     */
    public List<OptimizationOpportunity> getOptimizationOpportunities() {
        List<OptimizationOpportunity> opportunities = new ArrayList<>();

        List<String> indexes = state.indexRecommendationsSnapshot();
        if (!indexes.isEmpty()) {
            opportunities.add(new OptimizationOpportunity(OpportunityType.MISSING_INDEXES, Severity.HIGH,
                    indexes.size() + " missing indexes detected", indexes));
        }

        int slowQueries = state.getSlowQueryLog().size();
        if (slowQueries > config.getSlowQueryOpportunityThreshold()) {
            opportunities.add(new OptimizationOpportunity(OpportunityType.SLOW_QUERIES, Severity.MEDIUM,
                    slowQueries + " slow queries detected", List.of()));
        }

        List<String> inefficient = state.metricsSnapshot().stream()
                .filter(QueryMetrics::hasOptimizations)
                .map(QueryMetrics::getQueryId)
                .collect(Collectors.toList());
        if (!inefficient.isEmpty()) {
            opportunities.add(new OptimizationOpportunity(OpportunityType.INEFFICIENT_PATTERNS, Severity.LOW,
                    inefficient.size() + " queries with optimization opportunities", inefficient));
        }

        return opportunities;
    }

    private void runDetector(String name, Supplier<List<OptimizationOpportunity>> detector,
                             List<OptimizationOpportunity> sink) {
        try {
            sink.addAll(detector.get());
        } catch (RuntimeException e) {
            log.warn("Deep analysis detector '{}' failed: {}", name, e.getMessage(), e);
        }
    }

    List<OptimizationOpportunity> detectCachingCandidates(List<QueryMetrics> metrics) {
        List<String> candidates = metrics.stream()
                .filter(m -> m.getQueryType() == QueryType.SELECT)
                .filter(m -> m.getComplexity() == QueryComplexity.LOW)
                .filter(m -> m.getTotalExecutions() >= config.getCachingFrequencyThreshold())
                .map(QueryMetrics::getQueryId)
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            return List.of();
        }
        return List.of(new OptimizationOpportunity(OpportunityType.CACHING, Severity.MEDIUM,
                "High-frequency queries that could benefit from caching", candidates));
    }

    List<OptimizationOpportunity> detectIndexingCandidates(List<QueryMetrics> metrics) {
        List<String> candidates = metrics.stream()
                .filter(m -> m.getSuccessfulExecutions() > 0)
                .filter(m -> m.getAvgTime() > config.getIndexingCandidateAvgMs())
                .sorted(Comparator.comparingDouble(QueryMetrics::getAvgTime).reversed())
                .map(QueryMetrics::getQueryId)
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            return List.of();
        }
        return List.of(new OptimizationOpportunity(OpportunityType.INDEXING, Severity.HIGH,
                "Slow queries that need better indexing", candidates));
    }

    /**
     * Groups the execution history by statement shape and reports shapes executed at least
     * {@code nPlusOneMinExecutions} times inside one window by two or more distinct statements.
     */
    List<OptimizationOpportunity> detectNPlusOnePatterns(List<QueryMetrics> metrics) {
        Map<String, String> shapesById = new HashMap<>();
        for (QueryMetrics m : metrics) {
            String shape = shapeOf(m);
            if (shape != null) {
                shapesById.putIfAbsent(m.getQueryId(), shape);
            }
        }

        Map<String, List<PerformanceHistoryEntry>> byShape = new LinkedHashMap<>();
        for (PerformanceHistoryEntry entry : state.getPerformanceHistory().snapshot()) {
            String shape = shapesById.get(entry.queryId());
            if (shape != null) {
                byShape.computeIfAbsent(shape, s -> new ArrayList<>()).add(entry);
            }
        }

        List<String> candidates = new ArrayList<>();
        for (Map.Entry<String, List<PerformanceHistoryEntry>> group : byShape.entrySet()) {
            if (group.getValue().size() >= config.getNPlusOneMinExecutions() && hasBurst(group.getValue())) {
                candidates.add(group.getKey());
            }
        }

        if (candidates.isEmpty()) {
            return List.of();
        }
        log.debug("Detected {} potential N+1 patterns", candidates.size());
        return List.of(new OptimizationOpportunity(OpportunityType.N_PLUS_ONE_QUERIES, Severity.HIGH,
                "Repeated near-identical queries executed in rapid succession; consider batching or a JOIN",
                candidates));
    }

    /**
     * Entries imported from snapshots without a shape fall back to the stored text,
     * unless that text was truncated.
     */
    private String shapeOf(QueryMetrics metrics) {
        if (metrics.getShape() != null && !metrics.getShape().isEmpty()) {
            return metrics.getShape();
        }
        String sql = metrics.getSql();
        if (sql == null || sql.length() >= config.getSqlPreviewLength()) {
            return null;
        }
        return QueryAnalyzer.shapeOf(sql);
    }

    private boolean hasBurst(List<PerformanceHistoryEntry> entries) {
        List<PerformanceHistoryEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(PerformanceHistoryEntry::timestamp,
                Comparator.nullsFirst(Comparator.naturalOrder())));

        long windowMs = config.getNPlusOneWindowMs();
        int minExecutions = config.getNPlusOneMinExecutions();
        Map<String, Integer> idsInWindow = new HashMap<>();

        int start = 0;
        for (int end = 0; end < sorted.size(); end++) {
            PerformanceHistoryEntry current = sorted.get(end);
            if (current.timestamp() == null) {
                continue;
            }
            idsInWindow.merge(current.queryId(), 1, Integer::sum);

            while (start < end && outsideWindow(sorted.get(start).timestamp(), current.timestamp(), windowMs)) {
                PerformanceHistoryEntry leaving = sorted.get(start++);
                if (leaving.timestamp() != null) {
                    idsInWindow.computeIfPresent(leaving.queryId(), (id, n) -> n > 1 ? n - 1 : null);
                }
            }

            int inWindow = idsInWindow.values().stream().mapToInt(Integer::intValue).sum();
            if (inWindow >= minExecutions && idsInWindow.size() >= 2) {
                return true;
            }
        }
        return false;
    }

    private static boolean outsideWindow(Instant earliest, Instant latest, long windowMs) {
        return earliest == null || latest.toEpochMilli() - earliest.toEpochMilli() > windowMs;
    }
}
