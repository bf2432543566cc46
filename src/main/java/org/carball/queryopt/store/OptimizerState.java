package org.carball.queryopt.store;

import org.carball.queryopt.cache.PreparedStatementCache;
import org.carball.queryopt.config.OptimizerConfig;
import org.carball.queryopt.model.analysis.OptimizationOpportunity;
import org.carball.queryopt.model.query.PerformanceHistoryEntry;
import org.carball.queryopt.model.query.QueryMetrics;
import org.carball.queryopt.model.query.SlowQueryEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * All mutable state owned by one optimizer instance.
 */
public class OptimizerState {

    private final ConcurrentMap<String, QueryMetrics> queryMetrics = new ConcurrentHashMap<>();
    private final BoundedLog<PerformanceHistoryEntry> performanceHistory;
    private final BoundedLog<SlowQueryEntry> slowQueryLog;
    private final Set<String> indexRecommendations = Collections.synchronizedSet(new LinkedHashSet<>());
    private final PreparedStatementCache preparedStatements;
    private volatile List<OptimizationOpportunity> latestOpportunities = List.of();

    public OptimizerState(OptimizerConfig config) {
        this.performanceHistory = new BoundedLog<>(config.getMaxPerformanceHistory());
        this.slowQueryLog = new BoundedLog<>(config.getMaxSlowQueryLog());
        this.preparedStatements = new PreparedStatementCache(config.getMaxPreparedStatements());
    }

    /**
     * Fetches or creates the entry for the identity and applies the mutation in one atomic step.
     */
    public void updateMetrics(String queryId, Supplier<QueryMetrics> seed, Consumer<QueryMetrics> mutation) {
        queryMetrics.compute(queryId, (id, existing) -> {
            QueryMetrics metrics = existing != null ? existing : seed.get();
            synchronized (metrics) {
                mutation.accept(metrics);
            }
            return metrics;
        });
    }

    public Optional<QueryMetrics> findMetrics(String queryId) {
        QueryMetrics metrics = queryMetrics.get(queryId);
        if (metrics == null) {
            return Optional.empty();
        }
        synchronized (metrics) {
            return Optional.of(metrics.copy());
        }
    }

    /**
     * Returns copies of all entries.
     */
    public List<QueryMetrics> metricsSnapshot() {
        List<QueryMetrics> copies = new ArrayList<>(queryMetrics.size());
        for (String queryId : queryMetrics.keySet()) {
            findMetrics(queryId).ifPresent(copies::add);
        }
        return copies;
    }

    /**
     * Replaces all entries with copies of the given ones. Entries without an identity are skipped.
     */
    public void replaceMetrics(Collection<QueryMetrics> metrics) {
        queryMetrics.clear();
        for (QueryMetrics entry : metrics) {
            if (entry.getQueryId() != null) {
                queryMetrics.put(entry.getQueryId(), entry.copy());
            }
        }
    }

    public int removeMetricsIf(Predicate<QueryMetrics> filter) {
        int before = queryMetrics.size();
        queryMetrics.values().removeIf(metrics -> {
            synchronized (metrics) {
                return filter.test(metrics);
            }
        });
        return before - queryMetrics.size();
    }

    public boolean removeMetrics(String queryId) {
        return queryMetrics.remove(queryId) != null;
    }

    public int metricsCount() {
        return queryMetrics.size();
    }

    public BoundedLog<PerformanceHistoryEntry> getPerformanceHistory() {
        return performanceHistory;
    }

    public BoundedLog<SlowQueryEntry> getSlowQueryLog() {
        return slowQueryLog;
    }

    public PreparedStatementCache getPreparedStatements() {
        return preparedStatements;
    }

    /**
     * Adds an index recommendation, returning false when it was already known.
     */
    public boolean addIndexRecommendation(String indexSql) {
        return indexRecommendations.add(indexSql);
    }

    public List<String> indexRecommendationsSnapshot() {
        synchronized (indexRecommendations) {
            return new ArrayList<>(indexRecommendations);
        }
    }

    public void replaceIndexRecommendations(Collection<String> recommendations) {
        synchronized (indexRecommendations) {
            indexRecommendations.clear();
            indexRecommendations.addAll(recommendations);
        }
    }

    public List<OptimizationOpportunity> getLatestOpportunities() {
        return latestOpportunities;
    }

    public void setLatestOpportunities(List<OptimizationOpportunity> opportunities) {
        this.latestOpportunities = List.copyOf(opportunities);
    }

    /**
     * Clears everything, including index recommendations and cached handles.
     */
    public void clear() {
        queryMetrics.clear();
        performanceHistory.clear();
        slowQueryLog.clear();
        indexRecommendations.clear();
        preparedStatements.clear();
        latestOpportunities = List.of();
    }
}
