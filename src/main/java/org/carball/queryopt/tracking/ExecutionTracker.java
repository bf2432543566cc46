package org.carball.queryopt.tracking;

import lombok.extern.slf4j.Slf4j;
import org.carball.queryopt.analyzer.QueryAnalyzer;
import org.carball.queryopt.analyzer.QueryIdentity;
import org.carball.queryopt.config.OptimizerConfig;
import org.carball.queryopt.driver.DatabaseDriver;
import org.carball.queryopt.driver.QueryResult;
import org.carball.queryopt.event.EventBus;
import org.carball.queryopt.event.EventChannel;
import org.carball.queryopt.model.query.PerformanceHistoryEntry;
import org.carball.queryopt.model.query.QueryAnalysis;
import org.carball.queryopt.model.query.QueryErrorEvent;
import org.carball.queryopt.model.query.QueryMetrics;
import org.carball.queryopt.recommend.SlowQueryRecommender;
import org.carball.queryopt.store.OptimizerState;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Runs statements through the driver and records their outcome.
 * Driver failures are recorded and then passed on to the caller unchanged.
 * <p>
 * Durations come from a monotonic nanosecond source; the {@link Clock} only stamps entries.
 */
@Slf4j
public class ExecutionTracker {

    private final DatabaseDriver driver;
    private final QueryAnalyzer analyzer;
    private final OptimizerState state;
    private final SlowQueryRecommender slowQueryRecommender;
    private final EventBus eventBus;
    private final OptimizerConfig config;
    private final Clock clock;
    private final LongSupplier nanoTime;

    public ExecutionTracker(DatabaseDriver driver, QueryAnalyzer analyzer, OptimizerState state,
                            SlowQueryRecommender slowQueryRecommender, EventBus eventBus,
                            OptimizerConfig config, Clock clock, LongSupplier nanoTime) {
        this.driver = driver;
        this.analyzer = analyzer;
        this.state = state;
        this.slowQueryRecommender = slowQueryRecommender;
        this.eventBus = eventBus;
        this.config = config;
        this.clock = clock;
        this.nanoTime = nanoTime;
    }

    public CompletableFuture<QueryResult> executeWithTracking(String sql, List<Object> args) {
        String queryId = QueryIdentity.of(sql);
        long startNanos = nanoTime.getAsLong();

        CompletableFuture<QueryResult> pending;
        try {
            pending = driver.execute(sql, args);
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<QueryResult> tracked = new CompletableFuture<>();
        pending.whenComplete((result, error) -> {
            long elapsed = Math.max(0, TimeUnit.NANOSECONDS.toMillis(nanoTime.getAsLong() - startNanos));
            if (error == null) {
                try {
                    recordSuccess(queryId, sql, elapsed);
                } catch (RuntimeException e) {
                    log.error("Failed to record metrics for query {}", queryId, e);
                }
                tracked.complete(result);
            } else {
                Throwable cause = unwrap(error);
                try {
                    recordFailure(queryId, sql, elapsed, cause);
                } catch (RuntimeException e) {
                    log.error("Failed to record failure for query {}", queryId, e);
                }
                tracked.completeExceptionally(cause);
            }
        });
        return tracked;
    }

    /**
     * Records one successful execution: metrics, history and, when slow, the slow query log.
     */
    public void recordSuccess(String queryId, String sql, long elapsedMs) {
        QueryAnalysis analysis = analyzer.analyze(sql);
        Instant now = clock.instant();

        state.updateMetrics(queryId,
                () -> QueryMetrics.seed(queryId, preview(sql), analysis),
                metrics -> metrics.recordSuccess(elapsedMs, now));

        int dropped = state.getPerformanceHistory().append(new PerformanceHistoryEntry(queryId, elapsedMs, now));
        if (dropped > 0) {
            log.trace("Performance history at capacity, dropped {} oldest entries", dropped);
        }

        log.debug("Query {} completed in {} ms", queryId, elapsedMs);

        if (elapsedMs > config.getSlowQueryThresholdMs()) {
            slowQueryRecommender.handleSlowQuery(sql, elapsedMs, analysis);
        }
    }

    private void recordFailure(String queryId, String sql, long elapsedMs, Throwable error) {
        Instant now = clock.instant();
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();

        state.updateMetrics(queryId,
                () -> QueryMetrics.seed(queryId, preview(sql), analyzer.analyze(sql)),
                metrics -> metrics.recordFailure(message, now));

        log.debug("Query {} failed after {} ms: {}", queryId, elapsedMs, message);
        eventBus.publish(EventChannel.QUERY_ERROR, new QueryErrorEvent(queryId, sql, elapsedMs, message, now));
    }

    private String preview(String sql) {
        if (sql == null) {
            return null;
        }
        int limit = config.getSqlPreviewLength();
        return sql.length() > limit ? sql.substring(0, limit) : sql;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
