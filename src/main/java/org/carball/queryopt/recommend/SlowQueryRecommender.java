package org.carball.queryopt.recommend;

import lombok.extern.slf4j.Slf4j;
import org.carball.queryopt.event.EventBus;
import org.carball.queryopt.event.EventChannel;
import org.carball.queryopt.model.query.QueryAnalysis;
import org.carball.queryopt.model.query.SlowQueryEntry;
import org.carball.queryopt.store.OptimizerState;

import java.time.Clock;

/**
 * Records slow executions and accumulates index suggestions for them.
 */
@Slf4j
public class SlowQueryRecommender {

    private final OptimizerState state;
    private final EventBus eventBus;
    private final IndexRecommendationBuilder indexBuilder;
    private final Clock clock;

    public SlowQueryRecommender(OptimizerState state, EventBus eventBus,
                                IndexRecommendationBuilder indexBuilder, Clock clock) {
        this.state = state;
        this.eventBus = eventBus;
        this.indexBuilder = indexBuilder;
        this.clock = clock;
    }

    /**
     * Logs the slow execution, notifies subscribers and, for index-sensitive categories,
     * adds an index suggestion. Adding a known suggestion again has no effect.
     */
    public void handleSlowQuery(String sql, long elapsedMs, QueryAnalysis analysis) {
        SlowQueryEntry entry = new SlowQueryEntry(sql, elapsedMs, analysis.category(),
                analysis.complexity(), analysis.optimizations(), clock.instant());

        int dropped = state.getSlowQueryLog().append(entry);
        if (dropped > 0) {
            log.debug("Slow query log at capacity, dropped {} oldest entries", dropped);
        }

        log.warn("Slow query detected ({} ms, {}): {}", elapsedMs, analysis.category(), preview(sql));
        eventBus.publish(EventChannel.SLOW_QUERY, entry);

        if (analysis.category().isIndexSensitive()) {
            indexBuilder.build(sql, analysis.category()).ifPresent(indexSql -> {
                if (state.addIndexRecommendation(indexSql)) {
                    log.info("New index recommendation: {}", indexSql);
                }
            });
        }
    }

    private static String preview(String sql) {
        if (sql == null) {
            return "";
        }
        return sql.length() > 100 ? sql.substring(0, 100) + "..." : sql;
    }
}
