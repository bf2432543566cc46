package org.carball.queryopt.store;

import org.carball.queryopt.analyzer.QueryAnalyzer;
import org.carball.queryopt.config.OptimizerConfig;
import org.carball.queryopt.model.query.QueryMetrics;
import org.carball.queryopt.testutil.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

public class OptimizerStateTest {

    private static final String SQL = "SELECT id FROM events WHERE status = 'open'";

    private final QueryAnalyzer analyzer = new QueryAnalyzer();
    private TestClock clock;
    private OptimizerState state;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        state = new OptimizerState(OptimizerConfig.defaults());
    }

    private void recordSuccess(String queryId, long durationMs) {
        state.updateMetrics(queryId, () -> QueryMetrics.seed(queryId, SQL, analyzer.analyze(SQL)),
                m -> m.recordSuccess(durationMs, clock.instant()));
    }

    @Test
    void shouldNotLoseConcurrentUpdates() throws Exception {
        // Given
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    startGate.await();
                    for (int j = 0; j < 250; j++) {
                        recordSuccess("a1b2c3d4", 2);
                    }
                    return null;
                }));
            }
            startGate.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        // Then
        QueryMetrics metrics = state.findMetrics("a1b2c3d4").orElseThrow();
        assertThat(metrics.getTotalExecutions()).isEqualTo(2000);
        assertThat(metrics.getSuccessfulExecutions()).isEqualTo(2000);
        assertThat(metrics.getTotalTime()).isEqualTo(4000);
        assertThat(state.metricsCount()).isEqualTo(1);
    }

    @Test
    void shouldHandOutCopies() {
        // Given
        recordSuccess("a1b2c3d4", 10);

        // When
        state.findMetrics("a1b2c3d4").orElseThrow().setTotalExecutions(999);

        // Then
        assertThat(state.findMetrics("a1b2c3d4").orElseThrow().getTotalExecutions()).isEqualTo(1);
    }

    @Test
    void shouldSkipEntriesWithoutIdentityOnReplace() {
        // Given
        recordSuccess("a1b2c3d4", 10);
        QueryMetrics imported = QueryMetrics.seed("e5f6a7b8", SQL, analyzer.analyze(SQL));
        QueryMetrics anonymous = new QueryMetrics();

        // When
        state.replaceMetrics(List.of(imported, anonymous));

        // Then
        assertThat(state.metricsSnapshot()).extracting(QueryMetrics::getQueryId).containsExactly("e5f6a7b8");
    }

    @Test
    void shouldKeepIndexRecommendationsUniqueAndOrdered() {
        // When
        boolean first = state.addIndexRecommendation("CREATE INDEX IF NOT EXISTS idx_tickets_qr_code ON tickets(qr_code)");
        state.addIndexRecommendation("CREATE INDEX IF NOT EXISTS idx_tickets_order_id ON tickets(order_id)");
        boolean repeated = state.addIndexRecommendation("CREATE INDEX IF NOT EXISTS idx_tickets_qr_code ON tickets(qr_code)");

        // Then
        assertThat(first).isTrue();
        assertThat(repeated).isFalse();
        assertThat(state.indexRecommendationsSnapshot()).containsExactly(
                "CREATE INDEX IF NOT EXISTS idx_tickets_qr_code ON tickets(qr_code)",
                "CREATE INDEX IF NOT EXISTS idx_tickets_order_id ON tickets(order_id)");
    }

    @Test
    void shouldRemoveMatchingMetrics() {
        // Given
        recordSuccess("a1b2c3d4", 10);
        recordSuccess("e5f6a7b8", 300);

        // When
        int removed = state.removeMetricsIf(m -> m.getAvgTime() > 100);

        // Then
        assertThat(removed).isEqualTo(1);
        assertThat(state.findMetrics("e5f6a7b8")).isEmpty();
    }

    @Test
    void shouldClearEverything() {
        // Given
        recordSuccess("a1b2c3d4", 10);
        state.addIndexRecommendation("CREATE INDEX IF NOT EXISTS idx_tickets_qr_code ON tickets(qr_code)");
        state.getPreparedStatements().getOrCreate("a1b2c3d4", SQL, clock.instant());

        // When
        state.clear();

        // Then
        assertThat(state.metricsCount()).isZero();
        assertThat(state.indexRecommendationsSnapshot()).isEmpty();
        assertThat(state.getPreparedStatements().size()).isZero();
        assertThat(state.getLatestOpportunities()).isEmpty();
    }
}
