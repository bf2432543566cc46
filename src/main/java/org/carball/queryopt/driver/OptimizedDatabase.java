package org.carball.queryopt.driver;

import org.carball.queryopt.QueryOptimizer;
import org.carball.queryopt.config.OptimizerConfig;
import org.carball.queryopt.model.report.PerformanceReport;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A driver whose executions are tracked by a {@link QueryOptimizer}.
 * Results and failures reach the caller exactly as the wrapped driver produced them.
 */
public class OptimizedDatabase implements DatabaseDriver, AutoCloseable {

    private final DatabaseDriver delegate;
    private final QueryOptimizer optimizer;

    OptimizedDatabase(DatabaseDriver delegate, QueryOptimizer optimizer) {
        this.delegate = delegate;
        this.optimizer = optimizer;
    }

    public static OptimizedDatabase wrap(DatabaseDriver driver) {
        return wrap(driver, OptimizerConfig.defaults());
    }

    public static OptimizedDatabase wrap(DatabaseDriver driver, OptimizerConfig config) {
        Objects.requireNonNull(driver, "driver");
        return new OptimizedDatabase(driver, new QueryOptimizer(driver, config));
    }

    @Override
    public CompletableFuture<QueryResult> execute(String sql, List<Object> args) {
        return optimizer.executeWithTracking(sql, args);
    }

    @Override
    public String getConnectionString() {
        return delegate.getConnectionString();
    }

    public PerformanceReport getPerformanceReport() {
        return optimizer.generatePerformanceReport();
    }

    public QueryOptimizer getQueryOptimizer() {
        return optimizer;
    }

    public void resetPerformanceMetrics() {
        optimizer.resetMetrics();
    }

    /**
     * The wrapped driver, for executions that should bypass tracking.
     */
    public DatabaseDriver getDelegate() {
        return delegate;
    }

    @Override
    public void close() {
        optimizer.close();
    }
}
