package org.carball.queryopt;

import lombok.extern.slf4j.Slf4j;
import org.carball.queryopt.analyzer.DeepAnalysisEngine;
import org.carball.queryopt.analyzer.QueryAnalyzer;
import org.carball.queryopt.analyzer.QueryIdentity;
import org.carball.queryopt.config.OptimizerConfig;
import org.carball.queryopt.driver.DatabaseDriver;
import org.carball.queryopt.driver.DatabaseType;
import org.carball.queryopt.driver.QueryResult;
import org.carball.queryopt.driver.Statement;
import org.carball.queryopt.event.EventBus;
import org.carball.queryopt.event.EventChannel;
import org.carball.queryopt.model.analysis.DeepAnalysisResult;
import org.carball.queryopt.model.analysis.MemoryEstimate;
import org.carball.queryopt.model.analysis.OptimizationOpportunity;
import org.carball.queryopt.model.analysis.PerformanceAnalysis;
import org.carball.queryopt.model.query.PreparedHandle;
import org.carball.queryopt.model.query.QueryAnalysis;
import org.carball.queryopt.model.report.MetricsSnapshot;
import org.carball.queryopt.model.report.PerformanceReport;
import org.carball.queryopt.monitor.PerformanceMonitor;
import org.carball.queryopt.output.PerformanceReporter;
import org.carball.queryopt.recommend.IndexRecommendationBuilder;
import org.carball.queryopt.recommend.SlowQueryRecommender;
import org.carball.queryopt.store.OptimizerState;
import org.carball.queryopt.tracking.ExecutionTracker;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Tracks and analyzes every statement executed through one database driver.
 * <p>
 * Each instance owns all of its state. Monitoring starts on construction when
 * {@link OptimizerConfig#isEnableMonitoring()} is set; {@link #close()} stops it.
 */
@Slf4j
public class QueryOptimizer implements AutoCloseable {

    private final OptimizerConfig config;
    private final Clock clock;
    private final DatabaseType databaseType;
    private final OptimizerState state;
    private final EventBus eventBus;
    private final QueryAnalyzer analyzer;
    private final ExecutionTracker tracker;
    private final DeepAnalysisEngine deepAnalysisEngine;
    private final PerformanceReporter reporter;
    private final PerformanceMonitor monitor;

    public QueryOptimizer(DatabaseDriver driver) {
        this(driver, OptimizerConfig.defaults());
    }

    public QueryOptimizer(DatabaseDriver driver, OptimizerConfig config) {
        this(driver, config, Clock.systemUTC(), System::nanoTime, null);
    }

    /**
     * Creates an optimizer with an explicit clock, duration source and scheduler.
     * The clock stamps recorded entries; {@code nanoTime} measures execution time and must be monotonic.
     * A null scheduler makes the optimizer create and own a daemon scheduler.
     */
    public QueryOptimizer(DatabaseDriver driver, OptimizerConfig config, Clock clock, LongSupplier nanoTime,
                          ScheduledExecutorService scheduler) {
        Objects.requireNonNull(driver, "driver");
        Objects.requireNonNull(nanoTime, "nanoTime");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.databaseType = DatabaseType.fromConnectionString(driver.getConnectionString());
        this.state = new OptimizerState(config);
        this.eventBus = new EventBus();
        this.analyzer = new QueryAnalyzer();

        SlowQueryRecommender recommender = new SlowQueryRecommender(state, eventBus,
                new IndexRecommendationBuilder(databaseType), clock);
        this.tracker = new ExecutionTracker(driver, analyzer, state, recommender, eventBus, config, clock,
                nanoTime);
        this.deepAnalysisEngine = new DeepAnalysisEngine(state, eventBus, config, clock);
        this.reporter = new PerformanceReporter(state, deepAnalysisEngine, eventBus, config, clock);
        this.monitor = scheduler != null
                ? new PerformanceMonitor(reporter, deepAnalysisEngine, eventBus, config, clock, scheduler)
                : new PerformanceMonitor(reporter, deepAnalysisEngine, eventBus, config, clock);

        log.info("Initialized QueryOptimizer for {} with config: {}", databaseType, config.getConfigurationSummary());

        if (config.isEnableMonitoring()) {
            monitor.start();
        }
    }

    // Execution

    public CompletableFuture<QueryResult> executeWithTracking(String sql) {
        return tracker.executeWithTracking(sql, List.of());
    }

    public CompletableFuture<QueryResult> executeWithTracking(String sql, List<Object> args) {
        return tracker.executeWithTracking(sql, args);
    }

    public CompletableFuture<QueryResult> executeWithTracking(Statement statement) {
        return tracker.executeWithTracking(statement.sql(), statement.args());
    }

    /**
     * Returns the prepared handle for a hot statement, creating or touching it.
     * Empty when caching is disabled or the statement has run fewer than
     * {@code hotQueryExecutionThreshold} times.
     */
    public Optional<PreparedHandle> getPreparedStatement(String sql) {
        if (!config.isCacheQueries()) {
            return Optional.empty();
        }
        String queryId = QueryIdentity.of(sql);
        boolean hot = state.findMetrics(queryId)
                .map(m -> m.getTotalExecutions() >= config.getHotQueryExecutionThreshold())
                .orElse(false);
        if (!hot) {
            return Optional.empty();
        }
        return Optional.of(state.getPreparedStatements().getOrCreate(queryId, sql, clock.instant()).copy());
    }

    // Analysis

    public QueryAnalysis analyzeQuery(String sql) {
        return analyzer.analyze(sql);
    }

    public String queryId(String sql) {
        return QueryIdentity.of(sql);
    }

    public PerformanceAnalysis analyzePerformance() {
        return reporter.analyzePerformance();
    }

    public DeepAnalysisResult performDeepAnalysis() {
        return deepAnalysisEngine.performDeepAnalysis();
    }

    public List<OptimizationOpportunity> getOptimizationOpportunities() {
        return deepAnalysisEngine.getOptimizationOpportunities();
    }

    // Reporting

    public PerformanceReport generatePerformanceReport() {
        return reporter.generatePerformanceReport(monitor.isMonitoring());
    }

    public MemoryEstimate estimateMemoryUsage() {
        return reporter.estimateMemoryUsage();
    }

    // Lifecycle

    public boolean startPerformanceMonitoring() {
        return monitor.start();
    }

    public boolean stopPerformanceMonitoring() {
        return monitor.stop();
    }

    public boolean isMonitoring() {
        return monitor.isMonitoring();
    }

    public int cleanupOldMetrics() {
        return reporter.cleanupOldMetrics();
    }

    public MetricsSnapshot exportMetrics() {
        return reporter.exportMetrics();
    }

    public void importMetrics(MetricsSnapshot snapshot) {
        reporter.importMetrics(snapshot);
    }

    public String exportMetricsJson() {
        return reporter.exportMetricsJson();
    }

    public void importMetricsJson(String json) {
        reporter.importMetricsJson(json);
    }

    public void resetMetrics() {
        reporter.resetMetrics();
    }

    // Notifications

    public <T> EventBus.Subscription subscribe(EventChannel<T> channel, Consumer<? super T> handler) {
        return eventBus.subscribe(channel, handler);
    }

    public DatabaseType getDatabaseType() {
        return databaseType;
    }

    public OptimizerConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        monitor.close();
        log.info("QueryOptimizer closed");
    }
}
