package org.carball.queryopt.monitor;

import lombok.extern.slf4j.Slf4j;
import org.carball.queryopt.analyzer.DeepAnalysisEngine;
import org.carball.queryopt.config.OptimizerConfig;
import org.carball.queryopt.event.EventBus;
import org.carball.queryopt.event.EventChannel;
import org.carball.queryopt.model.analysis.PerformanceAnalysis;
import org.carball.queryopt.model.analysis.PerformanceDegradation;
import org.carball.queryopt.output.PerformanceReporter;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the periodic monitoring and deep analysis tasks.
 * Task failures are logged and the schedule keeps running.
 */
@Slf4j
public class PerformanceMonitor implements AutoCloseable {

    private final PerformanceReporter reporter;
    private final DeepAnalysisEngine deepAnalysisEngine;
    private final EventBus eventBus;
    private final OptimizerConfig config;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private ScheduledFuture<?> monitoringTask;
    private ScheduledFuture<?> deepAnalysisTask;

    /**
     * Creates a monitor running on its own daemon thread.
     */
    public PerformanceMonitor(PerformanceReporter reporter, DeepAnalysisEngine deepAnalysisEngine,
                              EventBus eventBus, OptimizerConfig config, Clock clock) {
        this(reporter, deepAnalysisEngine, eventBus, config, clock, createDaemonScheduler(), true);
    }

    /**
     * Creates a monitor on a caller-owned scheduler, which {@link #close()} leaves running.
     */
    public PerformanceMonitor(PerformanceReporter reporter, DeepAnalysisEngine deepAnalysisEngine,
                              EventBus eventBus, OptimizerConfig config, Clock clock,
                              ScheduledExecutorService scheduler) {
        this(reporter, deepAnalysisEngine, eventBus, config, clock, scheduler, false);
    }

    private PerformanceMonitor(PerformanceReporter reporter, DeepAnalysisEngine deepAnalysisEngine,
                               EventBus eventBus, OptimizerConfig config, Clock clock,
                               ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.reporter = reporter;
        this.deepAnalysisEngine = deepAnalysisEngine;
        this.eventBus = eventBus;
        this.config = config;
        this.clock = clock;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
    }

    /**
     * Schedules both periodic tasks. Has no effect when already running
     * or when either interval is not positive.
     *
     * @return true if monitoring was started by this call
     */
    public synchronized boolean start() {
        if (isMonitoring()) {
            log.debug("Performance monitoring already running");
            return false;
        }
        if (!config.hasSchedulableIntervals()) {
            log.warn("Performance monitoring not started: intervals must be positive (monitoring {} ms, deep analysis {} ms)",
                    config.getMonitoringIntervalMs(), config.getDeepAnalysisIntervalMs());
            return false;
        }

        long monitoringInterval = config.getMonitoringIntervalMs();
        long deepAnalysisInterval = config.getDeepAnalysisIntervalMs();

        monitoringTask = scheduler.scheduleWithFixedDelay(this::runMonitoringCycle,
                monitoringInterval, monitoringInterval, TimeUnit.MILLISECONDS);
        deepAnalysisTask = scheduler.scheduleWithFixedDelay(this::runDeepAnalysisCycle,
                deepAnalysisInterval, deepAnalysisInterval, TimeUnit.MILLISECONDS);

        log.info("Performance monitoring started (every {} ms, deep analysis every {} ms)",
                monitoringInterval, deepAnalysisInterval);
        return true;
    }

    /**
     * Cancels both periodic tasks. Has no effect when not running.
     *
     * @return true if monitoring was stopped by this call
     */
    public synchronized boolean stop() {
        if (!isMonitoring()) {
            return false;
        }
        monitoringTask.cancel(false);
        deepAnalysisTask.cancel(false);
        monitoringTask = null;
        deepAnalysisTask = null;
        log.info("Performance monitoring stopped");
        return true;
    }

    public synchronized boolean isMonitoring() {
        return monitoringTask != null;
    }

    /**
     * One lightweight pass: performance analysis, degradation check and stale state cleanup.
     */
    public void runMonitoringCycle() {
        try {
            PerformanceAnalysis analysis = reporter.analyzePerformance();
            checkDegradation(analysis);
            reporter.cleanupOldMetrics();
        } catch (RuntimeException e) {
            log.error("Performance monitoring cycle failed", e);
        }
    }

    public void runDeepAnalysisCycle() {
        try {
            deepAnalysisEngine.performDeepAnalysis();
        } catch (RuntimeException e) {
            log.error("Deep analysis cycle failed", e);
        }
    }

    /**
     * Publishes a degradation event when the slow query percentage or error rate is above its limit.
     */
    public Optional<PerformanceDegradation> checkDegradation(PerformanceAnalysis analysis) {
        boolean tooManySlow = analysis.slowQueryPercentage() > config.getDegradationSlowQueryPercentage();
        boolean tooManyErrors = analysis.errorRate() > config.getDegradationErrorRate();
        if (!tooManySlow && !tooManyErrors) {
            return Optional.empty();
        }

        PerformanceDegradation degradation = new PerformanceDegradation(analysis.slowQueryPercentage(),
                analysis.errorRate(), analysis.avgExecutionTime(), clock.instant());
        log.warn("Performance degradation detected - slow: {}%, errors: {}%, avg: {} ms",
                String.format("%.1f", degradation.slowQueryPercentage()),
                String.format("%.1f", degradation.errorRate()),
                String.format("%.1f", degradation.avgExecutionTime()));
        eventBus.publish(EventChannel.PERFORMANCE_DEGRADATION, degradation);
        return Optional.of(degradation);
    }

    @Override
    public void close() {
        stop();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    private static ScheduledExecutorService createDaemonScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "query-optimizer-monitor");
            t.setDaemon(true);
            return t;
        });
    }
}
