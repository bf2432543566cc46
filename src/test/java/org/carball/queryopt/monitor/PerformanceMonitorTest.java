package org.carball.queryopt.monitor;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.queryopt.analyzer.DeepAnalysisEngine;
import org.carball.queryopt.analyzer.QueryAnalyzer;
import org.carball.queryopt.analyzer.QueryIdentity;
import org.carball.queryopt.config.OptimizerConfig;
import org.carball.queryopt.event.EventBus;
import org.carball.queryopt.event.EventChannel;
import org.carball.queryopt.model.analysis.PerformanceAnalysis;
import org.carball.queryopt.model.analysis.PerformanceDegradation;
import org.carball.queryopt.model.query.QueryMetrics;
import org.carball.queryopt.output.PerformanceReporter;
import org.carball.queryopt.store.OptimizerState;
import org.carball.queryopt.testutil.TestClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

public class PerformanceMonitorTest {

    private final QueryAnalyzer analyzer = new QueryAnalyzer();
    private TestClock clock;
    private OptimizerConfig config;
    private OptimizerState state;
    private EventBus eventBus;
    private DeepAnalysisEngine engine;
    private PerformanceReporter reporter;
    private ScheduledThreadPoolExecutor scheduler;
    private PerformanceMonitor monitor;

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        config = OptimizerConfig.defaults();
        state = new OptimizerState(config);
        eventBus = new EventBus();
        engine = new DeepAnalysisEngine(state, eventBus, config, clock);
        reporter = new PerformanceReporter(state, engine, eventBus, config, clock);
        scheduler = new ScheduledThreadPoolExecutor(1);
        scheduler.setRemoveOnCancelPolicy(true);
        monitor = new PerformanceMonitor(reporter, engine, eventBus, config, clock, scheduler);

        logger = (Logger) LoggerFactory.getLogger(PerformanceMonitor.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
        scheduler.shutdownNow();
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldStartOnlyOnce() {
        // When
        boolean first = monitor.start();
        boolean second = monitor.start();

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(monitor.isMonitoring()).isTrue();
        assertThat(scheduler.getQueue()).hasSize(2);
    }

    @Test
    void shouldRefuseToStartWithNonPositiveInterval() {
        // Given
        OptimizerConfig broken = OptimizerConfig.builder().monitoringIntervalMs(0).build();
        PerformanceMonitor brokenMonitor = new PerformanceMonitor(reporter, engine, eventBus, broken, clock, scheduler);

        // When
        boolean started = brokenMonitor.start();

        // Then
        assertThat(started).isFalse();
        assertThat(brokenMonitor.isMonitoring()).isFalse();
        assertThat(scheduler.getQueue()).isEmpty();
        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Performance monitoring not started: intervals must be positive "
                        + "(monitoring 0 ms, deep analysis 300000 ms)");
    }

    @Test
    void shouldCancelBothTasksOnStop() {
        // Given
        monitor.start();

        // When
        boolean stopped = monitor.stop();
        boolean stoppedAgain = monitor.stop();

        // Then
        assertThat(stopped).isTrue();
        assertThat(stoppedAgain).isFalse();
        assertThat(monitor.isMonitoring()).isFalse();
        assertThat(scheduler.getQueue()).isEmpty();
    }

    @Test
    void shouldRestartAfterStop() {
        // Given
        monitor.start();
        monitor.stop();

        // When / Then
        assertThat(monitor.start()).isTrue();
        assertThat(scheduler.getQueue()).hasSize(2);
    }

    @Test
    void shouldLeaveInjectedSchedulerRunningOnClose() {
        // Given
        monitor.start();

        // When
        monitor.close();

        // Then
        assertThat(monitor.isMonitoring()).isFalse();
        assertThat(scheduler.isShutdown()).isFalse();
    }

    @Test
    void shouldRunScheduledCyclesPeriodically() throws InterruptedException {
        // Given
        OptimizerConfig fast = OptimizerConfig.builder().monitoringIntervalMs(10).deepAnalysisIntervalMs(10).build();
        PerformanceMonitor fastMonitor = new PerformanceMonitor(reporter, engine, eventBus, fast, clock, scheduler);
        CountDownLatch analyses = new CountDownLatch(3);
        CountDownLatch deepAnalyses = new CountDownLatch(2);
        eventBus.subscribe(EventChannel.PERFORMANCE_ANALYSIS, a -> analyses.countDown());
        eventBus.subscribe(EventChannel.DEEP_ANALYSIS, a -> deepAnalyses.countDown());

        // When
        fastMonitor.start();

        // Then
        try {
            assertThat(analyses.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(deepAnalyses.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            fastMonitor.stop();
        }
    }

    @Test
    void shouldPublishDegradationWhenErrorRateIsHigh() {
        // Given
        String sql = "SELECT name FROM users WHERE id = 1";
        String id = QueryIdentity.of(sql);
        for (int i = 0; i < 9; i++) {
            state.updateMetrics(id, () -> QueryMetrics.seed(id, sql, analyzer.analyze(sql)),
                    m -> m.recordSuccess(5, clock.instant()));
        }
        state.updateMetrics(id, () -> QueryMetrics.seed(id, sql, analyzer.analyze(sql)),
                m -> m.recordFailure("disk I/O error", clock.instant()));
        List<PerformanceDegradation> degradations = new ArrayList<>();
        eventBus.subscribe(EventChannel.PERFORMANCE_DEGRADATION, degradations::add);

        // When
        monitor.runMonitoringCycle();

        // Then
        assertThat(degradations).hasSize(1);
        assertThat(degradations.get(0).errorRate()).isEqualTo(10.0);
        assertThat(logAppender.list).anyMatch(e -> e.getLevel() == Level.WARN
                && e.getFormattedMessage().contains("Performance degradation detected"));
    }

    @Test
    void shouldNotPublishDegradationForHealthyWorkload() {
        // Given
        PerformanceAnalysis healthy = new PerformanceAnalysis(1, 100, Map.of(), List.of(),
                10.0, 5.0, 12.0, clock.instant());
        List<PerformanceDegradation> degradations = new ArrayList<>();
        eventBus.subscribe(EventChannel.PERFORMANCE_DEGRADATION, degradations::add);

        // When
        boolean degraded = monitor.checkDegradation(healthy).isPresent();

        // Then
        assertThat(degraded).isFalse();
        assertThat(degradations).isEmpty();
    }

    @Test
    void shouldCleanUpStaleMetricsDuringMonitoringCycle() {
        // Given
        String sql = "SELECT name FROM users WHERE id = 1";
        String id = QueryIdentity.of(sql);
        state.updateMetrics(id, () -> QueryMetrics.seed(id, sql, analyzer.analyze(sql)),
                m -> m.recordSuccess(5, clock.instant()));
        clock.advance(Duration.ofHours(48));

        // When
        monitor.runMonitoringCycle();

        // Then
        assertThat(state.metricsCount()).isZero();
    }

    @Test
    void shouldLogAndSwallowCycleFailures() {
        // Given
        PerformanceReporter failingReporter = new PerformanceReporter(state, engine, eventBus, config, clock) {
            @Override
            public PerformanceAnalysis analyzePerformance() {
                throw new IllegalStateException("no such column: checked_in_at");
            }
        };
        PerformanceMonitor failingMonitor = new PerformanceMonitor(failingReporter, engine, eventBus, config,
                clock, scheduler);

        // When / Then
        assertThatCode(failingMonitor::runMonitoringCycle).doesNotThrowAnyException();
        assertThat(logAppender.list).anyMatch(e -> e.getLevel() == Level.ERROR
                && e.getFormattedMessage().contains("Performance monitoring cycle failed"));
    }
}
