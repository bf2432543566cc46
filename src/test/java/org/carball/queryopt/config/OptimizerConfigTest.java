package org.carball.queryopt.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

public class OptimizerConfigTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(OptimizerConfig.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setLevel(null);
        logger.setAdditive(true);
    }

    @Test
    void shouldCreateDefaultConfig() {
        // When
        OptimizerConfig config = OptimizerConfig.defaults();

        // Then
        assertThat(config.getSlowQueryThresholdMs()).isEqualTo(100);
        assertThat(config.getIndexingCandidateAvgMs()).isEqualTo(50.0);
        assertThat(config.getProblematicQueryAvgMs()).isEqualTo(100.0);
        assertThat(config.getHotQueryExecutionThreshold()).isEqualTo(10);
        assertThat(config.getMaxPreparedStatements()).isEqualTo(10);
        assertThat(config.isCacheQueries()).isTrue();
        assertThat(config.getCachingFrequencyThreshold()).isEqualTo(100);
        assertThat(config.getNPlusOneMinExecutions()).isEqualTo(10);
        assertThat(config.getNPlusOneWindowMs()).isEqualTo(1000);
        assertThat(config.getDegradationSlowQueryPercentage()).isEqualTo(10.0);
        assertThat(config.getDegradationErrorRate()).isEqualTo(5.0);
        assertThat(config.getMetricsRetentionHours()).isEqualTo(24);
        assertThat(config.getMaxSlowQueryLog()).isEqualTo(1000);
        assertThat(config.getMaxPerformanceHistory()).isEqualTo(10000);
        assertThat(config.isEnableMonitoring()).isTrue();
        assertThat(config.getMonitoringIntervalMs()).isEqualTo(60_000);
        assertThat(config.getDeepAnalysisIntervalMs()).isEqualTo(300_000);
    }

    @Test
    void shouldValidateDefaultsWithoutWarnings() {
        // Given
        OptimizerConfig config = OptimizerConfig.defaults();

        // When
        config.validate();

        // Then
        assertThat(logAppender.list).hasSize(1);
        assertThat(logAppender.list.get(0).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(logAppender.list.get(0).getFormattedMessage())
                .contains("Using thresholds - Slow: 100 ms, Hot: 10, Cache size: 10, Retention: 24 h");
    }

    @Test
    void shouldWarnAboutNPlusOneMinimumBelowTwo() {
        // Given
        OptimizerConfig config = OptimizerConfig.builder().nPlusOneMinExecutions(1).build();

        // When
        config.validate();

        // Then
        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("N+1 minimum executions (1) should be at least 2");
    }

    @Test
    void shouldWarnAboutInconsistentThresholds() {
        // Given
        OptimizerConfig config = OptimizerConfig.builder()
                .slowQueryThresholdMs(40)
                .maxPreparedStatements(0)
                .deepAnalysisIntervalMs(1_000)
                .build();

        // When
        config.validate();

        // Then
        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly(
                        "Indexing candidate threshold (50.0 ms) should not exceed slow query threshold (40 ms)",
                        "Max prepared statements (0) should be positive",
                        "Deep analysis interval (1000 ms) should not be shorter than monitoring interval (60000 ms)");
    }

    @Test
    void shouldWarnAboutNonPositiveSlowQueryThreshold() {
        // Given
        OptimizerConfig config = OptimizerConfig.builder()
                .slowQueryThresholdMs(0)
                .indexingCandidateAvgMs(0.0)
                .build();

        // When
        config.validate();

        // Then
        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Slow query threshold (0 ms) should be positive");
    }

    @Test
    void shouldWarnAboutNonPositiveIntervals() {
        // Given
        OptimizerConfig zeroMonitoring = OptimizerConfig.builder().monitoringIntervalMs(0).build();
        OptimizerConfig negativeDeep = OptimizerConfig.builder().deepAnalysisIntervalMs(-5).build();

        // When
        zeroMonitoring.validate();
        negativeDeep.validate();

        // Then
        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly(
                        "Monitoring interval (0 ms) should be positive; monitoring cannot start",
                        "Deep analysis interval (-5 ms) should be positive; monitoring cannot start",
                        "Deep analysis interval (-5 ms) should not be shorter than monitoring interval (60000 ms)");
        assertThat(zeroMonitoring.hasSchedulableIntervals()).isFalse();
        assertThat(negativeDeep.hasSchedulableIntervals()).isFalse();
        assertThat(OptimizerConfig.defaults().hasSchedulableIntervals()).isTrue();
    }

    @Test
    void shouldDescribeConfiguration() {
        // Given
        OptimizerConfig config = OptimizerConfig.builder()
                .slowQueryThresholdMs(250)
                .enableMonitoring(false)
                .build();

        // When
        String summary = config.getConfigurationSummary();

        // Then
        assertThat(summary).startsWith("Slow: 250 ms | Indexing: ");
        assertThat(summary).contains("Hot: 10 | Cache: 10 | Retention: 24 h | Monitoring: off");
    }

    @Test
    void shouldCopyWithOverridesThroughBuilder() {
        // Given
        OptimizerConfig original = OptimizerConfig.defaults();

        // When
        OptimizerConfig copy = original.toBuilder().maxTrackedQueries(50).build();

        // Then
        assertThat(copy.getMaxTrackedQueries()).isEqualTo(50);
        assertThat(original.getMaxTrackedQueries()).isEqualTo(1000);
        assertThat(copy.getSlowQueryThresholdMs()).isEqualTo(original.getSlowQueryThresholdMs());
    }
}
