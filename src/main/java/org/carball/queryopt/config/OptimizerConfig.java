package org.carball.queryopt.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Slf4j
public class OptimizerConfig {

    // Latency thresholds
    @Builder.Default
    @JsonProperty("slow_query_threshold_ms")
    private long slowQueryThresholdMs = 100;

    @Builder.Default
    @JsonProperty("indexing_candidate_avg_ms")
    private double indexingCandidateAvgMs = 50.0;

    @Builder.Default
    @JsonProperty("problematic_query_avg_ms")
    private double problematicQueryAvgMs = 100.0;

    // Prepared statement cache
    @Builder.Default
    @JsonProperty("hot_query_execution_threshold")
    private int hotQueryExecutionThreshold = 10;

    @Builder.Default
    @JsonProperty("max_prepared_statements")
    private int maxPreparedStatements = 10;

    @Builder.Default
    @JsonProperty("cache_queries")
    private boolean cacheQueries = true;

    // Deep analysis
    @Builder.Default
    @JsonProperty("caching_frequency_threshold")
    private long cachingFrequencyThreshold = 100;

    @Builder.Default
    @JsonProperty("n_plus_one_min_executions")
    private int nPlusOneMinExecutions = 10;

    @Builder.Default
    @JsonProperty("n_plus_one_window_ms")
    private long nPlusOneWindowMs = 1000;

    @Builder.Default
    @JsonProperty("slow_query_opportunity_threshold")
    private int slowQueryOpportunityThreshold = 10;

    // Degradation detection
    @Builder.Default
    @JsonProperty("degradation_slow_query_percentage")
    private double degradationSlowQueryPercentage = 10.0;

    @Builder.Default
    @JsonProperty("degradation_error_rate")
    private double degradationErrorRate = 5.0;

    // Retention and caps
    @Builder.Default
    @JsonProperty("metrics_retention_hours")
    private long metricsRetentionHours = 24;

    @Builder.Default
    @JsonProperty("max_tracked_queries")
    private int maxTrackedQueries = 1000;

    @Builder.Default
    @JsonProperty("max_slow_query_log")
    private int maxSlowQueryLog = 1000;

    @Builder.Default
    @JsonProperty("max_performance_history")
    private int maxPerformanceHistory = 10000;

    @Builder.Default
    @JsonProperty("sql_preview_length")
    private int sqlPreviewLength = 200;

    // Monitoring schedule
    @Builder.Default
    @JsonProperty("enable_monitoring")
    private boolean enableMonitoring = true;

    @Builder.Default
    @JsonProperty("monitoring_interval_ms")
    private long monitoringIntervalMs = 60_000;

    @Builder.Default
    @JsonProperty("deep_analysis_interval_ms")
    private long deepAnalysisIntervalMs = 300_000;

    /**
     * Creates the default configuration.
     */
    public static OptimizerConfig defaults() {
        return OptimizerConfig.builder().build();
    }

    /**
     * Validates the configuration and logs warnings for potentially problematic values.
     */
    public void validate() {
        if (slowQueryThresholdMs <= 0) {
            log.warn("Slow query threshold ({} ms) should be positive", slowQueryThresholdMs);
        }

        if (indexingCandidateAvgMs > slowQueryThresholdMs) {
            log.warn("Indexing candidate threshold ({} ms) should not exceed slow query threshold ({} ms)",
                    indexingCandidateAvgMs, slowQueryThresholdMs);
        }

        if (maxPreparedStatements <= 0) {
            log.warn("Max prepared statements ({}) should be positive", maxPreparedStatements);
        }

        if (hotQueryExecutionThreshold <= 0) {
            log.warn("Hot query execution threshold ({}) should be positive", hotQueryExecutionThreshold);
        }

        if (nPlusOneMinExecutions < 2) {
            log.warn("N+1 minimum executions ({}) should be at least 2", nPlusOneMinExecutions);
        }

        if (maxSlowQueryLog > maxPerformanceHistory) {
            log.warn("Slow query log cap ({}) should not exceed performance history cap ({})",
                    maxSlowQueryLog, maxPerformanceHistory);
        }

        if (monitoringIntervalMs <= 0) {
            log.warn("Monitoring interval ({} ms) should be positive; monitoring cannot start", monitoringIntervalMs);
        }

        if (deepAnalysisIntervalMs <= 0) {
            log.warn("Deep analysis interval ({} ms) should be positive; monitoring cannot start",
                    deepAnalysisIntervalMs);
        }

        if (deepAnalysisIntervalMs < monitoringIntervalMs) {
            log.warn("Deep analysis interval ({} ms) should not be shorter than monitoring interval ({} ms)",
                    deepAnalysisIntervalMs, monitoringIntervalMs);
        }

        log.debug("Using thresholds - Slow: {} ms, Hot: {}, Cache size: {}, Retention: {} h",
                slowQueryThresholdMs, hotQueryExecutionThreshold, maxPreparedStatements, metricsRetentionHours);
    }

    /**
     * Whether both periodic intervals can be scheduled.
     */
    public boolean hasSchedulableIntervals() {
        return monitoringIntervalMs > 0 && deepAnalysisIntervalMs > 0;
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Slow: %d ms | Indexing: %.1f ms | Hot: %d | Cache: %d | Retention: %d h | Monitoring: %s",
                slowQueryThresholdMs, indexingCandidateAvgMs, hotQueryExecutionThreshold,
                maxPreparedStatements, metricsRetentionHours, enableMonitoring ? "on" : "off");
    }
}
