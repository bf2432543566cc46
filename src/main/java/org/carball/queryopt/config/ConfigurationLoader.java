package org.carball.queryopt.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_PREFIX = "QUERY_OPTIMIZER_";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration using the hierarchy: env vars > YAML file > defaults
     */
    public OptimizerConfig loadConfiguration(Path configFile) {
        return loadConfiguration(configFile, System.getenv());
    }

    /**
     * Loads configuration from the given file, overlaying the given environment.
     */
    public OptimizerConfig loadConfiguration(Path configFile, Map<String, String> env) {
        log.debug("Loading configuration");

        // 1. File or defaults
        OptimizerConfig.OptimizerConfigBuilder builder = loadFile(configFile).toBuilder();

        // 2. Environment variables (highest priority)
        applyEnvironmentVariables(builder, env);

        OptimizerConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private OptimizerConfig loadFile(Path configFile) {
        if (configFile == null) {
            log.info("No configuration file provided, using defaults");
            return OptimizerConfig.defaults();
        }

        if (!Files.exists(configFile)) {
            log.warn("Configuration file not found: {}, using defaults", configFile);
            return OptimizerConfig.defaults();
        }

        try {
            OptimizerConfig config = yamlMapper.readValue(configFile.toFile(), OptimizerConfig.class);
            log.info("Loaded optimizer configuration from: {}", configFile);
            return config;
        } catch (IOException e) {
            log.error("Failed to load configuration from {}: {}, using defaults", configFile, e.getMessage());
            return OptimizerConfig.defaults();
        }
    }

    private void applyEnvironmentVariables(OptimizerConfig.OptimizerConfigBuilder builder, Map<String, String> env) {
        for (Map.Entry<String, String> entry : env.entrySet()) {
            if (!entry.getKey().startsWith(ENV_PREFIX)) {
                continue;
            }
            String key = entry.getKey().substring(ENV_PREFIX.length());
            String value = entry.getValue().trim();

            try {
                switch (key) {
                    case "SLOW_QUERY_THRESHOLD_MS":
                        builder.slowQueryThresholdMs(Long.parseLong(value));
                        break;
                    case "INDEXING_CANDIDATE_AVG_MS":
                        builder.indexingCandidateAvgMs(Double.parseDouble(value));
                        break;
                    case "PROBLEMATIC_QUERY_AVG_MS":
                        builder.problematicQueryAvgMs(Double.parseDouble(value));
                        break;
                    case "HOT_QUERY_EXECUTION_THRESHOLD":
                        builder.hotQueryExecutionThreshold(Integer.parseInt(value));
                        break;
                    case "MAX_PREPARED_STATEMENTS":
                        builder.maxPreparedStatements(Integer.parseInt(value));
                        break;
                    case "METRICS_RETENTION_HOURS":
                        builder.metricsRetentionHours(Long.parseLong(value));
                        break;
                    case "ENABLE_MONITORING":
                        builder.enableMonitoring(Boolean.parseBoolean(value));
                        break;
                    case "MONITORING_INTERVAL_MS":
                        builder.monitoringIntervalMs(parseInterval(value));
                        break;
                    case "DEEP_ANALYSIS_INTERVAL_MS":
                        builder.deepAnalysisIntervalMs(parseInterval(value));
                        break;
                    default:
                        log.debug("Ignoring unknown environment variable {}", entry.getKey());
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", entry.getKey(), value);
            }
        }
    }

    /** Intervals feed a fixed-delay schedule, so zero and negative values are rejected like malformed ones. */
    private static long parseInterval(String value) {
        long interval = Long.parseLong(value);
        if (interval <= 0) {
            throw new NumberFormatException("Interval must be positive: " + value);
        }
        return interval;
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Optimizer Configuration Options:

            YAML keys (snake_case):
              slow_query_threshold_ms          Executions slower than this are logged as slow
              indexing_candidate_avg_ms        Average time above which a statement needs an index
              hot_query_execution_threshold    Executions before a prepared handle is created
              max_prepared_statements          Capacity of the prepared statement cache
              metrics_retention_hours          Age after which tracked state is discarded

            Environment Variables:
              QUERY_OPTIMIZER_SLOW_QUERY_THRESHOLD_MS
              QUERY_OPTIMIZER_INDEXING_CANDIDATE_AVG_MS
              QUERY_OPTIMIZER_PROBLEMATIC_QUERY_AVG_MS
              QUERY_OPTIMIZER_HOT_QUERY_EXECUTION_THRESHOLD
              QUERY_OPTIMIZER_MAX_PREPARED_STATEMENTS
              QUERY_OPTIMIZER_METRICS_RETENTION_HOURS
              QUERY_OPTIMIZER_ENABLE_MONITORING
              QUERY_OPTIMIZER_MONITORING_INTERVAL_MS
              QUERY_OPTIMIZER_DEEP_ANALYSIS_INTERVAL_MS

            Priority Order (highest to lowest):
              1. Environment variables
              2. YAML configuration file
              3. Built-in defaults
            """;
    }
}
