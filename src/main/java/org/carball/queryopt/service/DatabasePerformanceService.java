package org.carball.queryopt.service;

import lombok.extern.slf4j.Slf4j;
import org.carball.queryopt.QueryOptimizer;
import org.carball.queryopt.event.EventBus;
import org.carball.queryopt.event.EventChannel;
import org.carball.queryopt.model.analysis.DeepAnalysisResult;
import org.carball.queryopt.model.analysis.PerformanceDegradation;
import org.carball.queryopt.model.analysis.Severity;
import org.carball.queryopt.model.query.QueryErrorEvent;
import org.carball.queryopt.model.query.SlowQueryEntry;
import org.carball.queryopt.model.report.AlertType;
import org.carball.queryopt.model.report.HealthStatus;
import org.carball.queryopt.model.report.PerformanceAlert;
import org.carball.queryopt.model.report.QuickReport;
import org.carball.queryopt.model.report.ServiceHealth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns optimizer notifications into alerts and summarizes recent database health.
 */
@Slf4j
public class DatabasePerformanceService {

    static final int MAX_ALERTS = 500;
    static final int ALERTS_TRIMMED = 250;
    static final long HIGH_SEVERITY_SLOW_QUERY_MS = 100;
    static final Duration QUICK_REPORT_WINDOW = Duration.ofMinutes(5);
    static final int QUICK_REPORT_SLOW_QUERY_LIMIT = 5;
    static final double MEMORY_WARNING_MB = 100.0;
    static final int ALERT_COUNT_WARNING = 1000;

    private final QueryOptimizer optimizer;
    private final Clock clock;
    private final List<PerformanceAlert> alerts = new ArrayList<>();
    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();
    private volatile DeepAnalysisResult latestAnalysis;
    private volatile boolean active;

    public DatabasePerformanceService(QueryOptimizer optimizer) {
        this(optimizer, Clock.systemUTC());
    }

    public DatabasePerformanceService(QueryOptimizer optimizer, Clock clock) {
        this.optimizer = optimizer;
        this.clock = clock;

        subscriptions.add(optimizer.subscribe(EventChannel.SLOW_QUERY, this::handleSlowQuery));
        subscriptions.add(optimizer.subscribe(EventChannel.QUERY_ERROR, this::handleQueryError));
        subscriptions.add(optimizer.subscribe(EventChannel.PERFORMANCE_DEGRADATION, this::handleDegradation));
        subscriptions.add(optimizer.subscribe(EventChannel.DEEP_ANALYSIS, this::handleDeepAnalysis));
        this.active = true;

        log.info("Database performance service initialized");
    }

    void handleSlowQuery(SlowQueryEntry slowQuery) {
        Severity severity = slowQuery.executionTime() > HIGH_SEVERITY_SLOW_QUERY_MS ? Severity.HIGH : Severity.MEDIUM;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("executionTime", slowQuery.executionTime());
        putIfPresent(details, "category", slowQuery.category());
        putIfPresent(details, "complexity", slowQuery.complexity());
        putIfPresent(details, "sql", abbreviate(slowQuery.sql()));
        details.put("optimizationCount", slowQuery.optimizations().size());

        addAlert(new PerformanceAlert(AlertType.SLOW_QUERY, severity, timestampOrNow(slowQuery.timestamp()), details));

        if (severity == Severity.HIGH) {
            log.warn("HIGH SEVERITY: slow query detected ({} ms)", slowQuery.executionTime());
        } else {
            log.info("MEDIUM SEVERITY: slow query detected ({} ms)", slowQuery.executionTime());
        }
    }

    void handleQueryError(QueryErrorEvent error) {
        Map<String, Object> details = new LinkedHashMap<>();
        putIfPresent(details, "queryId", error.queryId());
        putIfPresent(details, "sql", error.sql());
        details.put("executionTime", error.executionTime());
        putIfPresent(details, "error", error.error());

        addAlert(new PerformanceAlert(AlertType.QUERY_ERROR, Severity.MEDIUM, timestampOrNow(error.timestamp()), details));
    }

    void handleDegradation(PerformanceDegradation degradation) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("slowQueryPercentage", degradation.slowQueryPercentage());
        details.put("errorRate", degradation.errorRate());
        details.put("avgExecutionTime", degradation.avgExecutionTime());

        addAlert(new PerformanceAlert(AlertType.PERFORMANCE_DEGRADATION, Severity.HIGH, clock.instant(), details));
        log.error("Performance degradation detected: {}", details);
    }

    void handleDeepAnalysis(DeepAnalysisResult analysis) {
        latestAnalysis = analysis;
        log.info("Deep analysis completed: {} unique queries, {} index recommendations, {} opportunities",
                analysis.totalUniqueQueries(), analysis.indexRecommendations().size(),
                analysis.optimizationOpportunities().size());
    }

    /**
     * Summarizes the alerts raised within the last five minutes.
     */
    public QuickReport generateQuickReport() {
        Instant since = clock.instant().minus(QUICK_REPORT_WINDOW);
        List<PerformanceAlert> recent = getAlerts().stream()
                .filter(alert -> alert.timestamp().isAfter(since))
                .toList();

        int slowQueries = countOfType(recent, AlertType.SLOW_QUERY);
        int queryErrors = countOfType(recent, AlertType.QUERY_ERROR);
        int degradations = countOfType(recent, AlertType.PERFORMANCE_DEGRADATION);

        List<String> issues = new ArrayList<>();
        if (slowQueries > QUICK_REPORT_SLOW_QUERY_LIMIT) {
            issues.add(slowQueries + " slow queries in last 5 minutes");
        }
        if (queryErrors > 0) {
            issues.add(queryErrors + " query errors in last 5 minutes");
        }
        if (degradations > 0) {
            issues.add("Performance degradation detected");
        }

        HealthStatus status;
        if (issues.isEmpty()) {
            status = HealthStatus.HEALTHY;
        } else if (issues.size() < 3) {
            status = HealthStatus.WARNING;
        } else {
            status = HealthStatus.CRITICAL;
        }

        return new QuickReport(status, clock.instant(), recent.size(), slowQueries, queryErrors, degradations,
                issues, quickRecommendations());
    }

    public ServiceHealth getServiceHealth() {
        double memoryMb = optimizer.estimateMemoryUsage().mb();
        int alertCount = alertCount();

        List<String> issues = new ArrayList<>();
        if (!active) {
            issues.add("Service shut down");
        }
        if (memoryMb > MEMORY_WARNING_MB) {
            issues.add("High memory usage");
        }
        if (alertCount > ALERT_COUNT_WARNING) {
            issues.add("Too many alerts in memory");
        }

        return new ServiceHealth(issues.isEmpty() ? HealthStatus.HEALTHY : HealthStatus.WARNING,
                issues, memoryMb, alertCount, optimizer.isMonitoring());
    }

    public Map<AlertType, Long> getAlertsByType() {
        Map<AlertType, Long> byType = new EnumMap<>(AlertType.class);
        for (PerformanceAlert alert : getAlerts()) {
            byType.merge(alert.type(), 1L, Long::sum);
        }
        return byType;
    }

    public List<PerformanceAlert> getAlerts() {
        synchronized (alerts) {
            return new ArrayList<>(alerts);
        }
    }

    public Optional<DeepAnalysisResult> getLatestAnalysis() {
        return Optional.ofNullable(latestAnalysis);
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Unsubscribes from the optimizer and stops its monitoring.
     */
    public void shutdown() {
        synchronized (subscriptions) {
            subscriptions.forEach(EventBus.Subscription::unsubscribe);
            subscriptions.clear();
        }
        optimizer.stopPerformanceMonitoring();
        active = false;
        log.info("Database performance service shut down");
    }

    private void addAlert(PerformanceAlert alert) {
        synchronized (alerts) {
            alerts.add(alert);
            if (alerts.size() > MAX_ALERTS) {
                alerts.subList(0, ALERTS_TRIMMED).clear();
                log.debug("Alert history trimmed to {} entries", alerts.size());
            }
        }
    }

    private int alertCount() {
        synchronized (alerts) {
            return alerts.size();
        }
    }

    private List<String> quickRecommendations() {
        DeepAnalysisResult analysis = latestAnalysis;
        if (analysis == null) {
            return List.of();
        }

        List<String> recommendations = new ArrayList<>();
        if (!analysis.indexRecommendations().isEmpty()) {
            recommendations.add(analysis.indexRecommendations().size()
                    + " index recommendations available: review and apply recommended indexes");
        }
        long highImpact = analysis.optimizationOpportunities().stream()
                .filter(o -> o.severity() == Severity.HIGH)
                .count();
        if (highImpact > 0) {
            recommendations.add(highImpact + " high-impact query optimization opportunities: review and optimize slow queries");
        }
        return recommendations;
    }

    private Instant timestampOrNow(Instant timestamp) {
        return timestamp != null ? timestamp : clock.instant();
    }

    private static int countOfType(List<PerformanceAlert> alerts, AlertType type) {
        return (int) alerts.stream().filter(alert -> alert.type() == type).count();
    }

    private static void putIfPresent(Map<String, Object> details, String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
    }

    private static String abbreviate(String sql) {
        if (sql == null) {
            return null;
        }
        return sql.length() > 100 ? sql.substring(0, 100) + "..." : sql;
    }
}
