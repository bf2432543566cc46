package org.carball.queryopt.event;

import org.carball.queryopt.model.analysis.DeepAnalysisResult;
import org.carball.queryopt.model.analysis.PerformanceAnalysis;
import org.carball.queryopt.model.analysis.PerformanceDegradation;
import org.carball.queryopt.model.query.QueryErrorEvent;
import org.carball.queryopt.model.query.SlowQueryEntry;

import java.util.List;

/**
 * A named notification channel carrying payloads of one type.
 */
public final class EventChannel<T> {

    public static final EventChannel<SlowQueryEntry> SLOW_QUERY =
            new EventChannel<>("slow-query", SlowQueryEntry.class);

    public static final EventChannel<QueryErrorEvent> QUERY_ERROR =
            new EventChannel<>("query-error", QueryErrorEvent.class);

    public static final EventChannel<PerformanceAnalysis> PERFORMANCE_ANALYSIS =
            new EventChannel<>("performance-analysis", PerformanceAnalysis.class);

    public static final EventChannel<DeepAnalysisResult> DEEP_ANALYSIS =
            new EventChannel<>("deep-analysis", DeepAnalysisResult.class);

    public static final EventChannel<PerformanceDegradation> PERFORMANCE_DEGRADATION =
            new EventChannel<>("performance-degradation", PerformanceDegradation.class);

    private final String name;
    private final Class<T> payloadType;

    private EventChannel(String name, Class<T> payloadType) {
        this.name = name;
        this.payloadType = payloadType;
    }

    public static List<EventChannel<?>> all() {
        return List.of(SLOW_QUERY, QUERY_ERROR, PERFORMANCE_ANALYSIS, DEEP_ANALYSIS, PERFORMANCE_DEGRADATION);
    }

    public String getName() {
        return name;
    }

    public Class<T> getPayloadType() {
        return payloadType;
    }

    @Override
    public String toString() {
        return name;
    }
}
