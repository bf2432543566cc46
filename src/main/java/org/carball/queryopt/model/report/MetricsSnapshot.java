package org.carball.queryopt.model.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.queryopt.model.query.PerformanceHistoryEntry;
import org.carball.queryopt.model.query.PreparedHandle;
import org.carball.queryopt.model.query.QueryMetrics;
import org.carball.queryopt.model.query.SlowQueryEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Plain-data form of the optimizer's full internal state, used for export and import.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MetricsSnapshot {
    private Instant exportedAt;
    @Builder.Default
    private List<QueryMetrics> queryMetrics = new ArrayList<>();
    @Builder.Default
    private List<SlowQueryEntry> slowQueryLog = new ArrayList<>();
    @Builder.Default
    private List<PerformanceHistoryEntry> performanceHistory = new ArrayList<>();
    @Builder.Default
    private List<String> indexRecommendations = new ArrayList<>();
    @Builder.Default
    private List<PreparedHandle> preparedStatements = new ArrayList<>();
}
