package org.carball.queryopt.output;

import org.carball.queryopt.model.analysis.CategoryPerformance;
import org.carball.queryopt.model.analysis.MemoryEstimate;
import org.carball.queryopt.model.analysis.OpportunityType;
import org.carball.queryopt.model.analysis.OptimizationOpportunity;
import org.carball.queryopt.model.analysis.PerformanceAnalysis;
import org.carball.queryopt.model.analysis.ProblematicQuery;
import org.carball.queryopt.model.analysis.Severity;
import org.carball.queryopt.model.query.QueryCategory;
import org.carball.queryopt.model.query.QueryComplexity;
import org.carball.queryopt.model.query.SlowQueryEntry;
import org.carball.queryopt.model.report.MonitoringStatus;
import org.carball.queryopt.model.report.PerformanceReport;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class PerformanceReportFormatterTest {

    private static final Instant GENERATED = Instant.parse("2024-03-15T10:00:00Z");

    @Test
    void shouldRenderMarkdownSections() {
        // Given
        PerformanceReportFormatter formatter = new PerformanceReportFormatter(sampleReport());

        // When
        String markdown = formatter.toMarkdown();

        // Then
        assertThat(markdown).startsWith("# Query Performance Report");
        assertThat(markdown).contains("**Generated:** 2024-03-15T10:00:00Z");
        assertThat(markdown).contains("**Monitoring:** active");
        assertThat(markdown).contains("| Unique Queries | 2 |");
        assertThat(markdown).contains("| Error Rate | 12.5% |");
        assertThat(markdown).contains("## Query Breakdown");
        assertThat(markdown).contains("| TICKET_LOOKUP | 1 | 4 | 20.0 ms |");
        assertThat(markdown).contains("## Problematic Queries");
        assertThat(markdown).contains("## Recent Slow Queries");
        assertThat(markdown).contains("**250 ms** (GENERAL)");
        assertThat(markdown).contains("CREATE INDEX IF NOT EXISTS idx_tickets_qr_code ON tickets(qr_code);");
        assertThat(markdown).contains("1. **N+1_QUERIES** (HIGH)");
    }

    @Test
    void shouldRenderPlaceholderWithoutOpportunities() {
        // Given
        PerformanceReport report = sampleReport();
        report.setOptimizationOpportunities(List.of());
        report.setSlowQueries(List.of());

        // When
        String markdown = new PerformanceReportFormatter(report).toMarkdown();

        // Then
        assertThat(markdown).contains("**No optimization opportunities found.**");
        assertThat(markdown).doesNotContain("## Recent Slow Queries");
    }

    @Test
    void shouldRenderJsonWithIsoTimestampsAndOpportunityLabels() {
        // When
        String json = new PerformanceReportFormatter(sampleReport()).toJson();

        // Then
        assertThat(json).contains("\"generatedAt\" : \"2024-03-15T10:00:00Z\"");
        assertThat(json).contains("\"N+1_QUERIES\"");
        assertThat(json).contains("\"TICKET_LOOKUP\"");
        assertThat(json).contains("idx_tickets_qr_code");
    }

    private static PerformanceReport sampleReport() {
        CategoryPerformance lookups = new CategoryPerformance();
        lookups.add(4, 4, 80);
        CategoryPerformance general = new CategoryPerformance();
        general.add(4, 4, 1000);
        Map<QueryCategory, CategoryPerformance> breakdown = Map.of(
                QueryCategory.TICKET_LOOKUP, lookups,
                QueryCategory.GENERAL, general);

        PerformanceAnalysis summary = new PerformanceAnalysis(2, 8, breakdown,
                List.of(new ProblematicQuery("abcd1234", "SELECT name FROM users WHERE id = 1",
                        QueryCategory.GENERAL, 250.0, 4)),
                37.5, 12.5, 154.3, GENERATED);

        return PerformanceReport.builder()
                .generatedAt(GENERATED)
                .monitoring(new MonitoringStatus(true, 2, 1, 8))
                .summary(summary)
                .queryBreakdown(breakdown)
                .slowQueries(List.of(new SlowQueryEntry("SELECT name FROM users WHERE id = 1", 250,
                        QueryCategory.GENERAL, QueryComplexity.LOW, List.of(), GENERATED)))
                .totalSlowQueries(1)
                .indexRecommendations(List.of("CREATE INDEX IF NOT EXISTS idx_tickets_qr_code ON tickets(qr_code)"))
                .optimizationOpportunities(List.of(new OptimizationOpportunity(OpportunityType.N_PLUS_ONE_QUERIES,
                        Severity.HIGH, "Repeated near-identical queries", List.of("SELECT * FROM ORDERS WHERE ID = ?"))))
                .memoryUsage(MemoryEstimate.ofBytes(4096))
                .build();
    }
}
