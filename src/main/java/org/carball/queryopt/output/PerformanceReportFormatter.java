package org.carball.queryopt.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.queryopt.model.analysis.CategoryPerformance;
import org.carball.queryopt.model.analysis.OptimizationOpportunity;
import org.carball.queryopt.model.analysis.PerformanceAnalysis;
import org.carball.queryopt.model.analysis.ProblematicQuery;
import org.carball.queryopt.model.query.QueryCategory;
import org.carball.queryopt.model.query.SlowQueryEntry;
import org.carball.queryopt.model.report.PerformanceReport;

import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link PerformanceReport} as JSON or Markdown.
 */
@Slf4j
public class PerformanceReportFormatter {

    private static final int SQL_COLUMN_WIDTH = 80;

    private final PerformanceReport report;
    private final ObjectMapper objectMapper;

    public PerformanceReportFormatter(PerformanceReport report) {
        this.report = report;
        this.objectMapper = createObjectMapper();
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        PerformanceAnalysis summary = report.getSummary();

        // Header
        md.append("# Query Performance Report\n\n");
        if (report.getGeneratedAt() != null) {
            md.append("**Generated:** ").append(DateTimeFormatter.ISO_INSTANT.format(report.getGeneratedAt())).append("  \n");
        }
        if (report.getMonitoring() != null) {
            md.append("**Monitoring:** ").append(report.getMonitoring().isActive() ? "active" : "stopped").append("  \n");
        }
        md.append("\n");

        // Summary
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        if (summary != null) {
            md.append("| Unique Queries | ").append(summary.totalQueries()).append(" |\n");
            md.append("| Total Executions | ").append(summary.totalExecutions()).append(" |\n");
            md.append("| Average Execution Time | ").append(String.format(Locale.ROOT, "%.1f ms", summary.avgExecutionTime())).append(" |\n");
            md.append("| Slow Query Percentage | ").append(String.format(Locale.ROOT, "%.1f%%", summary.slowQueryPercentage())).append(" |\n");
            md.append("| Error Rate | ").append(String.format(Locale.ROOT, "%.1f%%", summary.errorRate())).append(" |\n");
        }
        md.append("| Slow Queries Logged | ").append(report.getTotalSlowQueries()).append(" |\n");
        if (report.getMemoryUsage() != null) {
            md.append("| Estimated Memory | ").append(report.getMemoryUsage().mb()).append(" MB |\n");
        }
        md.append("\n");

        // Category breakdown
        Map<QueryCategory, CategoryPerformance> breakdown = report.getQueryBreakdown();
        if (breakdown != null && !breakdown.isEmpty()) {
            md.append("## Query Breakdown\n\n");
            md.append("| Category | Queries | Executions | Avg Time |\n");
            md.append("|----------|---------|------------|----------|\n");
            breakdown.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(entry -> md.append("| ").append(entry.getKey())
                            .append(" | ").append(entry.getValue().getCount())
                            .append(" | ").append(entry.getValue().getTotalExecutions())
                            .append(" | ").append(String.format(Locale.ROOT, "%.1f ms", entry.getValue().getAvgTime()))
                            .append(" |\n"));
            md.append("\n");
        }

        // Problematic queries
        if (summary != null && !summary.problematicQueries().isEmpty()) {
            md.append("## Problematic Queries\n\n");
            for (ProblematicQuery query : summary.problematicQueries()) {
                md.append("- `").append(query.queryId()).append("` ")
                        .append(String.format(Locale.ROOT, "%.1f ms avg over %d executions", query.avgTime(), query.totalExecutions()))
                        .append(": `").append(abbreviate(query.sql())).append("`\n");
            }
            md.append("\n");
        }

        // Slow queries
        if (report.getSlowQueries() != null && !report.getSlowQueries().isEmpty()) {
            md.append("## Recent Slow Queries\n\n");
            for (SlowQueryEntry entry : report.getSlowQueries()) {
                md.append("- **").append(entry.executionTime()).append(" ms** (").append(entry.category())
                        .append("): `").append(abbreviate(entry.sql())).append("`\n");
            }
            md.append("\n");
        }

        // Index recommendations
        if (report.getIndexRecommendations() != null && !report.getIndexRecommendations().isEmpty()) {
            md.append("## Index Recommendations\n\n");
            md.append("```sql\n");
            report.getIndexRecommendations().forEach(indexSql -> md.append(indexSql).append(";\n"));
            md.append("```\n\n");
        }

        // Opportunities
        md.append("## Optimization Opportunities\n\n");
        if (report.getOptimizationOpportunities() == null || report.getOptimizationOpportunities().isEmpty()) {
            md.append("**No optimization opportunities found.**\n\n");
        } else {
            int number = 1;
            for (OptimizationOpportunity opportunity : report.getOptimizationOpportunities()) {
                md.append(number++).append(". **").append(opportunity.type()).append("** (")
                        .append(opportunity.severity()).append("): ").append(opportunity.description());
                if (!opportunity.candidates().isEmpty()) {
                    md.append(" - ").append(opportunity.candidates().size()).append(" affected");
                }
                md.append("\n");
            }
            md.append("\n");
        }

        md.append("---\n\n");
        md.append("*Generated by Query Performance Optimizer*\n");

        return md.toString();
    }

    private static String abbreviate(String sql) {
        if (sql == null) {
            return "";
        }
        String singleLine = sql.replaceAll("\\s+", " ").trim();
        return singleLine.length() > SQL_COLUMN_WIDTH ? singleLine.substring(0, SQL_COLUMN_WIDTH) + "..." : singleLine;
    }
}
