package org.carball.queryopt.recommend;

import org.carball.queryopt.driver.DatabaseType;
import org.carball.queryopt.model.query.QueryCategory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Synthesizes CREATE INDEX statements for the filter columns of slow statements.
 */
public class IndexRecommendationBuilder {

    private static final int MAX_INDEX_COLUMNS = 3;
    private static final String DEFAULT_TABLE = "tickets";

    private static final Pattern TABLE_PATTERN = Pattern.compile(
            "(?:FROM|JOIN|UPDATE|INTO)\\s+[\"`\\[]?([A-Za-z_][A-Za-z0-9_]*)",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern WHERE_CLAUSE = Pattern.compile(
            "\\bWHERE\\b(.*?)(?:\\bGROUP\\s+BY\\b|\\bORDER\\s+BY\\b|\\bLIMIT\\b|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );

    private static final Pattern EQUALITY_FILTER = Pattern.compile(
            "(?:[A-Za-z_][A-Za-z0-9_]*\\.)?([A-Za-z_][A-Za-z0-9_]*)\\s*=(?!=)",
            Pattern.CASE_INSENSITIVE
    );

    private final DatabaseType databaseType;

    public IndexRecommendationBuilder(DatabaseType databaseType) {
        this.databaseType = databaseType;
    }

    /**
     * Builds a suggestion for an index-sensitive category, or nothing when no column applies.
     */
    public Optional<String> build(String sql, QueryCategory category) {
        if (sql == null || !category.isIndexSensitive()) {
            return Optional.empty();
        }

        List<String> columns = selectColumns(sql, category);
        if (columns.isEmpty()) {
            return Optional.empty();
        }

        String table = extractTable(sql);
        String indexName = "idx_" + table + "_" + String.join("_", columns);
        return Optional.of(String.format("%s %s ON %s(%s)",
                createPrefix(), indexName, table, String.join(", ", columns)));
    }

    private List<String> selectColumns(String sql, QueryCategory category) {
        List<String> filtered = equalityColumns(sql);
        List<String> columns = switch (category) {
            case QR_VALIDATION -> matching(filtered, c -> c.equals("qr_code"));
            case TICKET_VALIDATION -> matching(filtered, c -> c.equals("validation_token") || c.equals("is_valid"));
            case TICKET_LOOKUP -> matching(filtered, c -> c.equals("id") || c.endsWith("_id"));
            case CHECK_IN -> filtered.isEmpty() ? List.of("checked_in") : filtered;
            default -> List.of();
        };
        return columns.size() > MAX_INDEX_COLUMNS ? columns.subList(0, MAX_INDEX_COLUMNS) : columns;
    }

    private List<String> equalityColumns(String sql) {
        Matcher where = WHERE_CLAUSE.matcher(sql);
        String filterText = where.find() ? where.group(1) : sql;

        Set<String> columns = new LinkedHashSet<>();
        Matcher matcher = EQUALITY_FILTER.matcher(filterText);
        while (matcher.find()) {
            columns.add(matcher.group(1).toLowerCase(Locale.ROOT));
        }
        return new ArrayList<>(columns);
    }

    private static List<String> matching(List<String> columns, Predicate<String> filter) {
        return columns.stream().filter(filter).toList();
    }

    private String extractTable(String sql) {
        Matcher matcher = TABLE_PATTERN.matcher(sql);
        return matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : DEFAULT_TABLE;
    }

    private String createPrefix() {
        return switch (databaseType) {
            case POSTGRESQL -> "CREATE INDEX CONCURRENTLY IF NOT EXISTS";
            case MYSQL -> "CREATE INDEX";
            case SQLITE -> "CREATE INDEX IF NOT EXISTS";
        };
    }
}
