package org.carball.queryopt.model.query;

import java.util.List;

/**
 * Pattern-based classification of a single SQL statement.
 */
public record QueryAnalysis(
        QueryType queryType,
        boolean hasJoins,
        boolean hasSubqueries,
        boolean hasAggregations,
        boolean usesWildcard,
        QueryCategory category,
        QueryComplexity complexity,
        int estimatedRows,
        List<String> optimizations,
        String shape
) {

    public static final int DEFAULT_ESTIMATED_ROWS = 50;

    public QueryAnalysis {
        optimizations = List.copyOf(optimizations);
    }

    /**
     * Analysis returned for absent or blank statements.
     */
    public static QueryAnalysis defaults() {
        return new QueryAnalysis(QueryType.OTHER, false, false, false, false,
                QueryCategory.GENERAL, QueryComplexity.LOW, DEFAULT_ESTIMATED_ROWS, List.of(), "");
    }
}
