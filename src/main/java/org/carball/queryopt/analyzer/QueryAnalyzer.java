package org.carball.queryopt.analyzer;

import org.carball.queryopt.model.query.QueryAnalysis;
import org.carball.queryopt.model.query.QueryCategory;
import org.carball.queryopt.model.query.QueryComplexity;
import org.carball.queryopt.model.query.QueryType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies SQL statements by pattern matching over the raw text.
 */
public class QueryAnalyzer {

    public static final String WILDCARD_SUGGESTION = "Specify exact columns instead of SELECT *";
    public static final String SUBQUERY_SUGGESTION = "Consider using JOINs instead of subqueries";
    public static final String LIMIT_SUGGESTION = "Add LIMIT clause to prevent large result sets";

    private static final int WILDCARD_WEIGHT = 1;
    private static final int JOIN_WEIGHT = 2;
    private static final int SUBQUERY_WEIGHT = 3;
    private static final int AGGREGATION_WEIGHT = 1;

    // Structural patterns
    private static final Pattern LEADING_NOISE = Pattern.compile(
            "^(?:\\s+|--[^\\n]*(?:\\n|$)|/\\*.*?\\*/|\\()+", Pattern.DOTALL);

    private static final Pattern FIRST_KEYWORD = Pattern.compile("^([A-Za-z]+)");

    private static final Pattern JOIN_PATTERN = Pattern.compile("\\bJOIN\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern SUBQUERY_PATTERN = Pattern.compile("\\(\\s*SELECT\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern AGGREGATE_FUNCTION_PATTERN = Pattern.compile(
            "\\b(?:COUNT|SUM|AVG)\\s*\\(", Pattern.CASE_INSENSITIVE);

    private static final Pattern GROUP_BY_PATTERN = Pattern.compile("\\bGROUP\\s+BY\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern WILDCARD_PATTERN = Pattern.compile(
            "\\bSELECT\\s+(?:DISTINCT\\s+)?\\*|\\b[A-Za-z_][A-Za-z0-9_]*\\.\\*", Pattern.CASE_INSENSITIVE);

    private static final Pattern LIMIT_PATTERN = Pattern.compile("\\bLIMIT\\b", Pattern.CASE_INSENSITIVE);

    // Category patterns, checked in priority order
    private static final Pattern QR_VALIDATION_PATTERN = Pattern.compile(
            "\\bqr_code\\s*=", Pattern.CASE_INSENSITIVE);

    private static final Pattern CHECK_IN_PATTERN = Pattern.compile(
            "\\bUPDATE\\b.*tickets.*\\bSET\\b.*\\bchecked_in\\b", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern TICKET_VALIDATION_PATTERN = Pattern.compile(
            "\\b(?:validation_token|is_valid)\\s*=", Pattern.CASE_INSENSITIVE);

    private static final Pattern TICKETS_TABLE_PATTERN = Pattern.compile("\\btickets\\b", Pattern.CASE_INSENSITIVE);

    // Matches "id =" and "_id =" columns such as "order_id =", but not "paid =" or "uuid ="
    private static final Pattern ID_FILTER_PATTERN = Pattern.compile("(?:\\b|_)id\\s*=", Pattern.CASE_INSENSITIVE);

    private static final Pattern INVENTORY_PATTERN = Pattern.compile(
            "\\b(?:tickets_available|capacity)\\b", Pattern.CASE_INSENSITIVE);

    // Literal patterns used to derive statement shapes
    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'|\"[^\"]*\"");
    private static final Pattern NUMERIC_LITERAL = Pattern.compile("(?<![A-Za-z_0-9.])-?\\d+(?:\\.\\d+)?\\b");
    private static final Pattern IN_LIST = Pattern.compile("\\(\\s*\\?(?:\\s*,\\s*\\?)+\\s*\\)");

    /**
     * Analyzes a statement. Never throws; absent or blank input yields {@link QueryAnalysis#defaults()}.
     */
    public QueryAnalysis analyze(String sql) {
        if (sql == null || sql.isBlank()) {
            return QueryAnalysis.defaults();
        }

        QueryType queryType = extractQueryType(sql);
        boolean hasJoins = JOIN_PATTERN.matcher(sql).find();
        boolean hasSubqueries = SUBQUERY_PATTERN.matcher(sql).find();
        boolean hasAggregateFunction = AGGREGATE_FUNCTION_PATTERN.matcher(sql).find();
        boolean hasGroupBy = GROUP_BY_PATTERN.matcher(sql).find();
        boolean hasAggregations = hasAggregateFunction || hasGroupBy;
        boolean usesWildcard = WILDCARD_PATTERN.matcher(sql).find();

        QueryComplexity complexity = QueryComplexity.fromScore(
                scoreComplexity(usesWildcard, hasJoins, hasSubqueries, hasAggregations));
        QueryCategory category = categorize(sql, hasAggregateFunction && hasGroupBy);

        List<String> optimizations = new ArrayList<>();
        if (usesWildcard) {
            optimizations.add(WILDCARD_SUGGESTION);
        }
        if (hasSubqueries) {
            optimizations.add(SUBQUERY_SUGGESTION);
        }
        if (queryType == QueryType.SELECT && !LIMIT_PATTERN.matcher(sql).find()) {
            optimizations.add(LIMIT_SUGGESTION);
        }

        return new QueryAnalysis(queryType, hasJoins, hasSubqueries, hasAggregations, usesWildcard,
                category, complexity, estimateRows(category), optimizations, shapeOf(sql));
    }

    /**
     * Returns the statement with literals replaced by placeholders, so that statements
     * differing only in literal values share a shape.
     */
    public static String shapeOf(String sql) {
        String shape = QueryIdentity.normalize(sql);
        shape = STRING_LITERAL.matcher(shape).replaceAll("?");
        shape = NUMERIC_LITERAL.matcher(shape).replaceAll("?");
        shape = IN_LIST.matcher(shape).replaceAll("(?)");
        return shape.toUpperCase(Locale.ROOT);
    }

    private QueryType extractQueryType(String sql) {
        String stripped = LEADING_NOISE.matcher(sql).replaceFirst("");
        Matcher matcher = FIRST_KEYWORD.matcher(stripped);
        if (!matcher.find()) {
            return QueryType.OTHER;
        }
        switch (matcher.group(1).toUpperCase(Locale.ROOT)) {
            case "SELECT":
            case "WITH":
                return QueryType.SELECT;
            case "INSERT":
                return QueryType.INSERT;
            case "UPDATE":
                return QueryType.UPDATE;
            case "DELETE":
                return QueryType.DELETE;
            default:
                return QueryType.OTHER;
        }
    }

    private int scoreComplexity(boolean usesWildcard, boolean hasJoins, boolean hasSubqueries, boolean hasAggregations) {
        int score = 0;
        if (usesWildcard) {
            score += WILDCARD_WEIGHT;
        }
        if (hasJoins) {
            score += JOIN_WEIGHT;
        }
        if (hasSubqueries) {
            score += SUBQUERY_WEIGHT;
        }
        if (hasAggregations) {
            score += AGGREGATION_WEIGHT;
        }
        return score;
    }

    private QueryCategory categorize(String sql, boolean isStatistics) {
        if (QR_VALIDATION_PATTERN.matcher(sql).find()) {
            return QueryCategory.QR_VALIDATION;
        } else if (CHECK_IN_PATTERN.matcher(sql).find()) {
            return QueryCategory.CHECK_IN;
        } else if (TICKET_VALIDATION_PATTERN.matcher(sql).find()) {
            return QueryCategory.TICKET_VALIDATION;
        } else if (TICKETS_TABLE_PATTERN.matcher(sql).find() && ID_FILTER_PATTERN.matcher(sql).find()) {
            return QueryCategory.TICKET_LOOKUP;
        } else if (isStatistics) {
            return QueryCategory.EVENT_STATISTICS;
        } else if (INVENTORY_PATTERN.matcher(sql).find()) {
            return QueryCategory.INVENTORY_CHECK;
        } else {
            return QueryCategory.GENERAL;
        }
    }

    private int estimateRows(QueryCategory category) {
        return switch (category) {
            case TICKET_LOOKUP, QR_VALIDATION -> 1;
            case EVENT_STATISTICS -> 100;
            default -> QueryAnalysis.DEFAULT_ESTIMATED_ROWS;
        };
    }
}
