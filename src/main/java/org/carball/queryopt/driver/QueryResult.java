package org.carball.queryopt.driver;

import java.util.List;
import java.util.Map;

public record QueryResult(
        List<Map<String, Object>> rows,
        long rowCount
) {

    public static QueryResult empty() {
        return new QueryResult(List.of(), 0);
    }

    public static QueryResult of(List<Map<String, Object>> rows) {
        return new QueryResult(rows, rows.size());
    }
}
