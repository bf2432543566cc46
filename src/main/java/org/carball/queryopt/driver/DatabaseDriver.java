package org.carball.queryopt.driver;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The underlying database client. Implementations report failures by completing
 * the returned future exceptionally, typically with a {@link DriverException}.
 */
public interface DatabaseDriver {

    CompletableFuture<QueryResult> execute(String sql, List<Object> args);

    default CompletableFuture<QueryResult> execute(String sql) {
        return execute(sql, List.of());
    }

    default CompletableFuture<QueryResult> execute(Statement statement) {
        return execute(statement.sql(), statement.args());
    }

    /**
     * Connection descriptor, used only to pick the SQL dialect of index suggestions.
     */
    default String getConnectionString() {
        return null;
    }
}
