package org.carball.queryopt.driver;

import java.util.Locale;

public enum DatabaseType {
    POSTGRESQL,
    MYSQL,
    SQLITE;

    /**
     * Classifies a connection descriptor; anything unrecognised is treated as SQLite.
     */
    public static DatabaseType fromConnectionString(String connectionString) {
        if (connectionString == null) {
            return SQLITE;
        }
        String lower = connectionString.toLowerCase(Locale.ROOT);
        if (lower.contains("postgres")) {
            return POSTGRESQL;
        } else if (lower.contains("mysql")) {
            return MYSQL;
        }
        return SQLITE;
    }
}
