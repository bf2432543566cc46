package org.carball.queryopt.driver;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.assertj.core.api.Assertions.assertThat;

public class DatabaseTypeTest {

    @ParameterizedTest
    @CsvSource({
            "postgresql://app@db:5432/tickets, POSTGRESQL",
            "jdbc:postgresql://localhost/events, POSTGRESQL",
            "mysql://root@localhost:3306/shop, MYSQL",
            "JDBC:MYSQL://LOCALHOST/SHOP, MYSQL",
            "sqlite:/var/data/app.db, SQLITE",
            "/var/data/app.db, SQLITE",
            "oracle://legacy, SQLITE"
    })
    void shouldClassifyConnectionStrings(String connectionString, DatabaseType expected) {
        // When / Then
        assertThat(DatabaseType.fromConnectionString(connectionString)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    void shouldTreatMissingDescriptorAsSqlite(String connectionString) {
        // When / Then
        assertThat(DatabaseType.fromConnectionString(connectionString)).isEqualTo(DatabaseType.SQLITE);
    }
}
