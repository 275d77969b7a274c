package com.aegis.authservice.support;

import java.util.UUID;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/** Fresh, migrated in-memory H2 databases in PostgreSQL mode. */
public final class H2Databases {

    private H2Databases() {
        // utility class
    }

    public static DataSource migrated() {
        var dataSource =
                new DriverManagerDataSource(
                        "jdbc:h2:mem:aegis-"
                                + UUID.randomUUID()
                                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE"
                                + ";DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1",
                        "sa",
                        "");
        Flyway.configure().dataSource(dataSource).locations("classpath:db/migration").load().migrate();
        return dataSource;
    }
}
