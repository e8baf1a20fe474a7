package com.libragraph.cadence.core.db;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

@ApplicationScoped
public class JdbiProducer {

    @Produces
    @Singleton
    public Jdbi jdbi(AgroalDataSource dataSource,
                     @ConfigProperty(name = "quarkus.datasource.db-kind", defaultValue = "postgresql") String dbKind) {
        Jdbi jdbi = configure(Jdbi.create(dataSource));
        // the test profile runs on embedded H2
        if ("postgresql".equals(dbKind)) {
            jdbi.installPlugin(new PostgresPlugin());
        }
        return jdbi;
    }

    /**
     * Applies the database-agnostic part of the JDBI setup. Shared with tests that
     * run the DAOs against an embedded database.
     */
    public static Jdbi configure(Jdbi jdbi) {
        return jdbi
                .installPlugin(new SqlObjectPlugin())
                .setSqlLogger(new Slf4JSqlLogger());
    }
}
