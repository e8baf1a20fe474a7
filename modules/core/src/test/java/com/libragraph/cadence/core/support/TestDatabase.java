package com.libragraph.cadence.core.support;

import com.libragraph.cadence.core.db.JdbiProducer;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.time.Instant;
import java.util.UUID;

/**
 * Fresh in-memory H2 database (PostgreSQL mode) per call, with the production
 * migration applied and JDBI set up as in production minus the PostgreSQL plugin.
 */
public final class TestDatabase {

    private TestDatabase() {
    }

    public static Jdbi create() {
        String url = "jdbc:h2:mem:cadence-" + UUID.randomUUID()
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1";
        Jdbi jdbi = JdbiProducer.configure(Jdbi.create(url, "sa", ""));
        jdbi.useHandle(TestDatabase::migrate);
        return jdbi;
    }

    private static void migrate(Handle handle) {
        handle.execute("RUNSCRIPT FROM 'classpath:/db/migration/V1__cadence_schema.sql'");
    }

    public static int insertTenant(Jdbi jdbi, int id) {
        jdbi.useHandle(h -> h.createUpdate(
                        "INSERT INTO tenant (id, status, schedule_prefs, created_at) VALUES (:id, 'active', '{}', :now)")
                .bind("id", id)
                .bind("now", Instant.now())
                .execute());
        return id;
    }

    public static int insertTenant(Jdbi jdbi) {
        return jdbi.withHandle(h -> h.createUpdate(
                        "INSERT INTO tenant (status, schedule_prefs, created_at) VALUES ('active', '{}', :now)")
                .bind("now", Instant.now())
                .executeAndReturnGeneratedKeys("id")
                .mapTo(Integer.class)
                .one());
    }
}
