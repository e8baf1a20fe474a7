package com.libragraph.cadence.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(CrewRecord.class)
public interface CrewDao {

    @SqlUpdate("INSERT INTO crew (tenant_id, kind, schedule, created_at) " +
            "VALUES (:tenantId, :kind, :schedule, :createdAt)")
    @GetGeneratedKeys("id")
    int insert(@Bind("tenantId") int tenantId,
               @Bind("kind") String kind,
               @Bind("schedule") String schedule,
               @Bind("createdAt") Instant createdAt);

    @SqlQuery("SELECT * FROM crew WHERE id = :id")
    Optional<CrewRecord> findById(@Bind("id") int id);

    @SqlQuery("SELECT * FROM crew WHERE tenant_id = :tenantId ORDER BY id")
    List<CrewRecord> findByTenant(@Bind("tenantId") int tenantId);

    @SqlUpdate("UPDATE crew SET schedule = :schedule WHERE id = :id")
    int updateSchedule(@Bind("id") int id, @Bind("schedule") String schedule);

    /** Rewrites a crew's kind only if it still holds {@code expected}; safe to repeat. */
    @SqlUpdate("UPDATE crew SET kind = :newKind WHERE id = :id AND kind = :expected")
    int migrateKind(@Bind("id") int id, @Bind("expected") String expected,
                    @Bind("newKind") String newKind);
}
