package com.libragraph.cadence.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.Optional;

@RegisterConstructorMapper(TenantRecord.class)
public interface TenantDao {

    @SqlUpdate("INSERT INTO tenant (status, schedule_prefs, created_at) " +
            "VALUES (:status, :schedulePrefs, :createdAt)")
    @GetGeneratedKeys("id")
    int insert(@Bind("status") String status,
               @Bind("schedulePrefs") String schedulePrefs,
               @Bind("createdAt") Instant createdAt);

    @SqlQuery("SELECT * FROM tenant WHERE id = :id")
    Optional<TenantRecord> findById(@Bind("id") int id);

    @SqlUpdate("UPDATE tenant SET schedule_prefs = :schedulePrefs WHERE id = :id")
    int updateSchedulePrefs(@Bind("id") int id, @Bind("schedulePrefs") String schedulePrefs);
}
