package com.libragraph.cadence.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(ExecutionLogRecord.class)
public interface ExecutionLogDao {

    @SqlUpdate("INSERT INTO execution_log (logged_at, tenant_id, job_id, crew_id, result, error) " +
            "VALUES (:loggedAt, :tenantId, :jobId, :crewId, :result, :error)")
    void append(@Bind("loggedAt") Instant loggedAt,
                @Bind("tenantId") int tenantId,
                @Bind("jobId") String jobId,
                @Bind("crewId") Integer crewId,
                @Bind("result") String result,
                @Bind("error") String error);

    @SqlQuery("SELECT * FROM execution_log WHERE tenant_id = :tenantId " +
            "ORDER BY logged_at DESC, id DESC LIMIT :limit")
    List<ExecutionLogRecord> findRecentByTenant(@Bind("tenantId") int tenantId, @Bind("limit") int limit);

    @SqlQuery("SELECT * FROM execution_log WHERE job_id = :jobId ORDER BY id")
    List<ExecutionLogRecord> findByJob(@Bind("jobId") String jobId);
}
