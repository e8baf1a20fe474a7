package com.libragraph.cadence.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record ExecutionLogRecord(
        @ColumnName("id") long id,
        @ColumnName("logged_at") Instant loggedAt,
        @ColumnName("tenant_id") int tenantId,
        @ColumnName("job_id") String jobId,
        @ColumnName("crew_id") Integer crewId,
        @ColumnName("result") String result,
        @ColumnName("error") String error
) {
    public boolean failed() {
        return error != null;
    }
}
