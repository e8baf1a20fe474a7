package com.libragraph.cadence.core.dao;

import com.libragraph.cadence.core.job.JobStatus;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

/** Raw {@code scheduled_job} row; trigger and args are still JSON text. */
public record ScheduledJobRow(
        @ColumnName("job_id") String jobId,
        @ColumnName("tenant_id") int tenantId,
        @ColumnName("crew_id") Integer crewId,
        @ColumnName("func_name") String funcName,
        @ColumnName("job_prefix") String jobPrefix,
        @ColumnName("trigger_type") String triggerType,
        @ColumnName("trigger_spec") String triggerSpec,
        @ColumnName("args") String args,
        @ColumnName("status") JobStatus status,
        @ColumnName("next_run") Instant nextRun,
        @ColumnName("last_run") Instant lastRun,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt
) {}
