package com.libragraph.cadence.core.dao;

import com.libragraph.cadence.core.job.JobStatus;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transaction;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterColumnMapper(JobStatusColumnMapper.class)
@RegisterArgumentFactory(JobStatusArgumentFactory.class)
@RegisterConstructorMapper(ScheduledJobRow.class)
public interface ScheduledJobDao {

    @SqlUpdate("INSERT INTO scheduled_job (job_id, tenant_id, crew_id, func_name, job_prefix, " +
            "trigger_type, trigger_spec, args, status, next_run, last_run, created_at, updated_at) " +
            "VALUES (:jobId, :tenantId, :crewId, :funcName, :jobPrefix, :triggerType, :triggerSpec, " +
            ":args, :status, :nextRun, :lastRun, :now, :now)")
    void insert(@Bind("jobId") String jobId,
                @Bind("tenantId") int tenantId,
                @Bind("crewId") Integer crewId,
                @Bind("funcName") String funcName,
                @Bind("jobPrefix") String jobPrefix,
                @Bind("triggerType") String triggerType,
                @Bind("triggerSpec") String triggerSpec,
                @Bind("args") String args,
                @Bind("status") JobStatus status,
                @Bind("nextRun") Instant nextRun,
                @Bind("lastRun") Instant lastRun,
                @Bind("now") Instant now);

    @SqlUpdate("UPDATE scheduled_job SET tenant_id = :tenantId, crew_id = :crewId, func_name = :funcName, " +
            "job_prefix = :jobPrefix, trigger_type = :triggerType, trigger_spec = :triggerSpec, args = :args, " +
            "status = :status, next_run = :nextRun, last_run = :lastRun, updated_at = :now " +
            "WHERE job_id = :jobId")
    int replace(@Bind("jobId") String jobId,
                @Bind("tenantId") int tenantId,
                @Bind("crewId") Integer crewId,
                @Bind("funcName") String funcName,
                @Bind("jobPrefix") String jobPrefix,
                @Bind("triggerType") String triggerType,
                @Bind("triggerSpec") String triggerSpec,
                @Bind("args") String args,
                @Bind("status") JobStatus status,
                @Bind("nextRun") Instant nextRun,
                @Bind("lastRun") Instant lastRun,
                @Bind("now") Instant now);

    @Transaction
    default void upsert(String jobId, int tenantId, Integer crewId, String funcName, String jobPrefix,
                        String triggerType, String triggerSpec, String args, JobStatus status,
                        Instant nextRun, Instant lastRun, Instant now) {
        int updated = replace(jobId, tenantId, crewId, funcName, jobPrefix, triggerType, triggerSpec,
                args, status, nextRun, lastRun, now);
        if (updated == 0) {
            insert(jobId, tenantId, crewId, funcName, jobPrefix, triggerType, triggerSpec,
                    args, status, nextRun, lastRun, now);
        }
    }

    @SqlQuery("SELECT * FROM scheduled_job WHERE job_id = :jobId")
    Optional<ScheduledJobRow> findById(@Bind("jobId") String jobId);

    @SqlQuery("SELECT * FROM scheduled_job WHERE tenant_id = :tenantId ORDER BY job_id")
    List<ScheduledJobRow> findByTenant(@Bind("tenantId") int tenantId);

    @SqlQuery("SELECT * FROM scheduled_job WHERE status = :status ORDER BY job_id")
    List<ScheduledJobRow> findByStatus(@Bind("status") JobStatus status);

    @SqlQuery("SELECT * FROM scheduled_job WHERE status = :status AND next_run IS NOT NULL " +
            "AND next_run <= :now ORDER BY next_run, job_id")
    List<ScheduledJobRow> findDue(@Bind("status") JobStatus status, @Bind("now") Instant now);

    @SqlUpdate("UPDATE scheduled_job SET status = :status, next_run = :nextRun, updated_at = :now " +
            "WHERE job_id = :jobId")
    int updateStatus(@Bind("jobId") String jobId,
                     @Bind("status") JobStatus status,
                     @Bind("nextRun") Instant nextRun,
                     @Bind("now") Instant now);

    @SqlUpdate("UPDATE scheduled_job SET status = :status, next_run = :nextRun, last_run = :lastRun, " +
            "updated_at = :now WHERE job_id = :jobId")
    int updateStatusAndLastRun(@Bind("jobId") String jobId,
                               @Bind("status") JobStatus status,
                               @Bind("nextRun") Instant nextRun,
                               @Bind("lastRun") Instant lastRun,
                               @Bind("now") Instant now);

    @SqlUpdate("UPDATE scheduled_job SET next_run = :nextRun, last_run = :lastRun, updated_at = :now " +
            "WHERE job_id = :jobId AND status = :active")
    int advance(@Bind("jobId") String jobId,
                @Bind("active") JobStatus active,
                @Bind("nextRun") Instant nextRun,
                @Bind("lastRun") Instant lastRun,
                @Bind("now") Instant now);

    @SqlUpdate("DELETE FROM scheduled_job WHERE job_id = :jobId")
    int delete(@Bind("jobId") String jobId);
}
