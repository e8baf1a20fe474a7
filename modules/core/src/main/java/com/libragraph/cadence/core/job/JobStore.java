package com.libragraph.cadence.core.job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Durable job definitions keyed by job id. */
public interface JobStore {

    /** Inserts or replaces the job with the same id. */
    void put(JobDefinition job);

    Optional<JobDefinition> get(String jobId);

    List<JobDefinition> listByTenant(int tenantId);

    /** Sets status and next run together in one write. Returns false if the job is gone. */
    boolean updateStatus(String jobId, JobStatus status, Instant nextRun);

    /** As {@link #updateStatus(String, JobStatus, Instant)}, also recording when it last fired. */
    boolean updateStatus(String jobId, JobStatus status, Instant nextRun, Instant lastRun);

    /**
     * Moves an active job's {@code next_run} forward and records {@code lastRun}.
     * Returns false, changing nothing, if the job is no longer active.
     */
    boolean advance(String jobId, Instant nextRun, Instant lastRun);

    boolean delete(String jobId);

    /** Active jobs with {@code next_run <= now}, earliest first. */
    List<JobDefinition> findDue(Instant now);

    List<JobDefinition> findByStatus(JobStatus status);
}
