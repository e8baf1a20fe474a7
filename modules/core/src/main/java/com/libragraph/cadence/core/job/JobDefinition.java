package com.libragraph.cadence.core.job;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A persisted job. {@code nextRun} is null once the job can no longer fire.
 *
 * @param workRef   registered name of the work function to invoke
 * @param jobPrefix logical family of the job, used for generated ids and listing
 */
public record JobDefinition(
        String jobId,
        int tenantId,
        Integer crewId,
        String workRef,
        String jobPrefix,
        TriggerSpec trigger,
        Map<String, Object> args,
        JobStatus status,
        Instant nextRun,
        Instant lastRun
) {
    public JobDefinition {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(workRef, "workRef");
        Objects.requireNonNull(jobPrefix, "jobPrefix");
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(status, "status");
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public boolean isOneOff() {
        return trigger instanceof TriggerSpec.At;
    }

    public JobDefinition withStatus(JobStatus newStatus, Instant newNextRun) {
        return new JobDefinition(jobId, tenantId, crewId, workRef, jobPrefix, trigger, args,
                newStatus, newNextRun, lastRun);
    }
}
