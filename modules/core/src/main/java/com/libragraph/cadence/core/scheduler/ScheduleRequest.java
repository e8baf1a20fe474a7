package com.libragraph.cadence.core.scheduler;

import com.libragraph.cadence.core.job.TriggerSpec;

import java.util.Map;
import java.util.Objects;

/**
 * A request to register a job.
 *
 * @param jobId           explicit id, or null to generate {@code jobPrefix_xxxxxxxx}
 * @param replaceExisting overwrite a job with the same id instead of failing
 */
public record ScheduleRequest(
        String jobId,
        int tenantId,
        Integer crewId,
        String workRef,
        String jobPrefix,
        TriggerSpec trigger,
        Map<String, Object> args,
        boolean replaceExisting
) {
    public ScheduleRequest {
        Objects.requireNonNull(workRef, "workRef");
        Objects.requireNonNull(jobPrefix, "jobPrefix");
        Objects.requireNonNull(trigger, "trigger");
        if (args == null) {
            args = Map.of();
        }
    }
}
