package com.libragraph.cadence.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.cadence.core.job.JobDefinition;
import com.libragraph.cadence.core.job.TriggerSpec;

import java.time.Instant;

/** Job as shown to tenants; arguments are omitted since they may hold message content. */
public record JobView(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("func_name") String workRef,
        @JsonProperty("job_prefix") String jobPrefix,
        @JsonProperty("crew_id") Integer crewId,
        @JsonProperty("type") String type,
        @JsonProperty("schedule") TriggerSpec schedule,
        @JsonProperty("status") String status,
        @JsonProperty("next_run") Instant nextRun,
        @JsonProperty("last_run") Instant lastRun
) {
    static JobView of(JobDefinition job) {
        return new JobView(job.jobId(), job.workRef(), job.jobPrefix(), job.crewId(),
                job.trigger().typeName(), job.trigger(), job.status().label(), job.nextRun(), job.lastRun());
    }
}
