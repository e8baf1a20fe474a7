package com.libragraph.cadence.core.job;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A tenant's requested schedule for one service, as submitted and as kept in preferences. */
public record ScheduleConfig(
        @JsonProperty("frequency") String frequency,
        @JsonProperty("time") String time
) {
    public TriggerSpec.Cron toTrigger() {
        return TriggerSpec.Cron.parse(frequency, time);
    }
}
