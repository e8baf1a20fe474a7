package com.libragraph.cadence.core.scheduler;

import java.time.Instant;
import java.util.Map;

/**
 * What a work function is told about the invocation. Everything else is
 * re-read from storage inside the call.
 *
 * @param scheduledFor the fire time that triggered this run
 */
public record JobContext(
        String jobId,
        int tenantId,
        Integer crewId,
        Map<String, Object> args,
        Instant scheduledFor
) {}
