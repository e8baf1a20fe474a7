package com.libragraph.cadence.core.scheduler;

import java.time.Duration;

/**
 * @param tickInterval  how often the due-job scan runs
 * @param workerThreads size of the pool that runs work functions
 * @param maxInstances  concurrent executions allowed per job id
 */
public record SchedulerSettings(Duration tickInterval, int workerThreads, int maxInstances) {

    public SchedulerSettings {
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1");
        }
        if (maxInstances < 1) {
            throw new IllegalArgumentException("maxInstances must be >= 1");
        }
    }
}
