package com.libragraph.cadence.core.scheduler;

/** A job with the requested id exists and replacement was not requested. */
public class JobConflictException extends RuntimeException {

    public JobConflictException(String jobId) {
        super("Job '" + jobId + "' already exists");
    }
}
