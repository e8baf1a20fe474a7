package com.libragraph.cadence.core.scheduler;

/**
 * Unit of schedulable logic. Implementations are CDI beans discovered by
 * {@link WorkFunctionRegistry}.
 * <p>
 * Delivery is at-least-once: a run interrupted by a restart is repeated, so
 * implementations must tolerate being invoked twice for the same occurrence.
 */
public interface WorkFunction {

    /** Name stored in job records to refer to this function. */
    String workRef();

    /**
     * Runs one invocation. The returned text is recorded in the execution log;
     * a thrown exception is recorded as the failure.
     */
    String run(JobContext context) throws Exception;
}
