package com.libragraph.cadence.core.orchestrator;

/** Runs the calendar automation for one crew. Returns a summary for the execution log. */
@FunctionalInterface
public interface CalendarAgent {

    String run(int tenantId, int crewId, String accessToken) throws Exception;
}
