package com.libragraph.cadence.core.orchestrator;

/** Drafts and publishes LinkedIn content for one crew. Returns a summary for the execution log. */
@FunctionalInterface
public interface LinkedInContentAgent {

    String run(int tenantId, int crewId, String accessToken) throws Exception;
}
