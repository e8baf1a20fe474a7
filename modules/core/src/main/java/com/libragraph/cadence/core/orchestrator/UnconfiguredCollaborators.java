package com.libragraph.cadence.core.orchestrator;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * Fallbacks for the agent integrations. A deployment supplies real beans for these
 * interfaces; until then a job that needs one fails with a clear message in the
 * execution log.
 */
@ApplicationScoped
public class UnconfiguredCollaborators {

    @Produces
    @Singleton
    @DefaultBean
    public EmailScorer emailScorer() {
        return (tenantId, accessToken) -> {
            throw missing("EmailScorer");
        };
    }

    @Produces
    @Singleton
    @DefaultBean
    public ReplyGenerator replyGenerator() {
        return (tenantId, email) -> {
            throw missing("ReplyGenerator");
        };
    }

    @Produces
    @Singleton
    @DefaultBean
    public ReplySender replySender() {
        return (tenantId, accessToken, reply) -> {
            throw missing("ReplySender");
        };
    }

    @Produces
    @Singleton
    @DefaultBean
    public CalendarAgent calendarAgent() {
        return (tenantId, crewId, accessToken) -> {
            throw missing("CalendarAgent");
        };
    }

    @Produces
    @Singleton
    @DefaultBean
    public LinkedInContentAgent linkedInContentAgent() {
        return (tenantId, crewId, accessToken) -> {
            throw missing("LinkedInContentAgent");
        };
    }

    private static IllegalStateException missing(String collaborator) {
        return new IllegalStateException("No " + collaborator + " implementation is configured");
    }
}
