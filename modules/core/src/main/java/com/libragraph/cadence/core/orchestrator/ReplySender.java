package com.libragraph.cadence.core.orchestrator;

@FunctionalInterface
public interface ReplySender {

    void send(int tenantId, String accessToken, DraftReply reply) throws Exception;
}
