package com.libragraph.cadence.core.orchestrator;

import java.util.List;

/** Reads a tenant's recent inbox and scores each message. */
@FunctionalInterface
public interface EmailScorer {

    List<ScoredEmail> scoreRecent(int tenantId, String accessToken) throws Exception;
}
