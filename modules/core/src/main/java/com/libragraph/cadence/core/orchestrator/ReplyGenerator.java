package com.libragraph.cadence.core.orchestrator;

import java.util.Optional;

/** Drafts an answer to one message; empty when no reply is warranted. */
@FunctionalInterface
public interface ReplyGenerator {

    Optional<DraftReply> draft(int tenantId, ScoredEmail email) throws Exception;
}
