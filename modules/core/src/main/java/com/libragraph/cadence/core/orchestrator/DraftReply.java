package com.libragraph.cadence.core.orchestrator;

public record DraftReply(String to, String subject, String body, String inReplyTo) {}
