package com.libragraph.cadence.core.orchestrator;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An inbox message with the score assigned by the {@link EmailScorer}. Scores run
 * from 0 to 10; see {@link FollowUpSettings#urgencyThreshold()} for how they are read.
 *
 * @param receivedTime the message's received timestamp as the mail source reported it
 */
public record ScoredEmail(
        @JsonProperty("id") String id,
        @JsonProperty("from") String from,
        @JsonProperty("subject") String subject,
        @JsonProperty("body") String body,
        @JsonProperty("received_time") String receivedTime,
        @JsonProperty("urgency_score") int urgencyScore
) {
    private static final int ID_SOURCE_CHARS = 100;

    public ScoredEmail {
        if (id == null || id.isBlank()) {
            id = fallbackId(body);
        }
    }

    /** Stable id for messages the source did not identify, derived from the start of the body. */
    static String fallbackId(String body) {
        String source = body == null ? "" : body.substring(0, Math.min(body.length(), ID_SOURCE_CHARS));
        return Integer.toHexString(source.hashCode());
    }

    Map<String, Object> toArgs() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("email_id", id);
        args.put("from", from);
        args.put("subject", subject);
        args.put("body", body);
        args.put("received_time", receivedTime);
        args.put("urgency_score", urgencyScore);
        return args;
    }

    static ScoredEmail fromArgs(Map<String, Object> args) {
        Object score = args.get("urgency_score");
        return new ScoredEmail(
                text(args.get("email_id")),
                text(args.get("from")),
                text(args.get("subject")),
                text(args.get("body")),
                text(args.get("received_time")),
                score instanceof Number n ? n.intValue() : 0);
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
