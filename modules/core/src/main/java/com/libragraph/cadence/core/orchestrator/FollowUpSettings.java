package com.libragraph.cadence.core.orchestrator;

import java.time.Duration;

/**
 * @param delay            offset from an email's received time to its follow-up
 * @param urgencyThreshold scores strictly below this are answered immediately
 */
public record FollowUpSettings(Duration delay, int urgencyThreshold) {

    public static FollowUpSettings defaults() {
        return new FollowUpSettings(Duration.ofHours(2), 5);
    }
}
