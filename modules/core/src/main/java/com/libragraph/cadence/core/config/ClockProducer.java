package com.libragraph.cadence.core.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Provides the application-wide {@link Clock}. Always UTC: every expiry and
 * fire-time comparison in Cadence is made against this clock, never against
 * the JVM's local zone.
 */
@ApplicationScoped
public class ClockProducer {

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
