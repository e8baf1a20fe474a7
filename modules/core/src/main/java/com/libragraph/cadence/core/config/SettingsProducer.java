package com.libragraph.cadence.core.config;

import com.libragraph.cadence.core.oauth.OAuthSettings;
import com.libragraph.cadence.core.orchestrator.FollowUpSettings;
import com.libragraph.cadence.core.scheduler.SchedulerSettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;

/** Turns {@code cadence.*} configuration into the typed settings the services take. */
@ApplicationScoped
public class SettingsProducer {

    private static final Logger log = Logger.getLogger(SettingsProducer.class);

    @Produces
    @Singleton
    public OAuthSettings oauthSettings(
            @ConfigProperty(name = "cadence.oauth.state-ttl-minutes", defaultValue = "10") int stateTtlMinutes,
            @ConfigProperty(name = "cadence.oauth.refresh-buffer-minutes", defaultValue = "5") int refreshBufferMinutes,
            @ConfigProperty(name = "cadence.oauth.http-timeout-ms", defaultValue = "30000") long httpTimeoutMs,
            @ConfigProperty(name = "cadence.oauth.google.redirect-uri",
                    defaultValue = "http://localhost:3000") String googleRedirectUri,
            @ConfigProperty(name = "cadence.oauth.linkedin.redirect-uri",
                    defaultValue = "http://localhost:3000/linkedin-callback") String linkedinRedirectUri) {
        log.debugf("OAuth settings: stateTtl=%dm refreshBuffer=%dm httpTimeout=%dms",
                stateTtlMinutes, refreshBufferMinutes, httpTimeoutMs);
        return new OAuthSettings(
                Duration.ofMinutes(stateTtlMinutes),
                Duration.ofMinutes(refreshBufferMinutes),
                Duration.ofMillis(httpTimeoutMs),
                googleRedirectUri,
                linkedinRedirectUri);
    }

    @Produces
    @Singleton
    public SchedulerSettings schedulerSettings(
            @ConfigProperty(name = "cadence.scheduler.tick-interval-ms", defaultValue = "1000") long tickIntervalMs,
            @ConfigProperty(name = "cadence.scheduler.worker-threads", defaultValue = "10") int workerThreads,
            @ConfigProperty(name = "cadence.scheduler.max-instances", defaultValue = "3") int maxInstances) {
        return new SchedulerSettings(Duration.ofMillis(tickIntervalMs), workerThreads, maxInstances);
    }

    @Produces
    @Singleton
    public FollowUpSettings followUpSettings(
            @ConfigProperty(name = "cadence.followup.delay-minutes", defaultValue = "120") int delayMinutes,
            @ConfigProperty(name = "cadence.followup.urgency-threshold", defaultValue = "5") int urgencyThreshold) {
        return new FollowUpSettings(Duration.ofMinutes(delayMinutes), urgencyThreshold);
    }
}
