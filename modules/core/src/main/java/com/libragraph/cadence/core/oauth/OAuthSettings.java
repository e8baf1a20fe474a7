package com.libragraph.cadence.core.oauth;

import com.libragraph.cadence.core.credential.Provider;

import java.time.Duration;

/**
 * Timing and callback settings for the authorization flow.
 *
 * @param stateTtl          how long an issued state value stays acceptable
 * @param refreshBuffer     tokens expiring within this window are refreshed before use
 * @param httpTimeout       request timeout for calls to token endpoints
 * @param googleRedirectUri callback registered for Google clients
 * @param linkedinRedirectUri callback registered for LinkedIn clients
 */
public record OAuthSettings(
        Duration stateTtl,
        Duration refreshBuffer,
        Duration httpTimeout,
        String googleRedirectUri,
        String linkedinRedirectUri
) {
    public static final Duration DEFAULT_STATE_TTL = Duration.ofMinutes(10);
    public static final Duration DEFAULT_REFRESH_BUFFER = Duration.ofMinutes(5);
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

    public static OAuthSettings defaults() {
        return new OAuthSettings(DEFAULT_STATE_TTL, DEFAULT_REFRESH_BUFFER, DEFAULT_HTTP_TIMEOUT,
                "http://localhost:3000", "http://localhost:3000/linkedin-callback");
    }

    public String redirectUri(Provider provider) {
        switch (provider) {
            case GOOGLE:
                return googleRedirectUri;
            case LINKEDIN:
                return linkedinRedirectUri;
            default:
                throw new IllegalArgumentException("Unhandled provider: " + provider);
        }
    }
}
