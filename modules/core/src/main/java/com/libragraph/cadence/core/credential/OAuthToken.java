package com.libragraph.cadence.core.credential;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Tokens issued by a provider. {@code expiry} is always a UTC instant; a token with
 * no known expiry is treated as already expired.
 */
public record OAuthToken(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("expiry") Instant expiry,
        @JsonProperty("scopes") List<String> scopes
) {
    public OAuthToken {
        Objects.requireNonNull(accessToken, "accessToken");
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    public boolean isExpiredAt(Instant now) {
        return expiry == null || !expiry.isAfter(now);
    }

    /** True when the token is expired or will expire within {@code buffer} of {@code now}. */
    public boolean expiresWithin(Duration buffer, Instant now) {
        return expiry == null || !expiry.isAfter(now.plus(buffer));
    }

    @Override
    public String toString() {
        // tokens stay out of logs
        return "OAuthToken[expiry=" + expiry + ", scopes=" + scopes
                + ", refreshable=" + hasRefreshToken() + "]";
    }
}
