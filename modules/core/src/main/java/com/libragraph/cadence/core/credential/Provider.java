package com.libragraph.cadence.core.credential;

import com.libragraph.cadence.core.error.ValidationException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * External OAuth2 services a tenant can authorize. Endpoints and scopes are fixed
 * per provider; a tenant only supplies its own client id and secret.
 */
public enum Provider {

    GOOGLE("google",
            "https://accounts.google.com/o/oauth2/auth",
            "https://oauth2.googleapis.com/token",
            List.of("https://www.googleapis.com/auth/gmail.readonly",
                    "https://www.googleapis.com/auth/gmail.send",
                    "https://www.googleapis.com/auth/calendar"),
            Map.of("access_type", "offline",
                    "prompt", "consent",
                    "include_granted_scopes", "true")),

    LINKEDIN("linkedin",
            "https://www.linkedin.com/oauth/v2/authorization",
            "https://www.linkedin.com/oauth/v2/accessToken",
            List.of("openid", "profile", "w_member_social", "email"),
            Map.of());

    private final String key;
    private final String authorizationUri;
    private final String defaultTokenUri;
    private final List<String> scopes;
    private final Map<String, String> extraAuthorizationParams;

    Provider(String key, String authorizationUri, String defaultTokenUri,
             List<String> scopes, Map<String, String> extraAuthorizationParams) {
        this.key = key;
        this.authorizationUri = authorizationUri;
        this.defaultTokenUri = defaultTokenUri;
        this.scopes = scopes;
        this.extraAuthorizationParams = extraAuthorizationParams;
    }

    /** Lower-case name used in URLs and in the {@code oauth_state.provider} column. */
    public String key() {
        return key;
    }

    public String authorizationUri() {
        return authorizationUri;
    }

    public String defaultTokenUri() {
        return defaultTokenUri;
    }

    public List<String> scopes() {
        return scopes;
    }

    public Map<String, String> extraAuthorizationParams() {
        return extraAuthorizationParams;
    }

    public static Provider fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (Provider p : values()) {
                if (p.key.equals(normalized)) return p;
            }
        }
        throw new ValidationException("Unknown provider: " + key, "provider");
    }
}
