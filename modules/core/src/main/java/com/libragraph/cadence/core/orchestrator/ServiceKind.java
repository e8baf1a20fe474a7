package com.libragraph.cadence.core.orchestrator;

import com.libragraph.cadence.core.credential.Provider;
import com.libragraph.cadence.core.error.ValidationException;

import java.util.Optional;

/**
 * The closed set of automations a tenant can schedule. {@code serviceName} is what
 * tenants submit; {@code kind} is what a crew record stores.
 */
public enum ServiceKind {

    EMAIL_SCORING_AND_REPLY("Gmail", "email_scoring_and_reply", Provider.GOOGLE),
    CALENDAR("Calendar", "calendar", Provider.GOOGLE),
    LINKEDIN_CONTENT("LinkedIn", "linkedin_content", Provider.LINKEDIN);

    /** Kind stored by older crews for what is now {@link #EMAIL_SCORING_AND_REPLY}. */
    public static final String LEGACY_EMAIL_KIND = "email";

    private final String serviceName;
    private final String kind;
    private final Provider provider;

    ServiceKind(String serviceName, String kind, Provider provider) {
        this.serviceName = serviceName;
        this.kind = kind;
        this.provider = provider;
    }

    public String serviceName() {
        return serviceName;
    }

    public String kind() {
        return kind;
    }

    public Provider provider() {
        return provider;
    }

    public static Optional<ServiceKind> fromKind(String kind) {
        for (ServiceKind k : values()) {
            if (k.kind.equals(kind)) return Optional.of(k);
        }
        return Optional.empty();
    }

    public static ServiceKind fromServiceName(String serviceName) {
        for (ServiceKind k : values()) {
            if (k.serviceName.equalsIgnoreCase(serviceName)) return k;
        }
        throw new ValidationException("Unknown service: " + serviceName, "service");
    }
}
