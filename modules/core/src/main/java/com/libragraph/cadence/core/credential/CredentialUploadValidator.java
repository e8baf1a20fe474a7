package com.libragraph.cadence.core.credential;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.cadence.core.error.ValidationException;
import com.libragraph.cadence.core.oauth.OAuthSettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks an uploaded client-configuration document and turns it into a
 * {@link ClientConfig}. Google documents are the console download, wrapped in
 * {@code web} or {@code installed}; LinkedIn documents are a flat
 * {@code {client_id, client_secret}} pair.
 */
@ApplicationScoped
public class CredentialUploadValidator {

    static final List<String> GOOGLE_REQUIRED = List.of("client_id", "client_secret", "token_uri", "redirect_uris");
    static final List<String> LINKEDIN_REQUIRED = List.of("client_id", "client_secret");

    private final OAuthSettings settings;

    @Inject
    public CredentialUploadValidator(OAuthSettings settings) {
        this.settings = settings;
    }

    public ClientConfig validate(Provider provider, JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new ValidationException("Credentials document must be a JSON object", "document");
        }
        switch (provider) {
            case GOOGLE:
                return validateGoogle(document);
            case LINKEDIN:
                return validateLinkedIn(document);
            default:
                throw new IllegalArgumentException("Unhandled provider: " + provider);
        }
    }

    private ClientConfig validateGoogle(JsonNode document) {
        JsonNode client = document.has("web") ? document.get("web") : document.get("installed");
        if (client == null || !client.isObject()) {
            throw new ValidationException(
                    "Credentials document must contain a 'web' or 'installed' client section", "web");
        }
        requireFields(client, GOOGLE_REQUIRED);

        JsonNode urisNode = client.get("redirect_uris");
        if (!urisNode.isArray() || urisNode.isEmpty()) {
            throw new ValidationException("redirect_uris must be a non-empty array", "redirect_uris");
        }
        List<String> redirectUris = new ArrayList<>();
        urisNode.forEach(uri -> redirectUris.add(uri.asText()));

        String expected = settings.redirectUri(Provider.GOOGLE);
        if (!redirectUris.contains(expected)) {
            throw new ValidationException(
                    "redirect_uris must include the service callback URL " + expected, "redirect_uris");
        }
        return new ClientConfig(
                client.get("client_id").asText(),
                client.get("client_secret").asText(),
                client.get("token_uri").asText(),
                redirectUris);
    }

    private ClientConfig validateLinkedIn(JsonNode document) {
        requireFields(document, LINKEDIN_REQUIRED);
        return new ClientConfig(
                document.get("client_id").asText(),
                document.get("client_secret").asText(),
                Provider.LINKEDIN.defaultTokenUri(),
                List.of(settings.redirectUri(Provider.LINKEDIN)));
    }

    private static void requireFields(JsonNode node, List<String> required) {
        List<String> missing = new ArrayList<>();
        for (String field : required) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull() || (value.isTextual() && value.asText().isBlank())) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new ValidationException("Missing required fields in credentials document: " + missing, missing);
        }
    }
}
