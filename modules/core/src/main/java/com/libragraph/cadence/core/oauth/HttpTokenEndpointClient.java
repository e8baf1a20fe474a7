package com.libragraph.cadence.core.oauth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.cadence.core.credential.ClientConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@ApplicationScoped
public class HttpTokenEndpointClient implements TokenEndpointClient {

    private static final Logger log = Logger.getLogger(HttpTokenEndpointClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final OAuthSettings settings;

    @Inject
    public HttpTokenEndpointClient(ObjectMapper objectMapper, OAuthSettings settings) {
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(settings.httpTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public TokenResponse exchangeCode(ClientConfig client, String code, String redirectUri) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("redirect_uri", redirectUri);
        form.put("client_id", client.clientId());
        form.put("client_secret", client.clientSecret());
        return post(client.tokenUri(), form);
    }

    @Override
    public TokenResponse refresh(ClientConfig client, String refreshToken) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);
        form.put("client_id", client.clientId());
        form.put("client_secret", client.clientSecret());
        return post(client.tokenUri(), form);
    }

    private TokenResponse post(String tokenUri, Map<String, String> form) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(tokenUri))
                .timeout(settings.httpTimeout())
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TokenExchangeException("Token endpoint " + tokenUri + " unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenExchangeException("Interrupted calling token endpoint " + tokenUri, e);
        }

        return interpret(tokenUri, response.statusCode(), response.body());
    }

    /**
     * Reads a token endpoint reply. An OAuth {@code error} in a 4xx reply is handed
     * back as a failed grant; any other unusable reply is a transport failure.
     */
    TokenResponse interpret(String tokenUri, int status, String body) {
        TokenResponse parsed;
        try {
            parsed = objectMapper.readValue(body, TokenResponse.class);
        } catch (JsonProcessingException e) {
            throw new TokenExchangeException(
                    "Token endpoint " + tokenUri + " returned HTTP " + status + " with an unreadable body", e);
        }

        if (status >= 500) {
            throw new TokenExchangeException("Token endpoint " + tokenUri + " returned HTTP " + status
                    + (parsed.isError() ? " (" + parsed.error() + ")" : ""));
        }
        if (parsed.isError()) {
            log.warnf("Token endpoint %s returned error '%s' (HTTP %d)", tokenUri, parsed.error(), status);
            return parsed;
        }
        if (status >= 400 || parsed.accessToken() == null) {
            throw new TokenExchangeException(
                    "Token endpoint " + tokenUri + " returned HTTP " + status + " without a token");
        }
        return parsed;
    }

    static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
