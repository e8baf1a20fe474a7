package com.libragraph.cadence.core.oauth;

import com.libragraph.cadence.core.credential.ClientConfig;
import com.libragraph.cadence.core.credential.CredentialStore;
import com.libragraph.cadence.core.credential.OAuthToken;
import com.libragraph.cadence.core.credential.Provider;
import com.libragraph.cadence.core.credential.ProviderCredentials;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Authorization-code flow and token lifecycle per (tenant, provider).
 * <p>
 * {@link #beginAuth} issues a state and an authorization URL, {@link #completeAuth}
 * validates the echoed state and stores the exchanged token, and
 * {@link #getValidToken} hands out a token that is not about to expire, refreshing
 * it first when needed. Refreshes for one (tenant, provider) run one at a time.
 */
@ApplicationScoped
public class OAuthService {

    private static final Logger log = Logger.getLogger(OAuthService.class);

    private final CredentialStore credentialStore;
    private final OAuthStateStore stateStore;
    private final TokenEndpointClient tokenEndpoint;
    private final OAuthSettings settings;
    private final Clock clock;

    private final ConcurrentMap<String, ReentrantLock> refreshLocks = new ConcurrentHashMap<>();

    @Inject
    public OAuthService(CredentialStore credentialStore,
                        OAuthStateStore stateStore,
                        TokenEndpointClient tokenEndpoint,
                        OAuthSettings settings,
                        Clock clock) {
        this.credentialStore = credentialStore;
        this.stateStore = stateStore;
        this.tokenEndpoint = tokenEndpoint;
        this.settings = settings;
        this.clock = clock;
    }

    public AuthorizationRequest beginAuth(int tenantId, Provider provider) {
        ClientConfig client = credentialStore.require(tenantId, provider).config();
        String state = stateStore.issue(tenantId, provider);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("response_type", "code");
        params.put("client_id", client.clientId());
        params.put("redirect_uri", settings.redirectUri(provider));
        params.put("scope", String.join(" ", provider.scopes()));
        params.put("state", state);
        params.putAll(provider.extraAuthorizationParams());

        String url = provider.authorizationUri() + "?" + params.entrySet().stream()
                .map(e -> e.getKey() + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));
        log.infof("Issued %s authorization request for tenant %d", provider.key(), tenantId);
        return new AuthorizationRequest(provider, url, state);
    }

    /**
     * Finishes the flow started by {@link #beginAuth}. The state is consumed before the
     * code is exchanged, so a replayed callback fails even if the exchange did not.
     */
    public OAuthToken completeAuth(int tenantId, Provider provider, String code, String state) {
        stateStore.consume(tenantId, provider, state);
        ProviderCredentials current = credentialStore.require(tenantId, provider);

        TokenResponse response = tokenEndpoint.exchangeCode(current.config(), code, settings.redirectUri(provider));
        if (response.isError()) {
            throw new InvalidGrantException(describe(provider, response));
        }

        String previousRefresh = current.token() == null ? null : current.token().refreshToken();
        OAuthToken token = toToken(response, previousRefresh, clock.instant());
        credentialStore.update(tenantId, bundle -> bundle.with(provider,
                bundle.find(provider).orElse(current).withToken(token)));
        log.infof("Tenant %d authorized %s (scopes=%s, expiry=%s)",
                tenantId, provider.key(), token.scopes(), token.expiry());
        return token;
    }

    public OAuthToken getValidToken(int tenantId, Provider provider) {
        OAuthToken token = currentToken(tenantId, provider);
        Instant now = clock.instant();
        if (!token.expiresWithin(settings.refreshBuffer(), now)) {
            return token;
        }
        if (token.hasRefreshToken()) {
            return refreshSerialized(tenantId, provider);
        }
        if (token.isExpiredAt(now)) {
            throw new ExpiredCredentialsException(
                    provider.key() + " token for tenant " + tenantId + " expired and cannot be refreshed; re-authorize");
        }
        return token;
    }

    private OAuthToken refreshSerialized(int tenantId, Provider provider) {
        ReentrantLock lock = refreshLocks.computeIfAbsent(tenantId + ":" + provider.key(), k -> new ReentrantLock());
        lock.lock();
        try {
            // another caller may have refreshed while we waited
            ProviderCredentials current = credentialStore.require(tenantId, provider);
            OAuthToken token = requireToken(tenantId, provider, current);
            Instant now = clock.instant();
            if (!token.expiresWithin(settings.refreshBuffer(), now)) {
                return token;
            }

            log.debugf("Refreshing %s token for tenant %d (expiry=%s)", provider.key(), tenantId, token.expiry());
            TokenResponse response = tokenEndpoint.refresh(current.config(), token.refreshToken());
            if (response.isError()) {
                throw new InvalidGrantException(describe(provider, response));
            }

            OAuthToken refreshed = toToken(response, token.refreshToken(), clock.instant());
            credentialStore.update(tenantId, bundle -> bundle.with(provider,
                    bundle.find(provider).orElse(current).withToken(refreshed)));
            log.infof("Refreshed %s token for tenant %d, new expiry %s", provider.key(), tenantId, refreshed.expiry());
            return refreshed;
        } finally {
            lock.unlock();
        }
    }

    private OAuthToken currentToken(int tenantId, Provider provider) {
        return requireToken(tenantId, provider, credentialStore.require(tenantId, provider));
    }

    private static OAuthToken requireToken(int tenantId, Provider provider, ProviderCredentials credentials) {
        if (credentials.token() == null) {
            throw new ExpiredCredentialsException(
                    "Tenant " + tenantId + " has not authorized " + provider.key() + "; authorization required");
        }
        return credentials.token();
    }

    static OAuthToken toToken(TokenResponse response, String previousRefreshToken, Instant now) {
        Instant expiry = response.expiresIn() == null ? null : now.plusSeconds(response.expiresIn());
        String refreshToken = response.refreshToken() != null && !response.refreshToken().isBlank()
                ? response.refreshToken()
                : previousRefreshToken;
        List<String> scopes = response.scopeList();
        return new OAuthToken(response.accessToken(), refreshToken, expiry, scopes);
    }

    private static String describe(Provider provider, TokenResponse response) {
        String message = provider.key() + " rejected the grant: " + response.error();
        if (response.errorDescription() != null) {
            message += " (" + response.errorDescription() + ")";
        }
        return message + "; re-authorization required";
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
