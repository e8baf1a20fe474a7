package com.libragraph.cadence.core.oauth;

import com.libragraph.cadence.core.credential.ClientConfig;
import com.libragraph.cadence.core.credential.CredentialStore;
import com.libragraph.cadence.core.credential.MissingCredentialsException;
import com.libragraph.cadence.core.credential.OAuthToken;
import com.libragraph.cadence.core.credential.Provider;
import com.libragraph.cadence.core.credential.ProviderCredentials;
import com.libragraph.cadence.core.dao.OAuthStateDao;
import com.libragraph.cadence.core.dao.OAuthStateRecord;
import com.libragraph.cadence.core.support.FakeTokenEndpoint;
import com.libragraph.cadence.core.support.MutableClock;
import com.libragraph.cadence.core.support.TestDatabase;
import com.libragraph.cadence.core.support.TestKeys;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OAuthServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    private Jdbi jdbi;
    private MutableClock clock;
    private CredentialStore store;
    private OAuthStateStore stateStore;
    private FakeTokenEndpoint endpoint;
    private OAuthService service;
    private int tenantId;

    @BeforeEach
    void setUp() {
        jdbi = TestDatabase.create();
        clock = new MutableClock(NOW);
        store = new CredentialStore(jdbi, TestKeys.vault(), clock);
        stateStore = new OAuthStateStore(jdbi, OAuthSettings.defaults(), clock);
        endpoint = new FakeTokenEndpoint();
        service = new OAuthService(store, stateStore, endpoint, OAuthSettings.defaults(), clock);
        tenantId = TestDatabase.insertTenant(jdbi);
    }

    private void configureGoogle(OAuthToken token) {
        ClientConfig config = new ClientConfig("client-1", "secret-1",
                "https://oauth2.googleapis.com/token", List.of("http://localhost:3000"));
        store.update(tenantId, b -> b.with(Provider.GOOGLE, new ProviderCredentials(config, token)));
    }

    @Test
    void beginAuthBuildsGoogleUrl() {
        configureGoogle(null);

        AuthorizationRequest request = service.beginAuth(tenantId, Provider.GOOGLE);

        assertThat(request.state()).hasSizeGreaterThanOrEqualTo(43);
        assertThat(request.authorizationUrl())
                .startsWith("https://accounts.google.com/o/oauth2/auth?")
                .contains("client_id=client-1")
                .contains("redirect_uri=http%3A%2F%2Flocalhost%3A3000")
                .contains("state=" + request.state())
                .contains("access_type=offline")
                .contains("prompt=consent")
                .contains("gmail.send");
    }

    @Test
    void beginAuthWithoutConfigFails() {
        assertThatThrownBy(() -> service.beginAuth(tenantId, Provider.LINKEDIN))
                .isInstanceOf(MissingCredentialsException.class);
    }

    @Test
    void stateIsAcceptedExactlyOnce() {
        configureGoogle(null);
        AuthorizationRequest request = service.beginAuth(tenantId, Provider.GOOGLE);
        endpoint.respond(TokenResponse.success("access-1", "refresh-1", 3600L, "a b"));

        OAuthToken token = service.completeAuth(tenantId, Provider.GOOGLE, "code-1", request.state());

        assertThat(token.accessToken()).isEqualTo("access-1");
        assertThat(token.expiry()).isEqualTo(NOW.plusSeconds(3600));
        assertThat(token.scopes()).containsExactly("a", "b");
        assertThat(store.require(tenantId, Provider.GOOGLE).token()).isEqualTo(token);

        assertThatThrownBy(() -> service.completeAuth(tenantId, Provider.GOOGLE, "code-1", request.state()))
                .isInstanceOf(InvalidStateException.class);
        assertThat(endpoint.calls()).containsExactly("exchange:code-1");
    }

    @Test
    void expiredStateIsRejectedAndRemoved() {
        configureGoogle(null);
        AuthorizationRequest request = service.beginAuth(tenantId, Provider.GOOGLE);

        clock.advance(Duration.ofMinutes(10).plusSeconds(1));

        assertThatThrownBy(() -> service.completeAuth(tenantId, Provider.GOOGLE, "code", request.state()))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("expired");
        Optional<OAuthStateRecord> stored = jdbi.withExtension(OAuthStateDao.class, dao -> dao.find(tenantId, "google"));
        assertThat(stored).isEmpty();
        assertThat(endpoint.calls()).isEmpty();
    }

    @Test
    void mismatchedStateIsRejectedButKept() {
        configureGoogle(null);
        AuthorizationRequest request = service.beginAuth(tenantId, Provider.GOOGLE);

        assertThatThrownBy(() -> service.completeAuth(tenantId, Provider.GOOGLE, "code", "forged"))
                .isInstanceOf(InvalidStateException.class);

        endpoint.respond(TokenResponse.success("access-1", "refresh-1", 3600L, null));
        assertThat(service.completeAuth(tenantId, Provider.GOOGLE, "code", request.state()).accessToken())
                .isEqualTo("access-1");
    }

    @Test
    void newBeginAuthSupersedesPreviousState() {
        configureGoogle(null);
        AuthorizationRequest first = service.beginAuth(tenantId, Provider.GOOGLE);
        service.beginAuth(tenantId, Provider.GOOGLE);

        assertThatThrownBy(() -> service.completeAuth(tenantId, Provider.GOOGLE, "code", first.state()))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void providerErrorIsInvalidGrant() {
        configureGoogle(null);
        AuthorizationRequest request = service.beginAuth(tenantId, Provider.GOOGLE);
        endpoint.respond(TokenResponse.failure("invalid_grant", "Bad code"));

        assertThatThrownBy(() -> service.completeAuth(tenantId, Provider.GOOGLE, "bad", request.state()))
                .isInstanceOf(InvalidGrantException.class)
                .hasMessageContaining("invalid_grant");
        assertThat(store.require(tenantId, Provider.GOOGLE).token()).isNull();
    }

    @Test
    void freshTokenIsReturnedWithoutRefresh() {
        OAuthToken token = new OAuthToken("access", "refresh", NOW.plus(Duration.ofHours(1)), List.of());
        configureGoogle(token);

        assertThat(service.getValidToken(tenantId, Provider.GOOGLE)).isEqualTo(token);
        assertThat(endpoint.calls()).isEmpty();
    }

    @Test
    void nearExpiryTokenIsRefreshedAndPersisted() {
        configureGoogle(new OAuthToken("old", "refresh-1", NOW.plus(Duration.ofMinutes(4)), List.of("x")));
        endpoint.respond(TokenResponse.success("new", null, 3600L, "x"));

        OAuthToken refreshed = service.getValidToken(tenantId, Provider.GOOGLE);

        assertThat(refreshed.accessToken()).isEqualTo("new");
        assertThat(refreshed.refreshToken()).isEqualTo("refresh-1");
        assertThat(refreshed.expiry()).isEqualTo(NOW.plusSeconds(3600));
        assertThat(store.require(tenantId, Provider.GOOGLE).token()).isEqualTo(refreshed);
        assertThat(endpoint.calls()).containsExactly("refresh:refresh-1");
    }

    @Test
    void rotatedRefreshTokenReplacesOldOne() {
        configureGoogle(new OAuthToken("old", "refresh-1", NOW.minusSeconds(1), List.of()));
        endpoint.respond(TokenResponse.success("new", "refresh-2", 3600L, null));

        assertThat(service.getValidToken(tenantId, Provider.GOOGLE).refreshToken()).isEqualTo("refresh-2");
    }

    @Test
    void expiredWithoutRefreshTokenFails() {
        configureGoogle(new OAuthToken("old", null, NOW.minusSeconds(60), List.of()));

        assertThatThrownBy(() -> service.getValidToken(tenantId, Provider.GOOGLE))
                .isInstanceOf(ExpiredCredentialsException.class);
    }

    @Test
    void nearExpiryWithoutRefreshTokenIsStillUsable() {
        OAuthToken token = new OAuthToken("old", null, NOW.plus(Duration.ofMinutes(2)), List.of());
        configureGoogle(token);

        assertThat(service.getValidToken(tenantId, Provider.GOOGLE)).isEqualTo(token);
    }

    @Test
    void unauthorizedTenantFails() {
        configureGoogle(null);

        assertThatThrownBy(() -> service.getValidToken(tenantId, Provider.GOOGLE))
                .isInstanceOf(ExpiredCredentialsException.class)
                .hasMessageContaining("authorization required");
    }

    @Test
    void revokedRefreshTokenIsInvalidGrant() {
        configureGoogle(new OAuthToken("old", "refresh-1", NOW.minusSeconds(1), List.of()));
        endpoint.respond(TokenResponse.failure("invalid_grant", "Token has been revoked"));

        assertThatThrownBy(() -> service.getValidToken(tenantId, Provider.GOOGLE))
                .isInstanceOf(InvalidGrantException.class);
    }

    @Test
    void concurrentCallersShareOneRefresh() throws Exception {
        configureGoogle(new OAuthToken("old", "refresh-1", NOW.minusSeconds(1), List.of()));
        CountDownLatch inRefresh = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        endpoint.respond(() -> {
            inRefresh.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return TokenResponse.success("new", null, 3600L, null);
        });

        CompletableFuture<OAuthToken> first = CompletableFuture.supplyAsync(
                () -> service.getValidToken(tenantId, Provider.GOOGLE));
        assertThat(inRefresh.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<OAuthToken> second = CompletableFuture.supplyAsync(
                () -> service.getValidToken(tenantId, Provider.GOOGLE));
        release.countDown();

        assertThat(first.get(5, TimeUnit.SECONDS).accessToken()).isEqualTo("new");
        assertThat(second.get(5, TimeUnit.SECONDS).accessToken()).isEqualTo("new");
        assertThat(endpoint.calls()).containsExactly("refresh:refresh-1");
    }

    @Test
    void sweepRemovesOnlyExpiredStates() {
        configureGoogle(null);
        service.beginAuth(tenantId, Provider.GOOGLE);
        clock.advance(Duration.ofMinutes(11));

        assertThat(stateStore.sweepExpired()).isEqualTo(1);
        assertThat(stateStore.sweepExpired()).isZero();
    }
}
