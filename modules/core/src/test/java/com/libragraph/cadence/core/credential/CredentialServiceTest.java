package com.libragraph.cadence.core.credential;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.cadence.core.crypto.CredentialVault;
import com.libragraph.cadence.core.dao.CredentialDao;
import com.libragraph.cadence.core.error.ResourceNotFoundException;
import com.libragraph.cadence.core.error.ValidationException;
import com.libragraph.cadence.core.oauth.OAuthSettings;
import com.libragraph.cadence.core.support.MutableClock;
import com.libragraph.cadence.core.support.TestDatabase;
import com.libragraph.cadence.core.support.TestKeys;
import com.libragraph.cadence.core.support.TestMappers;
import com.libragraph.cadence.core.tenant.TenantService;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialServiceTest {

    private static final String GOOGLE_DOC = """
            {"web": {"client_id": "abc", "client_secret": "xyz",
                     "token_uri": "https://oauth2.googleapis.com/token",
                     "redirect_uris": ["http://localhost:3000"]}}
            """;

    private final ObjectMapper mapper = TestMappers.objectMapper();
    private Jdbi jdbi;
    private CredentialStore store;
    private CredentialService service;
    private int tenantId;

    @BeforeEach
    void setUp() {
        jdbi = TestDatabase.create();
        MutableClock clock = MutableClock.at("2024-01-01T10:00:00Z");
        CredentialVault vault = TestKeys.vault();
        store = new CredentialStore(jdbi, vault, clock);
        service = new CredentialService(store,
                new CredentialUploadValidator(OAuthSettings.defaults()),
                new TenantService(jdbi, mapper, clock));
        tenantId = TestDatabase.insertTenant(jdbi);
    }

    @Test
    void uploadStoresEncryptedConfiguration() throws Exception {
        CredentialStatus status = service.upload(tenantId, Provider.GOOGLE, mapper.readTree(GOOGLE_DOC));

        assertThat(status.configured()).isTrue();
        assertThat(status.authorized()).isFalse();

        String blob = jdbi.withExtension(CredentialDao.class, dao -> dao.findBlob(tenantId)).orElseThrow();
        assertThat(blob).doesNotContain("xyz");
        assertThat(store.require(tenantId, Provider.GOOGLE).config().clientSecret()).isEqualTo("xyz");
    }

    @Test
    void invalidUploadPersistsNothing() throws Exception {
        String missingSecret = """
                {"web": {"client_id": "abc",
                         "token_uri": "https://oauth2.googleapis.com/token",
                         "redirect_uris": ["http://localhost:3000"]}}
                """;

        assertThatThrownBy(() -> service.upload(tenantId, Provider.GOOGLE, mapper.readTree(missingSecret)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("client_secret");

        Optional<String> stored = jdbi.withExtension(CredentialDao.class, dao -> dao.findBlob(tenantId));
        assertThat(stored).isEmpty();
    }

    @Test
    void reuploadOfSameClientKeepsToken() throws Exception {
        service.upload(tenantId, Provider.GOOGLE, mapper.readTree(GOOGLE_DOC));
        OAuthToken token = new OAuthToken("access", "refresh", Instant.parse("2024-01-01T11:00:00Z"), List.of());
        store.update(tenantId, b -> b.with(Provider.GOOGLE, b.find(Provider.GOOGLE).orElseThrow().withToken(token)));

        service.upload(tenantId, Provider.GOOGLE, mapper.readTree(GOOGLE_DOC));

        assertThat(store.require(tenantId, Provider.GOOGLE).token()).isEqualTo(token);
    }

    @Test
    void uploadingAnotherClientDropsToken() throws Exception {
        service.upload(tenantId, Provider.GOOGLE, mapper.readTree(GOOGLE_DOC));
        OAuthToken token = new OAuthToken("access", "refresh", Instant.parse("2024-01-01T11:00:00Z"), List.of());
        store.update(tenantId, b -> b.with(Provider.GOOGLE, b.find(Provider.GOOGLE).orElseThrow().withToken(token)));

        service.upload(tenantId, Provider.GOOGLE, mapper.readTree(GOOGLE_DOC.replace("\"abc\"", "\"other\"")));

        assertThat(store.require(tenantId, Provider.GOOGLE).token()).isNull();
    }

    @Test
    void providersShareOneRecord() throws Exception {
        service.upload(tenantId, Provider.GOOGLE, mapper.readTree(GOOGLE_DOC));
        service.upload(tenantId, Provider.LINKEDIN,
                mapper.readTree("{\"client_id\": \"li\", \"client_secret\": \"li-secret\"}"));

        List<CredentialStatus> statuses = service.status(tenantId);

        assertThat(statuses).extracting(CredentialStatus::provider)
                .containsExactly(Provider.GOOGLE, Provider.LINKEDIN);
        assertThat(statuses).allMatch(CredentialStatus::configured);
        assertThat(store.require(tenantId, Provider.GOOGLE).config().clientId()).isEqualTo("abc");
    }

    @Test
    void statusOfFreshTenantShowsNothingConfigured() {
        assertThat(service.status(tenantId)).noneMatch(CredentialStatus::configured);
    }

    @Test
    void unknownTenantIsRejected() throws Exception {
        assertThatThrownBy(() -> service.upload(9999, Provider.GOOGLE, mapper.readTree(GOOGLE_DOC)))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void requireWithoutUploadThrowsMissingCredentials() {
        assertThatThrownBy(() -> store.require(tenantId, Provider.LINKEDIN))
                .isInstanceOf(MissingCredentialsException.class)
                .hasMessageContaining("linkedin");
    }
}
