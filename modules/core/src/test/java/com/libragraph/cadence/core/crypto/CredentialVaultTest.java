package com.libragraph.cadence.core.crypto;

import com.libragraph.cadence.core.credential.ClientConfig;
import com.libragraph.cadence.core.credential.CredentialBundle;
import com.libragraph.cadence.core.credential.OAuthToken;
import com.libragraph.cadence.core.credential.Provider;
import com.libragraph.cadence.core.credential.ProviderCredentials;
import com.libragraph.cadence.core.error.ConfigurationException;
import com.libragraph.cadence.core.support.TestKeys;
import com.libragraph.cadence.core.support.TestMappers;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialVaultTest {

    private final CredentialVault vault = TestKeys.vault();

    private static CredentialBundle sampleBundle() {
        ClientConfig config = new ClientConfig("client-1", "s3cret",
                "https://oauth2.googleapis.com/token", List.of("http://localhost:3000"));
        OAuthToken token = new OAuthToken("access-1", "refresh-1",
                Instant.parse("2024-01-01T10:00:00Z"), List.of("gmail.send"));
        return CredentialBundle.empty().with(Provider.GOOGLE, new ProviderCredentials(config, token));
    }

    @Test
    void decryptReturnsWhatWasEncrypted() {
        CredentialBundle bundle = sampleBundle();

        byte[] sealed = vault.encrypt(bundle);

        assertThat(vault.decrypt(sealed, CredentialBundle.class)).isEqualTo(bundle);
    }

    @Test
    void sealedBlobDoesNotContainPlaintext() {
        byte[] sealed = vault.encrypt(sampleBundle());

        assertThat(new String(sealed, StandardCharsets.ISO_8859_1)).doesNotContain("s3cret", "access-1");
    }

    @Test
    void encryptingTwiceUsesFreshNonces() {
        CredentialBundle bundle = sampleBundle();

        assertThat(vault.encrypt(bundle)).isNotEqualTo(vault.encrypt(bundle));
    }

    @Test
    void tamperedCiphertextFails() {
        byte[] sealed = vault.encrypt(sampleBundle());
        sealed[sealed.length - 5] ^= 0x01;

        assertThatThrownBy(() -> vault.decrypt(sealed, CredentialBundle.class))
                .isInstanceOf(DecryptionException.class)
                .hasMessageContaining("tampered");
    }

    @Test
    void wrongKeyFails() {
        byte[] sealed = vault.encrypt(sampleBundle());
        CredentialVault other = TestKeys.vault();

        assertThatThrownBy(() -> other.decrypt(sealed, CredentialBundle.class))
                .isInstanceOf(DecryptionException.class);
    }

    @Test
    void truncatedBlobFails() {
        assertThatThrownBy(() -> vault.decrypt(new byte[]{1, 2, 3}, CredentialBundle.class))
                .isInstanceOf(DecryptionException.class);
        assertThatThrownBy(() -> vault.decryptFromString("not base64!", CredentialBundle.class))
                .isInstanceOf(DecryptionException.class);
    }

    @Test
    void stringFormRoundTrips() {
        CredentialBundle bundle = sampleBundle();

        String encoded = vault.encryptToString(bundle);

        assertThat(vault.decryptFromString(encoded, CredentialBundle.class)).isEqualTo(bundle);
    }

    @Test
    void missingKeyIsAConfigurationError() {
        assertThatThrownBy(() -> new CredentialVault(Optional.empty(), TestMappers.objectMapper()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("cadence.vault.key");
        assertThatThrownBy(() -> new CredentialVault(Optional.of("   "), TestMappers.objectMapper()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shortKeyIsAConfigurationError() {
        assertThatThrownBy(() -> new CredentialVault(Optional.of("c2hvcnQ="), TestMappers.objectMapper()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("32 bytes");
    }
}
