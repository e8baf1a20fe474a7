package com.libragraph.cadence.core.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.libragraph.cadence.core.error.ConfigurationException;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * Symmetric sealing of credential documents at rest.
 * <p>
 * Layout of a sealed blob: one format byte, a 12-byte random nonce, then the
 * AES-256-GCM ciphertext with its 128-bit tag. The plaintext is the document's
 * JSON form with sorted keys, so equal documents serialize identically before
 * sealing.
 * <p>
 * The key comes from {@code cadence.vault.key} (base64, 32 bytes). The bean is
 * created at startup so that a missing key stops the process before any request
 * is served.
 */
@ApplicationScoped
@Startup
public class CredentialVault {

    private static final Logger log = Logger.getLogger(CredentialVault.class);

    static final byte FORMAT_V1 = 1;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_BYTES = 32;
    private static final int NONCE_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final SecretKey key;
    private final ObjectMapper mapper;
    private final SecureRandom random = new SecureRandom();

    @Inject
    public CredentialVault(@ConfigProperty(name = "cadence.vault.key") Optional<String> encodedKey,
                           ObjectMapper objectMapper) {
        this.key = decodeKey(encodedKey);
        this.mapper = deterministic(objectMapper);
        log.info("Credential vault initialized (AES-256-GCM)");
    }

    public byte[] encrypt(Object document) {
        byte[] plaintext;
        try {
            plaintext = mapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Credential document is not serializable", e);
        }

        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            byte[] sealed = cipher.doFinal(plaintext);
            return ByteBuffer.allocate(1 + NONCE_BYTES + sealed.length)
                    .put(FORMAT_V1)
                    .put(nonce)
                    .put(sealed)
                    .array();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM unavailable", e);
        }
    }

    public <T> T decrypt(byte[] blob, Class<T> type) {
        if (blob == null || blob.length < 1 + NONCE_BYTES + TAG_BITS / 8) {
            throw new DecryptionException("Credential blob is truncated");
        }
        if (blob[0] != FORMAT_V1) {
            throw new DecryptionException("Unknown credential blob format: " + blob[0]);
        }

        byte[] plaintext;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, blob, 1, NONCE_BYTES));
            plaintext = cipher.doFinal(blob, 1 + NONCE_BYTES, blob.length - 1 - NONCE_BYTES);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Credential blob failed authentication (tampered or wrong key)", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Credential blob could not be decrypted", e);
        }

        try {
            return mapper.readValue(plaintext, type);
        } catch (IOException e) {
            // authenticated but unreadable: written by an incompatible version
            throw new DecryptionException("Decrypted credential document is malformed", e);
        }
    }

    public String encryptToString(Object document) {
        return Base64.getEncoder().encodeToString(encrypt(document));
    }

    public <T> T decryptFromString(String encoded, Class<T> type) {
        byte[] blob;
        try {
            blob = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Credential blob is not valid base64", e);
        }
        return decrypt(blob, type);
    }

    private static SecretKey decodeKey(Optional<String> encodedKey) {
        String value = encodedKey.map(String::trim).filter(s -> !s.isEmpty())
                .orElseThrow(() -> new ConfigurationException(
                        "cadence.vault.key is not set; refusing to start without an encryption key"));
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("cadence.vault.key is not valid base64", e);
        }
        if (raw.length != KEY_BYTES) {
            throw new ConfigurationException(
                    "cadence.vault.key must decode to " + KEY_BYTES + " bytes, got " + raw.length);
        }
        return new SecretKeySpec(raw, "AES");
    }

    private static ObjectMapper deterministic(ObjectMapper base) {
        return base.copy()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }
}
