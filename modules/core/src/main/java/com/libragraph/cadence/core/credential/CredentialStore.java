package com.libragraph.cadence.core.credential;

import com.libragraph.cadence.core.crypto.CredentialVault;
import com.libragraph.cadence.core.dao.CredentialDao;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persists each tenant's {@link CredentialBundle} as a single sealed blob.
 * Writes are last-writer-wins on the whole document.
 */
@ApplicationScoped
public class CredentialStore {

    private static final Logger log = Logger.getLogger(CredentialStore.class);

    private final Jdbi jdbi;
    private final CredentialVault vault;
    private final Clock clock;

    @Inject
    public CredentialStore(Jdbi jdbi, CredentialVault vault, Clock clock) {
        this.jdbi = jdbi;
        this.vault = vault;
        this.clock = clock;
    }

    public Optional<CredentialBundle> load(int tenantId) {
        return jdbi.withExtension(CredentialDao.class, dao -> dao.findBlob(tenantId))
                .map(blob -> vault.decryptFromString(blob, CredentialBundle.class));
    }

    public CredentialBundle loadOrEmpty(int tenantId) {
        return load(tenantId).orElseGet(CredentialBundle::empty);
    }

    public ProviderCredentials require(int tenantId, Provider provider) {
        return loadOrEmpty(tenantId).find(provider)
                .orElseThrow(() -> new MissingCredentialsException(tenantId, provider));
    }

    public void save(int tenantId, CredentialBundle bundle) {
        String sealed = vault.encryptToString(bundle);
        jdbi.useExtension(CredentialDao.class, dao -> dao.upsert(tenantId, sealed, clock.instant()));
        log.debugf("Stored credentials for tenant %d (%d providers)", tenantId, bundle.providers().size());
    }

    /** Read-modify-write of the tenant's bundle; returns what was stored. */
    public CredentialBundle update(int tenantId, UnaryOperator<CredentialBundle> change) {
        CredentialBundle updated = change.apply(loadOrEmpty(tenantId));
        save(tenantId, updated);
        return updated;
    }
}
