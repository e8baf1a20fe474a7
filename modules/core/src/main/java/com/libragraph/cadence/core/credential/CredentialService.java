package com.libragraph.cadence.core.credential;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.cadence.core.tenant.TenantService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Tenant-facing credential operations: client configuration upload and status. */
@ApplicationScoped
public class CredentialService {

    private static final Logger log = Logger.getLogger(CredentialService.class);

    private final CredentialStore store;
    private final CredentialUploadValidator validator;
    private final TenantService tenants;

    @Inject
    public CredentialService(CredentialStore store, CredentialUploadValidator validator, TenantService tenants) {
        this.store = store;
        this.validator = validator;
        this.tenants = tenants;
    }

    /**
     * Validates and stores a client configuration. Nothing is written unless the
     * document is valid. A token obtained under the same client id is kept;
     * switching to another client drops it.
     */
    public CredentialStatus upload(int tenantId, Provider provider, JsonNode document) {
        tenants.requireExists(tenantId);
        ClientConfig config = validator.validate(provider, document);

        CredentialBundle stored = store.update(tenantId, bundle -> {
            ProviderCredentials previous = bundle.find(provider).orElse(null);
            boolean sameClient = previous != null
                    && Objects.equals(previous.config().clientId(), config.clientId());
            ProviderCredentials next = sameClient
                    ? new ProviderCredentials(config, previous.token())
                    : ProviderCredentials.unauthorized(config);
            return bundle.with(provider, next);
        });

        log.infof("Stored %s client configuration for tenant %d", provider.key(), tenantId);
        return CredentialStatus.of(provider, stored.find(provider).orElse(null));
    }

    public List<CredentialStatus> status(int tenantId) {
        tenants.requireExists(tenantId);
        CredentialBundle bundle = store.loadOrEmpty(tenantId);
        List<CredentialStatus> result = new ArrayList<>();
        for (Provider provider : Provider.values()) {
            result.add(CredentialStatus.of(provider, bundle.find(provider).orElse(null)));
        }
        return result;
    }
}
