package com.libragraph.cadence.core.oauth;

import com.libragraph.cadence.core.credential.Provider;
import com.libragraph.cadence.core.dao.OAuthStateDao;
import com.libragraph.cadence.core.dao.OAuthStateRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * CSRF state values for the authorization flow. At most one outstanding state
 * exists per (tenant, provider); issuing a new one replaces the old. A state is
 * accepted at most once and only before it expires.
 */
@ApplicationScoped
public class OAuthStateStore {

    private static final Logger log = Logger.getLogger(OAuthStateStore.class);

    private static final int STATE_BYTES = 32;

    private final Jdbi jdbi;
    private final OAuthSettings settings;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    @Inject
    public OAuthStateStore(Jdbi jdbi, OAuthSettings settings, Clock clock) {
        this.jdbi = jdbi;
        this.settings = settings;
        this.clock = clock;
    }

    public String issue(int tenantId, Provider provider) {
        byte[] raw = new byte[STATE_BYTES];
        random.nextBytes(raw);
        String state = Base64.getUrlEncoder().withoutPadding().encodeToString(raw);

        Instant now = clock.instant();
        Instant expiresAt = now.plus(settings.stateTtl());
        jdbi.useTransaction(handle -> {
            OAuthStateDao dao = handle.attach(OAuthStateDao.class);
            dao.delete(tenantId, provider.key());
            dao.insert(tenantId, provider.key(), state, expiresAt, now);
        });
        log.debugf("Issued %s state for tenant %d, expires %s", provider.key(), tenantId, expiresAt);
        return state;
    }

    /**
     * Accepts {@code presented} if it equals the outstanding state and has not expired,
     * deleting it in the same step. Otherwise throws {@link InvalidStateException}.
     */
    public void consume(int tenantId, Provider provider, String presented) {
        if (presented == null || presented.isEmpty()) {
            throw new InvalidStateException("Missing state parameter");
        }
        Instant now = clock.instant();
        Outcome outcome = jdbi.inTransaction(handle -> {
            OAuthStateDao dao = handle.attach(OAuthStateDao.class);
            Optional<OAuthStateRecord> stored = dao.find(tenantId, provider.key());
            if (stored.isEmpty()) {
                return Outcome.ABSENT;
            }
            OAuthStateRecord record = stored.get();
            if (!record.expiresAt().isAfter(now)) {
                dao.delete(tenantId, provider.key());
                return Outcome.EXPIRED;
            }
            if (!constantTimeEquals(record.state(), presented)) {
                return Outcome.MISMATCH;
            }
            return dao.deleteMatching(tenantId, provider.key(), record.state()) == 1
                    ? Outcome.ACCEPTED
                    : Outcome.ABSENT;
        });

        switch (outcome) {
            case ACCEPTED:
                log.debugf("Consumed %s state for tenant %d", provider.key(), tenantId);
                return;
            case EXPIRED:
                log.infof("Rejected expired %s state for tenant %d", provider.key(), tenantId);
                throw new InvalidStateException("Authorization state expired; start authorization again");
            case MISMATCH:
                log.warnf("State mismatch on %s callback for tenant %d", provider.key(), tenantId);
                throw new InvalidStateException("Authorization state does not match");
            default:
                throw new InvalidStateException(
                        "No pending " + provider.key() + " authorization for tenant " + tenantId);
        }
    }

    /** Removes states that expired without being used. */
    public int sweepExpired() {
        int removed = jdbi.withExtension(OAuthStateDao.class, dao -> dao.deleteExpired(clock.instant()));
        if (removed > 0) {
            log.infof("Swept %d expired OAuth states", removed);
        }
        return removed;
    }

    private enum Outcome { ACCEPTED, ABSENT, EXPIRED, MISMATCH }

    private static boolean constantTimeEquals(String expected, String presented) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
