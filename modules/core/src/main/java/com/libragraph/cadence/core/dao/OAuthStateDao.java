package com.libragraph.cadence.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.Optional;

@RegisterConstructorMapper(OAuthStateRecord.class)
public interface OAuthStateDao {

    @SqlUpdate("INSERT INTO oauth_state (tenant_id, provider, state, expires_at, created_at) " +
            "VALUES (:tenantId, :provider, :state, :expiresAt, :createdAt)")
    void insert(@Bind("tenantId") int tenantId,
                @Bind("provider") String provider,
                @Bind("state") String state,
                @Bind("expiresAt") Instant expiresAt,
                @Bind("createdAt") Instant createdAt);

    @SqlQuery("SELECT * FROM oauth_state WHERE tenant_id = :tenantId AND provider = :provider")
    Optional<OAuthStateRecord> find(@Bind("tenantId") int tenantId, @Bind("provider") String provider);

    @SqlUpdate("DELETE FROM oauth_state WHERE tenant_id = :tenantId AND provider = :provider")
    int delete(@Bind("tenantId") int tenantId, @Bind("provider") String provider);

    /** Deletes only if the stored value still matches; 0 means someone else consumed it. */
    @SqlUpdate("DELETE FROM oauth_state WHERE tenant_id = :tenantId AND provider = :provider " +
            "AND state = :state")
    int deleteMatching(@Bind("tenantId") int tenantId,
                       @Bind("provider") String provider,
                       @Bind("state") String state);

    @SqlUpdate("DELETE FROM oauth_state WHERE expires_at < :now")
    int deleteExpired(@Bind("now") Instant now);
}
