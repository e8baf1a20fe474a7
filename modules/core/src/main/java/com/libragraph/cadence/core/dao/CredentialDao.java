package com.libragraph.cadence.core.dao;

import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transaction;

import java.time.Instant;
import java.util.Optional;

public interface CredentialDao {

    @SqlQuery("SELECT encrypted_blob FROM credential WHERE tenant_id = :tenantId")
    Optional<String> findBlob(@Bind("tenantId") int tenantId);

    @SqlUpdate("UPDATE credential SET encrypted_blob = :blob, updated_at = :updatedAt " +
            "WHERE tenant_id = :tenantId")
    int update(@Bind("tenantId") int tenantId, @Bind("blob") String blob,
               @Bind("updatedAt") Instant updatedAt);

    @SqlUpdate("INSERT INTO credential (tenant_id, encrypted_blob, updated_at) " +
            "VALUES (:tenantId, :blob, :updatedAt)")
    void insert(@Bind("tenantId") int tenantId, @Bind("blob") String blob,
                @Bind("updatedAt") Instant updatedAt);

    /** Last writer wins at the document level. */
    @Transaction
    default void upsert(int tenantId, String blob, Instant updatedAt) {
        if (update(tenantId, blob, updatedAt) == 0) {
            insert(tenantId, blob, updatedAt);
        }
    }
}
