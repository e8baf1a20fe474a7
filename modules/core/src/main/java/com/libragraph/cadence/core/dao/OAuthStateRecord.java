package com.libragraph.cadence.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record OAuthStateRecord(
        @ColumnName("tenant_id") int tenantId,
        @ColumnName("provider") String provider,
        @ColumnName("state") String state,
        @ColumnName("expires_at") Instant expiresAt,
        @ColumnName("created_at") Instant createdAt
) {}
