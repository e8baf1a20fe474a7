package com.libragraph.cadence.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record CrewRecord(
        @ColumnName("id") int id,
        @ColumnName("tenant_id") int tenantId,
        @ColumnName("kind") String kind,
        @ColumnName("schedule") String schedule,
        @ColumnName("created_at") Instant createdAt
) {}
