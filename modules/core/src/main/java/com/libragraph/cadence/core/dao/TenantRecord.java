package com.libragraph.cadence.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record TenantRecord(
        @ColumnName("id") int id,
        @ColumnName("status") String status,
        @ColumnName("schedule_prefs") String schedulePrefs,
        @ColumnName("created_at") Instant createdAt
) {}
