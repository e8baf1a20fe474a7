package com.libragraph.cadence.core.tenant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.cadence.core.dao.TenantDao;
import com.libragraph.cadence.core.dao.TenantRecord;
import com.libragraph.cadence.core.error.ResourceNotFoundException;
import com.libragraph.cadence.core.job.ScheduleConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tenant accounts and their per-service schedule preferences. Tenants are created
 * on signup and never deleted here.
 */
@ApplicationScoped
public class TenantService {

    private static final Logger log = Logger.getLogger(TenantService.class);

    public static final String STATUS_ACTIVE = "active";

    private static final TypeReference<Map<String, ScheduleConfig>> PREFS_TYPE = new TypeReference<>() {};

    private final Jdbi jdbi;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Inject
    public TenantService(Jdbi jdbi, ObjectMapper objectMapper, Clock clock) {
        this.jdbi = jdbi;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public TenantRecord create() {
        int id = jdbi.withExtension(TenantDao.class,
                dao -> dao.insert(STATUS_ACTIVE, "{}", clock.instant()));
        log.infof("Created tenant %d", id);
        return get(id);
    }

    public TenantRecord get(int tenantId) {
        return jdbi.withExtension(TenantDao.class, dao -> dao.findById(tenantId))
                .orElseThrow(() -> new ResourceNotFoundException("Tenant not found: " + tenantId));
    }

    public void requireExists(int tenantId) {
        get(tenantId);
    }

    public Map<String, ScheduleConfig> schedulePrefs(int tenantId) {
        return readPrefs(get(tenantId).schedulePrefs());
    }

    /** Overlays {@code updates} onto the stored preferences and returns the merged map. */
    public Map<String, ScheduleConfig> mergeSchedulePrefs(int tenantId, Map<String, ScheduleConfig> updates) {
        return jdbi.inTransaction(handle -> {
            TenantDao dao = handle.attach(TenantDao.class);
            TenantRecord tenant = dao.findById(tenantId)
                    .orElseThrow(() -> new ResourceNotFoundException("Tenant not found: " + tenantId));
            Map<String, ScheduleConfig> merged = new LinkedHashMap<>(readPrefs(tenant.schedulePrefs()));
            merged.putAll(updates);
            dao.updateSchedulePrefs(tenantId, writePrefs(merged));
            return merged;
        });
    }

    public Map<String, ScheduleConfig> removeSchedulePrefs(int tenantId, Collection<String> serviceNames) {
        return jdbi.inTransaction(handle -> {
            TenantDao dao = handle.attach(TenantDao.class);
            TenantRecord tenant = dao.findById(tenantId)
                    .orElseThrow(() -> new ResourceNotFoundException("Tenant not found: " + tenantId));
            Map<String, ScheduleConfig> remaining = new LinkedHashMap<>(readPrefs(tenant.schedulePrefs()));
            remaining.keySet().removeAll(serviceNames);
            dao.updateSchedulePrefs(tenantId, writePrefs(remaining));
            return remaining;
        });
    }

    private Map<String, ScheduleConfig> readPrefs(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, PREFS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored schedule preferences are not valid JSON", e);
        }
    }

    private String writePrefs(Map<String, ScheduleConfig> prefs) {
        try {
            return objectMapper.writeValueAsString(prefs);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize schedule preferences", e);
        }
    }
}
