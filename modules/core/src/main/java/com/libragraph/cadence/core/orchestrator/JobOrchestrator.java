package com.libragraph.cadence.core.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.cadence.core.dao.CrewDao;
import com.libragraph.cadence.core.dao.CrewRecord;
import com.libragraph.cadence.core.error.ResourceNotFoundException;
import com.libragraph.cadence.core.error.ValidationException;
import com.libragraph.cadence.core.job.JobDefinition;
import com.libragraph.cadence.core.job.JobStore;
import com.libragraph.cadence.core.job.ScheduleConfig;
import com.libragraph.cadence.core.job.TriggerSpec;
import com.libragraph.cadence.core.scheduler.JobScheduler;
import com.libragraph.cadence.core.scheduler.ScheduleRequest;
import com.libragraph.cadence.core.tenant.TenantService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a tenant's service schedule into crews and recurring jobs. Each
 * (tenant, service) pair owns one crew and one job with a deterministic id, so
 * reconfiguring replaces the job instead of adding another.
 */
@ApplicationScoped
public class JobOrchestrator {

    private static final Logger log = Logger.getLogger(JobOrchestrator.class);

    private final Jdbi jdbi;
    private final TenantService tenants;
    private final JobScheduler scheduler;
    private final JobStore jobStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Inject
    public JobOrchestrator(Jdbi jdbi,
                           TenantService tenants,
                           JobScheduler scheduler,
                           JobStore jobStore,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this.jdbi = jdbi;
        this.tenants = tenants;
        this.scheduler = scheduler;
        this.jobStore = jobStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Applies {@code {service name -> schedule}}. Every entry is validated before
     * anything is written.
     */
    public List<JobDefinition> configureServices(int tenantId, Map<String, ScheduleConfig> services) {
        tenants.requireExists(tenantId);
        if (services == null || services.isEmpty()) {
            throw new ValidationException("No services to configure", "services");
        }

        Map<ServiceKind, TriggerSpec.Cron> triggers = new LinkedHashMap<>();
        Map<String, ScheduleConfig> prefs = new LinkedHashMap<>();
        for (Map.Entry<String, ScheduleConfig> entry : services.entrySet()) {
            ServiceKind kind = ServiceKind.fromServiceName(entry.getKey());
            if (entry.getValue() == null) {
                throw new ValidationException("Schedule missing for " + entry.getKey(), entry.getKey());
            }
            triggers.put(kind, entry.getValue().toTrigger());
            prefs.put(kind.serviceName(), entry.getValue());
        }

        tenants.mergeSchedulePrefs(tenantId, prefs);

        List<JobDefinition> jobs = new ArrayList<>();
        for (Map.Entry<ServiceKind, TriggerSpec.Cron> entry : triggers.entrySet()) {
            ServiceKind kind = entry.getKey();
            TriggerSpec.Cron trigger = entry.getValue();
            int crewId = ensureCrew(tenantId, kind, trigger);
            jobs.add(scheduler.schedule(new ScheduleRequest(
                    jobId(kind, tenantId, crewId),
                    tenantId,
                    crewId,
                    CrewJobFunction.WORK_REF,
                    kind.kind() + "_job",
                    trigger,
                    Map.of(),
                    true)));
            log.infof("Tenant %d: %s scheduled %s at %s UTC",
                    tenantId, kind.serviceName(), trigger.frequency(), trigger.time());
        }
        return jobs;
    }

    /** Cancels the service's job. Returns false if the tenant never configured it. */
    public boolean disableService(int tenantId, String serviceName) {
        tenants.requireExists(tenantId);
        ServiceKind kind = ServiceKind.fromServiceName(serviceName);
        tenants.removeSchedulePrefs(tenantId, List.of(kind.serviceName()));

        Optional<CrewRecord> crew = findCrew(tenantId, kind);
        if (crew.isEmpty()) {
            return false;
        }
        boolean cancelled = scheduler.cancel(jobId(kind, tenantId, crew.get().id()));
        log.infof("Tenant %d: disabled %s (job cancelled=%s)", tenantId, kind.serviceName(), cancelled);
        return cancelled;
    }

    public List<JobDefinition> listJobs(int tenantId) {
        tenants.requireExists(tenantId);
        return jobStore.listByTenant(tenantId);
    }

    public JobDefinition getJob(int tenantId, String jobId) {
        return jobStore.get(jobId)
                .filter(job -> job.tenantId() == tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Job not found: " + jobId));
    }

    static String jobId(ServiceKind kind, int tenantId, int crewId) {
        return kind.kind() + "_job_" + tenantId + "_" + crewId;
    }

    private int ensureCrew(int tenantId, ServiceKind kind, TriggerSpec.Cron trigger) {
        String schedule = toJson(trigger);
        Optional<CrewRecord> existing = findCrew(tenantId, kind);
        if (existing.isPresent()) {
            int crewId = existing.get().id();
            jdbi.useExtension(CrewDao.class, dao -> dao.updateSchedule(crewId, schedule));
            return crewId;
        }
        int crewId = jdbi.withExtension(CrewDao.class,
                dao -> dao.insert(tenantId, kind.kind(), schedule, clock.instant()));
        log.infof("Tenant %d: created crew %d (%s)", tenantId, crewId, kind.kind());
        return crewId;
    }

    private Optional<CrewRecord> findCrew(int tenantId, ServiceKind kind) {
        List<CrewRecord> crews = jdbi.withExtension(CrewDao.class, dao -> dao.findByTenant(tenantId));
        return crews.stream()
                .filter(c -> c.kind().equals(kind.kind())
                        || (kind == ServiceKind.EMAIL_SCORING_AND_REPLY
                        && ServiceKind.LEGACY_EMAIL_KIND.equals(c.kind())))
                .findFirst();
    }

    private String toJson(TriggerSpec trigger) {
        try {
            return objectMapper.writeValueAsString(trigger);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize schedule", e);
        }
    }
}
