package com.libragraph.cadence.api;

import com.libragraph.cadence.core.audit.ExecutionLog;
import com.libragraph.cadence.core.dao.ExecutionLogRecord;
import com.libragraph.cadence.core.job.ScheduleConfig;
import com.libragraph.cadence.core.orchestrator.JobOrchestrator;
import com.libragraph.cadence.core.tenant.TenantService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.List;
import java.util.Map;

/** Service scheduling, job listing, and the execution log for one tenant. */
@Path("/api/tenants/{tenantId}")
@Produces(MediaType.APPLICATION_JSON)
public class ServiceResource {

    static final int MAX_LOG_ENTRIES = 500;

    @Inject
    JobOrchestrator orchestrator;

    @Inject
    TenantService tenantService;

    @Inject
    ExecutionLog executionLog;

    @PUT
    @Path("/services")
    @Consumes(MediaType.APPLICATION_JSON)
    public List<JobView> configure(@PathParam("tenantId") int tenantId,
                                   Map<String, ScheduleConfig> services) {
        return orchestrator.configureServices(tenantId, services).stream().map(JobView::of).toList();
    }

    @DELETE
    @Path("/services/{service}")
    public Map<String, Object> disable(@PathParam("tenantId") int tenantId,
                                       @PathParam("service") String service) {
        boolean cancelled = orchestrator.disableService(tenantId, service);
        return Map.of("service", service, "cancelled", cancelled);
    }

    @GET
    @Path("/jobs")
    public List<JobView> jobs(@PathParam("tenantId") int tenantId) {
        return orchestrator.listJobs(tenantId).stream().map(JobView::of).toList();
    }

    @GET
    @Path("/jobs/{jobId}")
    public JobView job(@PathParam("tenantId") int tenantId, @PathParam("jobId") String jobId) {
        return JobView.of(orchestrator.getJob(tenantId, jobId));
    }

    @GET
    @Path("/logs")
    public List<ExecutionLogRecord> logs(@PathParam("tenantId") int tenantId,
                                         @QueryParam("limit") @DefaultValue("50") int limit) {
        tenantService.requireExists(tenantId);
        return executionLog.recent(tenantId, Math.max(1, Math.min(limit, MAX_LOG_ENTRIES)));
    }
}
