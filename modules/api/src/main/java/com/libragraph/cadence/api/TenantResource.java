package com.libragraph.cadence.api;

import com.libragraph.cadence.core.dao.TenantRecord;
import com.libragraph.cadence.core.tenant.TenantService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.Map;

@Path("/api/tenants")
@Produces(MediaType.APPLICATION_JSON)
public class TenantResource {

    @Inject
    TenantService tenantService;

    @POST
    public Response create() {
        TenantRecord tenant = tenantService.create();
        return Response.status(Response.Status.CREATED).entity(view(tenant)).build();
    }

    @GET
    @Path("/{tenantId}")
    public Map<String, Object> get(@PathParam("tenantId") int tenantId) {
        return view(tenantService.get(tenantId));
    }

    private Map<String, Object> view(TenantRecord tenant) {
        return Map.of(
                "tenant_id", tenant.id(),
                "status", tenant.status(),
                "schedule_prefs", tenantService.schedulePrefs(tenant.id()),
                "created_at", tenant.createdAt().toString());
    }
}
