package com.libragraph.cadence.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.cadence.core.credential.CredentialService;
import com.libragraph.cadence.core.credential.CredentialStatus;
import com.libragraph.cadence.core.credential.Provider;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

/** Client configuration upload. Secrets go in, only status comes out. */
@Path("/api/tenants/{tenantId}/credentials")
@Produces(MediaType.APPLICATION_JSON)
public class CredentialResource {

    @Inject
    CredentialService credentialService;

    @PUT
    @Path("/{provider}")
    @Consumes(MediaType.APPLICATION_JSON)
    public CredentialStatus upload(@PathParam("tenantId") int tenantId,
                                   @PathParam("provider") String provider,
                                   JsonNode document) {
        return credentialService.upload(tenantId, Provider.fromKey(provider), document);
    }

    @GET
    public List<CredentialStatus> status(@PathParam("tenantId") int tenantId) {
        return credentialService.status(tenantId);
    }
}
