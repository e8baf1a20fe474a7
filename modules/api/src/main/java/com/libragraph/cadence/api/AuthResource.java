package com.libragraph.cadence.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.cadence.core.credential.OAuthToken;
import com.libragraph.cadence.core.credential.Provider;
import com.libragraph.cadence.core.error.ValidationException;
import com.libragraph.cadence.core.oauth.AuthorizationRequest;
import com.libragraph.cadence.core.oauth.OAuthService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Path("/api/tenants/{tenantId}/auth/{provider}")
@Produces(MediaType.APPLICATION_JSON)
public class AuthResource {

    @Inject
    OAuthService oauthService;

    public record CallbackRequest(@JsonProperty("code") String code, @JsonProperty("state") String state) {}

    @POST
    @Path("/begin")
    public Map<String, String> begin(@PathParam("tenantId") int tenantId,
                                     @PathParam("provider") String provider) {
        AuthorizationRequest request = oauthService.beginAuth(tenantId, Provider.fromKey(provider));
        return Map.of(
                "authorization_url", request.authorizationUrl(),
                "state", request.state());
    }

    @POST
    @Path("/callback")
    @Consumes(MediaType.APPLICATION_JSON)
    public Map<String, Object> callback(@PathParam("tenantId") int tenantId,
                                        @PathParam("provider") String provider,
                                        CallbackRequest body) {
        List<String> missing = new ArrayList<>();
        if (body == null || body.code() == null || body.code().isBlank()) missing.add("code");
        if (body == null || body.state() == null || body.state().isBlank()) missing.add("state");
        if (!missing.isEmpty()) {
            throw new ValidationException("Missing callback parameters: " + missing, missing);
        }

        Provider p = Provider.fromKey(provider);
        OAuthToken token = oauthService.completeAuth(tenantId, p, body.code(), body.state());
        return Map.of(
                "provider", p.key(),
                "authorized", true,
                "scopes", token.scopes());
    }
}
