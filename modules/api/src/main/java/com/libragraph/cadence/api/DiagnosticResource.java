package com.libragraph.cadence.api;

import com.libragraph.cadence.core.db.DatabaseService;
import com.libragraph.cadence.core.scheduler.JobScheduler;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.LinkedHashMap;
import java.util.Map;

@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @Inject
    DatabaseService databaseService;

    @Inject
    JobScheduler jobScheduler;

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        boolean ready = databaseService.isRunning() && jobScheduler.isRunning();
        return Map.of(
                "status", ready ? "ok" : "degraded",
                "database", databaseService.state().name(),
                "scheduler", jobScheduler.state().name()
        );
    }

    @GET
    @Path("/info")
    public Map<String, Object> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", appName);
        info.put("version", appVersion);
        info.put("java", System.getProperty("java.version"));
        info.put("profile", profile);
        info.put("database", databaseService.serverVersion());
        info.put("scheduler", jobScheduler.state().name());
        info.put("runningJobs", jobScheduler.runningCount());
        return info;
    }
}
