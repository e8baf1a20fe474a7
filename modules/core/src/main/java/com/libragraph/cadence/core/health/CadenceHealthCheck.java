package com.libragraph.cadence.core.health;

import com.libragraph.cadence.core.db.DatabaseService;
import com.libragraph.cadence.core.scheduler.JobScheduler;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class CadenceHealthCheck implements HealthCheck {

    @Inject
    DatabaseService databaseService;

    @Inject
    JobScheduler jobScheduler;

    @Override
    public HealthCheckResponse call() {
        boolean dbUp = databaseService.ping();
        boolean schedulerUp = jobScheduler.isRunning();
        return HealthCheckResponse.named("cadence")
                .status(dbUp && schedulerUp)
                .withData("database", databaseService.state().name())
                .withData("databaseVersion", String.valueOf(databaseService.serverVersion()))
                .withData("scheduler", jobScheduler.state().name())
                .withData("runningJobs", jobScheduler.runningCount())
                .build();
    }
}
