package com.libragraph.cadence.core.orchestrator;

import com.libragraph.cadence.core.dao.CrewDao;
import com.libragraph.cadence.core.dao.CrewRecord;
import com.libragraph.cadence.core.error.ResourceNotFoundException;
import com.libragraph.cadence.core.oauth.OAuthService;
import com.libragraph.cadence.core.scheduler.JobContext;
import com.libragraph.cadence.core.scheduler.WorkFunction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

/**
 * The work function behind every recurring service job: resolves the crew from
 * {@code (tenant, crew)} and runs the automation for its kind.
 */
@ApplicationScoped
public class CrewJobFunction implements WorkFunction {

    private static final Logger log = Logger.getLogger(CrewJobFunction.class);

    public static final String WORK_REF = "crew_job";

    private final Jdbi jdbi;
    private final OAuthService oauth;
    private final EmailTriagePipeline emailPipeline;
    private final CalendarAgent calendarAgent;
    private final LinkedInContentAgent linkedInAgent;

    @Inject
    public CrewJobFunction(Jdbi jdbi,
                           OAuthService oauth,
                           EmailTriagePipeline emailPipeline,
                           CalendarAgent calendarAgent,
                           LinkedInContentAgent linkedInAgent) {
        this.jdbi = jdbi;
        this.oauth = oauth;
        this.emailPipeline = emailPipeline;
        this.calendarAgent = calendarAgent;
        this.linkedInAgent = linkedInAgent;
    }

    @Override
    public String workRef() {
        return WORK_REF;
    }

    @Override
    public String run(JobContext context) throws Exception {
        if (context.crewId() == null) {
            throw new IllegalArgumentException("Job " + context.jobId() + " has no crew");
        }
        int tenantId = context.tenantId();
        int crewId = context.crewId();
        ServiceKind kind = resolveKind(tenantId, crewId);
        log.debugf("Running %s for tenant %d, crew %d", kind.kind(), tenantId, crewId);

        switch (kind) {
            case EMAIL_SCORING_AND_REPLY:
                return emailPipeline.run(tenantId, context.jobId(), crewId);
            case CALENDAR:
                return calendarAgent.run(tenantId, crewId,
                        oauth.getValidToken(tenantId, kind.provider()).accessToken());
            case LINKEDIN_CONTENT:
                return linkedInAgent.run(tenantId, crewId,
                        oauth.getValidToken(tenantId, kind.provider()).accessToken());
            default:
                throw new IllegalStateException("Unhandled service kind: " + kind);
        }
    }

    /** Loads the crew's kind, rewriting the legacy email kind in place on first sight. */
    ServiceKind resolveKind(int tenantId, int crewId) {
        CrewRecord crew = jdbi.withExtension(CrewDao.class, dao -> dao.findById(crewId))
                .filter(c -> c.tenantId() == tenantId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Crew " + crewId + " not found for tenant " + tenantId));

        String kind = crew.kind();
        if (ServiceKind.LEGACY_EMAIL_KIND.equals(kind)) {
            String migrated = ServiceKind.EMAIL_SCORING_AND_REPLY.kind();
            int updated = jdbi.withExtension(CrewDao.class,
                    dao -> dao.migrateKind(crewId, ServiceKind.LEGACY_EMAIL_KIND, migrated));
            if (updated > 0) {
                log.infof("Migrated crew %d kind '%s' -> '%s'", crewId, kind, migrated);
            }
            kind = migrated;
        }

        String stored = kind;
        return ServiceKind.fromKind(kind)
                .orElseThrow(() -> new IllegalStateException("Crew " + crewId + " has unknown kind '" + stored + "'"));
    }
}
