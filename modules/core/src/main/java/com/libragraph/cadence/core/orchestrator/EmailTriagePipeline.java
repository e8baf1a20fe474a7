package com.libragraph.cadence.core.orchestrator;

import com.libragraph.cadence.core.audit.ExecutionLog;
import com.libragraph.cadence.core.credential.Provider;
import com.libragraph.cadence.core.job.TriggerSpec;
import com.libragraph.cadence.core.oauth.OAuthService;
import com.libragraph.cadence.core.scheduler.JobScheduler;
import com.libragraph.cadence.core.scheduler.ScheduleRequest;
import com.libragraph.cadence.util.UtcTimestamps;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Scores a tenant's recent mail and branches per message: a score below the
 * threshold is answered within this run, anything else gets a one-off follow-up
 * job at received time plus the configured delay.
 * <p>
 * An email whose follow-up job has already finished is left alone, so a message
 * that stays in the recent inbox is not answered twice.
 * <p>
 * Lower scores take the immediate branch. That follows the scorer's contract as
 * deployed, even though the scorer describes higher scores as more urgent.
 */
@ApplicationScoped
public class EmailTriagePipeline {

    private static final Logger log = Logger.getLogger(EmailTriagePipeline.class);

    public static final String FOLLOW_UP_PREFIX = "email_followup";

    private final OAuthService oauth;
    private final EmailScorer scorer;
    private final ReplyGenerator replyGenerator;
    private final ReplySender replySender;
    private final JobScheduler scheduler;
    private final ExecutionLog executionLog;
    private final FollowUpSettings settings;
    private final Clock clock;

    @Inject
    public EmailTriagePipeline(OAuthService oauth,
                               EmailScorer scorer,
                               ReplyGenerator replyGenerator,
                               ReplySender replySender,
                               JobScheduler scheduler,
                               ExecutionLog executionLog,
                               FollowUpSettings settings,
                               Clock clock) {
        this.oauth = oauth;
        this.scorer = scorer;
        this.replyGenerator = replyGenerator;
        this.replySender = replySender;
        this.scheduler = scheduler;
        this.executionLog = executionLog;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Triages the inbox. Each message's outcome is written to the execution log on
     * its own; a failure on one message does not stop the others.
     *
     * @return a one-line summary of the run
     */
    public String run(int tenantId, String jobId, Integer crewId) throws Exception {
        String accessToken = oauth.getValidToken(tenantId, Provider.GOOGLE).accessToken();
        List<ScoredEmail> emails = scorer.scoreRecent(tenantId, accessToken);

        int replied = 0;
        int deferred = 0;
        int failed = 0;
        for (ScoredEmail email : emails) {
            try {
                if (followUpHandled(email)) {
                    log.debugf("Tenant %d: follow-up for email %s already handled", tenantId, email.id());
                    continue;
                }
                if (email.urgencyScore() < settings.urgencyThreshold()) {
                    if (replyNow(tenantId, jobId, crewId, accessToken, email)) {
                        replied++;
                    }
                } else {
                    scheduleFollowUp(tenantId, jobId, crewId, email);
                    deferred++;
                }
            } catch (Exception e) {
                failed++;
                log.errorf(e, "Tenant %d: processing email %s failed", tenantId, email.id());
                executionLog.failure(tenantId, jobId, crewId,
                        "Failed to process email " + email.id() + ": " + e.getMessage());
            }
        }

        String summary = String.format("Processed %d emails: %d replied, %d deferred, %d failed",
                emails.size(), replied, deferred, failed);
        log.infof("Tenant %d: %s", tenantId, summary);
        return summary;
    }

    private boolean replyNow(int tenantId, String jobId, Integer crewId, String accessToken,
                             ScoredEmail email) throws Exception {
        Optional<DraftReply> draft = replyGenerator.draft(tenantId, email);
        if (draft.isEmpty()) {
            executionLog.success(tenantId, jobId, crewId, "No reply generated for email " + email.id());
            return false;
        }
        replySender.send(tenantId, accessToken, draft.get());
        executionLog.success(tenantId, jobId, crewId, "Sent reply for email " + email.id());
        return true;
    }

    /** True once the email's follow-up job has run, failed or been cancelled. */
    private boolean followUpHandled(ScoredEmail email) {
        return scheduler.find(followUpJobId(email))
                .map(job -> job.status().isTerminal())
                .orElse(false);
    }

    static String followUpJobId(ScoredEmail email) {
        return FOLLOW_UP_PREFIX + "_" + email.id();
    }

    private void scheduleFollowUp(int tenantId, String jobId, Integer crewId, ScoredEmail email) {
        Instant runAt = followUpTime(email);
        scheduler.schedule(new ScheduleRequest(
                followUpJobId(email),
                tenantId,
                crewId,
                EmailFollowUpFunction.WORK_REF,
                FOLLOW_UP_PREFIX,
                new TriggerSpec.At(runAt),
                email.toArgs(),
                true));
        executionLog.success(tenantId, jobId, crewId,
                "Scheduled follow-up for email " + email.id() + " at " + runAt);
    }

    /** Received time plus the delay; now plus the delay when the received time is unreadable. */
    Instant followUpTime(ScoredEmail email) {
        Optional<Instant> received = UtcTimestamps.parse(email.receivedTime());
        if (received.isEmpty()) {
            log.debugf("Unparsable received time '%s' on email %s; using now", email.receivedTime(), email.id());
        }
        return received.orElseGet(clock::instant).plus(settings.delay());
    }
}
