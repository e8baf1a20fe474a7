package com.libragraph.cadence.core.orchestrator;

import com.libragraph.cadence.core.audit.ExecutionLog;
import com.libragraph.cadence.core.credential.ClientConfig;
import com.libragraph.cadence.core.credential.CredentialStore;
import com.libragraph.cadence.core.credential.OAuthToken;
import com.libragraph.cadence.core.credential.Provider;
import com.libragraph.cadence.core.credential.ProviderCredentials;
import com.libragraph.cadence.core.db.DatabaseService;
import com.libragraph.cadence.core.job.JdbiJobStore;
import com.libragraph.cadence.core.oauth.OAuthService;
import com.libragraph.cadence.core.oauth.OAuthSettings;
import com.libragraph.cadence.core.oauth.OAuthStateStore;
import com.libragraph.cadence.core.scheduler.JobContext;
import com.libragraph.cadence.core.scheduler.JobScheduler;
import com.libragraph.cadence.core.scheduler.SchedulerSettings;
import com.libragraph.cadence.core.scheduler.WorkFunction;
import com.libragraph.cadence.core.scheduler.WorkFunctionRegistry;
import com.libragraph.cadence.core.support.FakeTokenEndpoint;
import com.libragraph.cadence.core.support.MutableClock;
import com.libragraph.cadence.core.support.TestDatabase;
import com.libragraph.cadence.core.support.TestKeys;
import com.libragraph.cadence.core.support.TestMappers;
import com.libragraph.cadence.core.tenant.TenantService;
import org.jdbi.v3.core.Jdbi;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Wires the orchestrator stack by hand against an in-memory database, with the
 * agent integrations replaced by recording fakes.
 */
class OrchestratorFixture implements AutoCloseable {

    final Jdbi jdbi = TestDatabase.create();
    final MutableClock clock;
    final CredentialStore credentialStore;
    final FakeTokenEndpoint tokenEndpoint = new FakeTokenEndpoint();
    final OAuthService oauth;
    final ExecutionLog executionLog;
    final JdbiJobStore jobStore;
    final DatabaseService database;
    final JobScheduler scheduler;
    final TenantService tenants;

    final List<ScoredEmail> inbox = new ArrayList<>();
    final List<DraftReply> sent = Collections.synchronizedList(new ArrayList<>());
    final Set<String> noReplyFor = new HashSet<>();
    final Set<String> sendFailsFor = new HashSet<>();
    final List<String> agentRuns = Collections.synchronizedList(new ArrayList<>());

    final EmailTriagePipeline pipeline;
    final EmailFollowUpFunction followUp;
    final CrewJobFunction crewJob;

    OrchestratorFixture(Instant now) throws Exception {
        clock = new MutableClock(now);
        credentialStore = new CredentialStore(jdbi, TestKeys.vault(), clock);
        oauth = new OAuthService(credentialStore,
                new OAuthStateStore(jdbi, OAuthSettings.defaults(), clock),
                tokenEndpoint, OAuthSettings.defaults(), clock);
        executionLog = new ExecutionLog(jdbi, clock);
        jobStore = new JdbiJobStore(jdbi, TestMappers.objectMapper(), clock);
        tenants = new TenantService(jdbi, TestMappers.objectMapper(), clock);
        database = new DatabaseService(jdbi);
        database.start();

        EmailScorer scorer = (tenantId, accessToken) -> List.copyOf(inbox);
        ReplyGenerator generator = (tenantId, email) -> noReplyFor.contains(email.id())
                ? Optional.empty()
                : Optional.of(new DraftReply(email.from(), "Re: " + email.subject(), "Thanks!", email.id()));
        ReplySender sender = (tenantId, accessToken, reply) -> {
            if (sendFailsFor.contains(reply.inReplyTo())) {
                throw new IllegalStateException("SMTP rejected");
            }
            sent.add(reply);
        };
        CalendarAgent calendar = (tenantId, crewId, accessToken) -> {
            agentRuns.add("calendar:" + crewId + ":" + accessToken);
            return "Calendar updated";
        };
        LinkedInContentAgent linkedIn = (tenantId, crewId, accessToken) -> {
            agentRuns.add("linkedin:" + crewId + ":" + accessToken);
            return "Post published";
        };

        followUp = new EmailFollowUpFunction(oauth, generator, sender);
        CrewJobHolder holder = new CrewJobHolder();
        WorkFunctionRegistry registry = new WorkFunctionRegistry(List.of(followUp, holder));
        scheduler = new JobScheduler(database, jobStore, registry, executionLog,
                new SchedulerSettings(Duration.ofHours(1), 4, 3), clock);
        scheduler.start();

        pipeline = new EmailTriagePipeline(oauth, scorer, generator, sender, scheduler, executionLog,
                FollowUpSettings.defaults(), clock);
        crewJob = new CrewJobFunction(jdbi, oauth, pipeline, calendar, linkedIn);
        holder.target = crewJob;
    }

    int tenant(int id) {
        return TestDatabase.insertTenant(jdbi, id);
    }

    void authorize(int tenantId, Provider provider, String accessToken) {
        ClientConfig config = new ClientConfig("client", "secret", provider.defaultTokenUri(),
                List.of("http://localhost:3000"));
        OAuthToken token = new OAuthToken(accessToken, "refresh",
                clock.instant().plus(Duration.ofDays(30)), List.of());
        credentialStore.update(tenantId, b -> b.with(provider, new ProviderCredentials(config, token)));
    }

    void awaitIdle() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (scheduler.runningCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    @Override
    public void close() throws Exception {
        scheduler.stop();
        database.stop();
    }

    /** Registers under the crew job name before the real function exists. */
    private static final class CrewJobHolder implements WorkFunction {
        private volatile WorkFunction target;

        @Override
        public String workRef() {
            return CrewJobFunction.WORK_REF;
        }

        @Override
        public String run(JobContext context) throws Exception {
            return target.run(context);
        }
    }
}
