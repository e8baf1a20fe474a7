package com.libragraph.cadence.core.scheduler;

import com.libragraph.cadence.core.audit.ExecutionLog;
import com.libragraph.cadence.core.db.DatabaseService;
import com.libragraph.cadence.core.job.JobDefinition;
import com.libragraph.cadence.core.job.JobStatus;
import com.libragraph.cadence.core.job.JobStore;
import com.libragraph.cadence.core.job.TriggerSpec;
import com.libragraph.cadence.core.service.AbstractManagedService;
import com.libragraph.cadence.core.service.ManagedService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process scheduler over the persistent {@link JobStore}.
 * <p>
 * Every tick scans for active jobs whose {@code next_run} has passed and hands
 * each to a bounded worker pool. A cron job's {@code next_run} is advanced before
 * its work function runs, so the stored fire time never lags behind a dispatch,
 * whatever the outcome. One-off jobs end COMPLETED or ERROR. At most
 * {@code maxInstances} runs of the same job id execute at once; surplus
 * dispatches are skipped.
 * <p>
 * Jobs live in the database, so a restart picks them up again; overdue cron
 * jobs fire once on the first tick, then continue from the next occurrence.
 */
@ApplicationScoped
@Startup
public class JobScheduler extends AbstractManagedService {

    private final DatabaseService databaseService;
    private final JobStore jobStore;
    private final WorkFunctionRegistry functions;
    private final ExecutionLog executionLog;
    private final SchedulerSettings settings;
    private final Clock clock;

    private final ConcurrentMap<String, AtomicInteger> runningPerJob = new ConcurrentHashMap<>();
    private final Set<String> oneOffInFlight = ConcurrentHashMap.newKeySet();
    private final AtomicInteger runningTotal = new AtomicInteger();
    private final SecureRandom random = new SecureRandom();

    private ScheduledExecutorService ticker;
    private ExecutorService workers;

    @Inject
    public JobScheduler(DatabaseService databaseService,
                        JobStore jobStore,
                        WorkFunctionRegistry functions,
                        ExecutionLog executionLog,
                        SchedulerSettings settings,
                        Clock clock) {
        this.databaseService = databaseService;
        this.jobStore = jobStore;
        this.functions = functions;
        this.executionLog = executionLog;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public String serviceId() {
        return "job-scheduler";
    }

    @Override
    protected List<ManagedService> dependencies() {
        return List.of(databaseService);
    }

    @Override
    protected void doStart() {
        workers = Executors.newFixedThreadPool(settings.workerThreads(), namedThreads("job-worker-"));
        ticker = Executors.newSingleThreadScheduledExecutor(namedThreads("job-scheduler-tick-"));

        recoverOnBoot();

        long interval = settings.tickInterval().toMillis();
        ticker.scheduleWithFixedDelay(this::safeTick, interval, interval, TimeUnit.MILLISECONDS);
        log.infof("JobScheduler started (tick=%dms, workers=%d, maxInstances=%d)",
                interval, settings.workerThreads(), settings.maxInstances());
    }

    @Override
    protected void doStop() throws InterruptedException {
        if (ticker != null) {
            ticker.shutdownNow();
        }
        if (workers == null) {
            return;
        }
        workers.shutdown();
        if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warnf("%d job runs still in progress at shutdown", runningTotal.get());
            workers.shutdownNow();
        }
        log.info("JobScheduler stopped");
    }

    // -- registration --

    /**
     * Registers a job and computes its first fire time. With
     * {@code replaceExisting} an existing job of the same id is overwritten, so
     * exactly one definition remains and the latest trigger applies.
     * <p>
     * A one-off job that already reached a terminal status is returned unchanged
     * when registered again with the same trigger: its occurrence has been handled.
     */
    public JobDefinition schedule(ScheduleRequest request) {
        functions.require(request.workRef());

        String jobId = request.jobId() != null ? request.jobId() : generateId(request.jobPrefix());
        Optional<JobDefinition> existing = jobStore.get(jobId);
        if (existing.isPresent() && !request.replaceExisting()) {
            throw new JobConflictException(jobId);
        }
        if (existing.isPresent() && isHandledOccurrence(existing.get(), request.trigger())) {
            log.debugf("One-off job %s already %s; not rescheduled", jobId, existing.get().status().label());
            return existing.get();
        }

        Instant nextRun = TriggerCalculator.nextFireTime(request.trigger(), clock.instant());
        JobDefinition job = new JobDefinition(jobId, request.tenantId(), request.crewId(),
                request.workRef(), request.jobPrefix(), request.trigger(), request.args(),
                JobStatus.ACTIVE, nextRun, existing.map(JobDefinition::lastRun).orElse(null));
        jobStore.put(job);
        log.infof("%s job %s (tenant=%d, work=%s, next run %s)",
                existing.isPresent() ? "Replaced" : "Scheduled",
                jobId, request.tenantId(), request.workRef(), nextRun);
        return job;
    }

    public Optional<JobDefinition> find(String jobId) {
        return jobStore.get(jobId);
    }

    /** Stops a job from firing again; a run already in progress completes. */
    public boolean cancel(String jobId) {
        boolean updated = jobStore.updateStatus(jobId, JobStatus.CANCELLED, null);
        if (updated) {
            log.infof("Cancelled job %s", jobId);
        }
        return updated;
    }

    public boolean remove(String jobId) {
        boolean deleted = jobStore.delete(jobId);
        if (deleted) {
            log.infof("Removed job %s", jobId);
        }
        return deleted;
    }

    // -- dispatch --

    /**
     * Scans for due jobs and dispatches them. Called by the ticker; public so that
     * callers can drive the scheduler deterministically.
     *
     * @return the number of runs handed to the worker pool
     */
    public int tick() {
        Instant now = clock.instant();
        int dispatched = 0;
        for (JobDefinition job : jobStore.findDue(now)) {
            if (dispatch(job, now)) {
                dispatched++;
            }
        }
        return dispatched;
    }

    public int runningCount() {
        return runningTotal.get();
    }

    public int runningCount(String jobId) {
        AtomicInteger count = runningPerJob.get(jobId);
        return count == null ? 0 : count.get();
    }

    private void safeTick() {
        if (!databaseService.isRunning()) {
            log.debug("Database not running; skipping tick");
            return;
        }
        try {
            int dispatched = tick();
            if (dispatched > 0) {
                log.debugf("Dispatched %d jobs", dispatched);
            }
        } catch (Exception e) {
            log.error("Scheduler tick failed", e);
        }
    }

    private boolean dispatch(JobDefinition job, Instant now) {
        Instant scheduledFor = job.nextRun();

        if (job.isOneOff()) {
            if (!oneOffInFlight.add(job.jobId())) {
                return false;
            }
        } else {
            Instant next = TriggerCalculator.nextFireTime(job.trigger(), now);
            if (!jobStore.advance(job.jobId(), next, now)) {
                // cancelled or removed since the scan
                return false;
            }
        }

        AtomicInteger count = runningPerJob.computeIfAbsent(job.jobId(), k -> new AtomicInteger());
        if (count.incrementAndGet() > settings.maxInstances()) {
            count.decrementAndGet();
            if (job.isOneOff()) {
                oneOffInFlight.remove(job.jobId());
            }
            log.warnf("Job %s skipped: %d instances already running", job.jobId(), settings.maxInstances());
            return false;
        }
        runningTotal.incrementAndGet();

        try {
            workers.execute(() -> execute(job, scheduledFor, count));
            return true;
        } catch (RejectedExecutionException e) {
            finished(job, count);
            log.warnf("Job %s not dispatched: worker pool is shut down", job.jobId());
            return false;
        }
    }

    private void execute(JobDefinition job, Instant scheduledFor, AtomicInteger count) {
        JobContext context = new JobContext(job.jobId(), job.tenantId(), job.crewId(), job.args(), scheduledFor);
        try {
            String result = functions.require(job.workRef()).run(context);
            executionLog.success(job.tenantId(), job.jobId(), job.crewId(), result);
            log.debugf("Job %s finished: %s", job.jobId(), result);
            if (job.isOneOff()) {
                finishOneOff(job, JobStatus.COMPLETED);
            }
        } catch (Exception e) {
            log.errorf(e, "Job %s (work=%s, tenant=%d) failed", job.jobId(), job.workRef(), job.tenantId());
            executionLog.failure(job.tenantId(), job.jobId(), job.crewId(), describe(e));
            if (job.isOneOff()) {
                finishOneOff(job, JobStatus.ERROR);
            }
        } finally {
            finished(job, count);
        }
    }

    private void finishOneOff(JobDefinition job, JobStatus outcome) {
        try {
            // a re-registration while running replaces the trigger; leave that one alone
            Optional<JobDefinition> current = jobStore.get(job.jobId());
            if (current.isPresent() && current.get().trigger().equals(job.trigger())) {
                jobStore.updateStatus(job.jobId(), outcome, null, clock.instant());
            }
        } catch (RuntimeException e) {
            log.errorf(e, "Could not mark one-off job %s as %s", job.jobId(), outcome);
        }
    }

    private void finished(JobDefinition job, AtomicInteger count) {
        count.decrementAndGet();
        runningTotal.decrementAndGet();
        if (job.isOneOff()) {
            oneOffInFlight.remove(job.jobId());
        }
    }

    private void recoverOnBoot() {
        Instant now = clock.instant();
        int recovered = 0;
        int overdue = 0;
        for (JobDefinition job : jobStore.findByStatus(JobStatus.ACTIVE)) {
            recovered++;
            if (job.nextRun() == null) {
                Instant next = TriggerCalculator.nextFireTime(job.trigger(), now);
                jobStore.updateStatus(job.jobId(), JobStatus.ACTIVE, next);
                log.warnf("Job %s had no next run; rescheduled for %s", job.jobId(), next);
            } else if (!job.nextRun().isAfter(now)) {
                overdue++;
            }
        }
        log.infof("Recovered %d active jobs (%d overdue, firing on first tick)", recovered, overdue);
    }

    private static boolean isHandledOccurrence(JobDefinition job, TriggerSpec trigger) {
        return job.isOneOff() && job.status().isTerminal() && job.trigger().equals(trigger);
    }

    private String generateId(String prefix) {
        byte[] raw = new byte[4];
        random.nextBytes(raw);
        return prefix + "_" + HexFormat.of().formatHex(raw);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("JobScheduler failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping JobScheduler", e);
        }
    }
}
