package com.libragraph.cadence.core.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.cadence.core.dao.ScheduledJobDao;
import com.libragraph.cadence.core.dao.ScheduledJobRow;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** {@link JobStore} over the {@code scheduled_job} table. */
@ApplicationScoped
public class JdbiJobStore implements JobStore {

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private final Jdbi jdbi;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Inject
    public JdbiJobStore(Jdbi jdbi, ObjectMapper objectMapper, Clock clock) {
        this.jdbi = jdbi;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void put(JobDefinition job) {
        String trigger = toJson(job.trigger());
        String args = toJson(job.args());
        jdbi.useExtension(ScheduledJobDao.class, dao -> dao.upsert(
                job.jobId(), job.tenantId(), job.crewId(), job.workRef(), job.jobPrefix(),
                job.trigger().typeName(), trigger, args, job.status(),
                job.nextRun(), job.lastRun(), clock.instant()));
    }

    @Override
    public Optional<JobDefinition> get(String jobId) {
        return jdbi.withExtension(ScheduledJobDao.class, dao -> dao.findById(jobId)).map(this::toDefinition);
    }

    @Override
    public List<JobDefinition> listByTenant(int tenantId) {
        return toDefinitions(jdbi.withExtension(ScheduledJobDao.class, dao -> dao.findByTenant(tenantId)));
    }

    @Override
    public boolean updateStatus(String jobId, JobStatus status, Instant nextRun) {
        return jdbi.withExtension(ScheduledJobDao.class,
                dao -> dao.updateStatus(jobId, status, nextRun, clock.instant())) == 1;
    }

    @Override
    public boolean updateStatus(String jobId, JobStatus status, Instant nextRun, Instant lastRun) {
        return jdbi.withExtension(ScheduledJobDao.class,
                dao -> dao.updateStatusAndLastRun(jobId, status, nextRun, lastRun, clock.instant())) == 1;
    }

    @Override
    public boolean advance(String jobId, Instant nextRun, Instant lastRun) {
        return jdbi.withExtension(ScheduledJobDao.class,
                dao -> dao.advance(jobId, JobStatus.ACTIVE, nextRun, lastRun, clock.instant())) == 1;
    }

    @Override
    public boolean delete(String jobId) {
        return jdbi.withExtension(ScheduledJobDao.class, dao -> dao.delete(jobId)) == 1;
    }

    @Override
    public List<JobDefinition> findDue(Instant now) {
        return toDefinitions(jdbi.withExtension(ScheduledJobDao.class,
                dao -> dao.findDue(JobStatus.ACTIVE, now)));
    }

    @Override
    public List<JobDefinition> findByStatus(JobStatus status) {
        return toDefinitions(jdbi.withExtension(ScheduledJobDao.class, dao -> dao.findByStatus(status)));
    }

    private List<JobDefinition> toDefinitions(List<ScheduledJobRow> rows) {
        return rows.stream().map(this::toDefinition).toList();
    }

    private JobDefinition toDefinition(ScheduledJobRow row) {
        try {
            TriggerSpec trigger = objectMapper.readValue(row.triggerSpec(), TriggerSpec.class);
            Map<String, Object> args = objectMapper.readValue(row.args(), ARGS_TYPE);
            return new JobDefinition(row.jobId(), row.tenantId(), row.crewId(), row.funcName(),
                    row.jobPrefix(), trigger, args, row.status(), row.nextRun(), row.lastRun());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt job record " + row.jobId(), e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job data is not serializable", e);
        }
    }
}
