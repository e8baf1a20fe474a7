package com.libragraph.cadence.core.audit;

import com.libragraph.cadence.core.dao.ExecutionLogDao;
import com.libragraph.cadence.core.dao.ExecutionLogRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;
import java.util.List;

/**
 * Append-only audit trail of job outcomes. Recording never throws: a failed write
 * is reported in the application log so that it cannot disturb the job that
 * produced the entry.
 */
@ApplicationScoped
public class ExecutionLog {

    private static final Logger log = Logger.getLogger(ExecutionLog.class);

    static final int MAX_TEXT = 4000;

    private final Jdbi jdbi;
    private final Clock clock;

    @Inject
    public ExecutionLog(Jdbi jdbi, Clock clock) {
        this.jdbi = jdbi;
        this.clock = clock;
    }

    public void success(int tenantId, String jobId, Integer crewId, String result) {
        append(tenantId, jobId, crewId, truncate(result), null);
    }

    public void failure(int tenantId, String jobId, Integer crewId, String error) {
        append(tenantId, jobId, crewId, null, truncate(error == null ? "unknown error" : error));
    }

    public List<ExecutionLogRecord> recent(int tenantId, int limit) {
        return jdbi.withExtension(ExecutionLogDao.class, dao -> dao.findRecentByTenant(tenantId, limit));
    }

    public List<ExecutionLogRecord> forJob(String jobId) {
        return jdbi.withExtension(ExecutionLogDao.class, dao -> dao.findByJob(jobId));
    }

    private void append(int tenantId, String jobId, Integer crewId, String result, String error) {
        try {
            jdbi.useExtension(ExecutionLogDao.class,
                    dao -> dao.append(clock.instant(), tenantId, jobId, crewId, result, error));
        } catch (RuntimeException e) {
            log.errorf(e, "Failed to write execution log entry (tenant=%d, job=%s, result=%s, error=%s)",
                    tenantId, jobId, result, error);
        }
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_TEXT) {
            return text;
        }
        return text.substring(0, MAX_TEXT);
    }
}
