package com.libragraph.cadence.core.db;

import com.libragraph.cadence.core.dao.DatabaseDao;
import com.libragraph.cadence.core.service.AbstractManagedService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.sql.DatabaseMetaData;
import java.sql.SQLException;

/**
 * Root infrastructure service that gates access to the database.
 * Starts eagerly at boot via {@code @Startup}, verifies connectivity,
 * and exposes {@link #jdbi()} only when RUNNING. The connection pool itself
 * is owned by Agroal and closed with the application.
 */
@ApplicationScoped
@Startup
public class DatabaseService extends AbstractManagedService {

    private final Jdbi jdbi;

    private String serverVersion;

    @Inject
    public DatabaseService(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    @Override
    public String serviceId() {
        return "database";
    }

    @Override
    protected void doStart() throws SQLException {
        jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
        serverVersion = jdbi.withHandle(h -> {
            DatabaseMetaData meta = h.getConnection().getMetaData();
            return meta.getDatabaseProductName() + " " + meta.getDatabaseProductVersion();
        });
        log.infof("Connected to: %s", serverVersion);
    }

    @Override
    protected void doStop() {
        log.info("DatabaseService stopping (Agroal manages pool shutdown)");
    }

    /** Returns the JDBI instance. Throws if service is not RUNNING. */
    public Jdbi jdbi() {
        if (!isRunning()) {
            throw new IllegalStateException(
                    "DatabaseService is not running (state=" + state() + ")");
        }
        return jdbi;
    }

    /** Executes SELECT 1 to verify connectivity. Calls {@link #fail} on error. */
    public boolean ping() {
        try {
            jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
            return true;
        } catch (Exception e) {
            fail(e);
            return false;
        }
    }

    /** Server version string read at startup. */
    public String serverVersion() {
        return serverVersion;
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("DatabaseService failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping DatabaseService", e);
        }
    }
}
