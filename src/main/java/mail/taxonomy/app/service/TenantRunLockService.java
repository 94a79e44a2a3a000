package mail.taxonomy.app.service;

import lombok.extern.slf4j.Slf4j;
import mail.taxonomy.app.config.TaxonomyProperties;
import mail.taxonomy.app.exception.TenantBusyException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Per-tenant lock held in a database table so that provisioning and reconciliation for one
 * tenant never interleave, also across nodes. Different tenants never contend.
 */
@Slf4j
@Service
public class TenantRunLockService {
    private static final String LOCK_TABLE = "tenant_run_locks";

    private final JdbcTemplate jdbcTemplate;
    private final Duration lockTimeout;
    private final String nodeId;

    public TenantRunLockService(JdbcTemplate jdbcTemplate, TaxonomyProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.lockTimeout = properties.getLock().getTimeout();
        this.nodeId = resolveNodeId();
        initializeLockTable();
    }

    private void initializeLockTable() {
        try {
            jdbcTemplate.execute(
                "CREATE TABLE IF NOT EXISTS " + LOCK_TABLE + " (" +
                "tenant_id VARCHAR(255) PRIMARY KEY, " +
                "locked_by VARCHAR(255) NOT NULL, " +
                "locked_at TIMESTAMP NOT NULL, " +
                "expires_at TIMESTAMP NOT NULL" +
                ")"
            );
            log.debug("Tenant lock table initialized");
        } catch (Exception e) {
            log.warn("Could not initialize tenant lock table (may already exist): {}", e.getMessage());
        }
    }

    /**
     * @return the owner token to release with, or empty if another run holds the lock
     */
    public Optional<String> tryLock(String tenantId) {
        Instant now = Instant.now();
        jdbcTemplate.update("DELETE FROM " + LOCK_TABLE + " WHERE tenant_id = ? AND expires_at < ?",
                tenantId, Timestamp.from(now));

        String owner = nodeId + ":" + UUID.randomUUID();
        try {
            int rows = jdbcTemplate.update(
                "INSERT INTO " + LOCK_TABLE + " (tenant_id, locked_by, locked_at, expires_at) VALUES (?, ?, ?, ?)",
                tenantId, owner, Timestamp.from(now), Timestamp.from(now.plus(lockTimeout)));
            if (rows > 0) {
                log.debug("Acquired run lock for tenant {}", tenantId);
                return Optional.of(owner);
            }
        } catch (DataIntegrityViolationException e) {
            log.debug("Run lock for tenant {} is held by another run", tenantId);
        }
        return Optional.empty();
    }

    public void release(String tenantId, String owner) {
        try {
            int rows = jdbcTemplate.update("DELETE FROM " + LOCK_TABLE + " WHERE tenant_id = ? AND locked_by = ?",
                    tenantId, owner);
            if (rows == 0) {
                log.warn("Run lock for tenant {} was already gone on release (expired?)", tenantId);
            }
        } catch (Exception e) {
            log.error("Error releasing run lock for tenant {}: {}", tenantId, e.getMessage(), e);
        }
    }

    /**
     * Runs {@code work} holding the tenant lock.
     * @throws TenantBusyException if another run holds it
     */
    public <T> T runExclusively(String tenantId, Supplier<T> work) {
        return runIfFree(tenantId, work).orElseThrow(() -> new TenantBusyException(tenantId));
    }

    /**
     * Runs {@code work} holding the tenant lock, or returns empty without running it if the lock is taken.
     * {@code work} must not return null.
     */
    public <T> Optional<T> runIfFree(String tenantId, Supplier<T> work) {
        Optional<String> owner = tryLock(tenantId);
        if (owner.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(work.get());
        } finally {
            release(tenantId, owner.get());
        }
    }

    private static String resolveNodeId() {
        String id = System.getenv("FLY_APP_INSTANCE_ID");
        if (id == null || id.isEmpty()) {
            id = System.getenv("HOSTNAME");
        }
        if (id == null || id.isEmpty()) {
            id = System.getProperty("user.name") + "-" + ProcessHandle.current().pid();
        }
        return id;
    }
}
