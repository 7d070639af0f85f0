package com.reviewroster.scheduler.reviewer.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Cross-instance mutex for periodic jobs.
 * <p>
 * Uses session-level advisory locks on PostgreSQL. Acquire and release run on the same pooled connection, which
 * stays borrowed while the task runs. Other databases (H2 in dev) have no equivalent, and the task always runs there.
 */
@Repository
public class AdvisoryLockRepository {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryLockRepository.class);

    private final JdbcTemplate jdbcTemplate;

    private volatile Boolean postgres;

    public AdvisoryLockRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Runs {@code task} while holding the lock named {@code key}. Exceptions from the task propagate after the
     * lock is released.
     *
     * @return false if another session holds the lock and the task was skipped
     */
    public boolean runExclusively(String key, Runnable task) {
        if (!lockingSupported()) {
            task.run();
            return true;
        }

        Boolean ran = jdbcTemplate.execute((ConnectionCallback<Boolean>) con -> {
            if (!tryAcquire(con, key)) {
                return false;
            }
            try {
                task.run();
            } finally {
                if (!release(con, key)) {
                    log.warn("advisory_unlock_not_held key={}", key);
                }
            }
            return true;
        });
        return Boolean.TRUE.equals(ran);
    }

    protected boolean lockingSupported() {
        var cached = postgres;
        if (cached == null) {
            var product = jdbcTemplate.execute((ConnectionCallback<String>) con -> con.getMetaData().getDatabaseProductName());
            cached = product != null && product.toLowerCase().contains("postgres");
            postgres = cached;
        }
        return cached;
    }

    protected boolean tryAcquire(Connection con, String key) throws SQLException {
        return queryBoolean(con, "select pg_try_advisory_lock(hashtext(?)::bigint)", key);
    }

    protected boolean release(Connection con, String key) throws SQLException {
        return queryBoolean(con, "select pg_advisory_unlock(hashtext(?)::bigint)", key);
    }

    private static boolean queryBoolean(Connection con, String sql, String key) throws SQLException {
        try (var ps = con.prepareStatement(sql)) {
            ps.setString(1, key);
            try (var rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }
}
