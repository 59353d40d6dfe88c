package com.apunto.roster.service.impl;

import com.apunto.roster.service.UserLockService;
import com.apunto.roster.shared.exception.PersistenceFailedException;
import com.apunto.roster.shared.exception.SyncInProgressException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Cross-replica lock backed by session-level advisory locks. The connection that takes the
 * lock is held for the whole action and used only for lock/unlock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "profile-sync.lock.mode", havingValue = "postgres")
public class PostgresAdvisoryLockServiceImpl implements UserLockService {

    private static final long DEFAULT_RETRY_DELAY_MS = 50L;

    private final DataSource dataSource;

    @Override
    public <T> T withUserLock(UUID userId, Duration maxWait, Supplier<T> action) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(action, "action");

        final String key = UserLockService.lockKey(userId);
        final long waitMs = maxWait == null ? 0L : Math.max(0L, maxWait.toMillis());
        final long deadline = System.currentTimeMillis() + waitMs;

        while (true) {
            try (Connection con = dataSource.getConnection()) {
                if (tryLock(con, key)) {
                    try {
                        return action.get();
                    } finally {
                        unlockQuietly(con, key);
                    }
                }
            } catch (SQLException e) {
                throw new PersistenceFailedException("DB lock error: " + e.getMessage(), e, Map.of("lockKey", key));
            }

            if (System.currentTimeMillis() >= deadline) {
                log.warn("event=lock.timeout key={} waitMs={}", key, waitMs);
                throw new SyncInProgressException(key, "lock_timeout");
            }

            sleep(key, DEFAULT_RETRY_DELAY_MS);
        }
    }

    private boolean tryLock(Connection con, String key) throws SQLException {
        try (PreparedStatement ps = con.prepareStatement("SELECT pg_try_advisory_lock(hashtext(?))")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    private void unlockQuietly(Connection con, String key) {
        try (PreparedStatement ps = con.prepareStatement("SELECT pg_advisory_unlock(hashtext(?))")) {
            ps.setString(1, key);
            ps.execute();
        } catch (SQLException e) {
            log.warn("event=lock.unlock.failed key={} err={}", key, e.toString());
        }
    }

    private void sleep(String key, long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new SyncInProgressException(key, "lock_interrupted");
        }
    }
}
