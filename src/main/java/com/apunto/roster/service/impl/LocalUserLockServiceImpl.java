package com.apunto.roster.service.impl;

import com.apunto.roster.service.UserLockService;
import com.apunto.roster.shared.exception.SyncInProgressException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-replica lock. Locks are held weakly so idle users do not accumulate entries.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "profile-sync.lock.mode", havingValue = "local", matchIfMissing = true)
public class LocalUserLockServiceImpl implements UserLockService {

    private final Cache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build();

    @Override
    public <T> T withUserLock(UUID userId, Duration maxWait, Supplier<T> action) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(action, "action");

        final String key = UserLockService.lockKey(userId);
        final long waitMs = maxWait == null ? 0L : Math.max(0L, maxWait.toMillis());
        final ReentrantLock lock = locks.get(key, k -> new ReentrantLock());

        final boolean acquired;
        try {
            acquired = lock.tryLock(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new SyncInProgressException(key, "lock_interrupted");
        }

        if (!acquired) {
            log.warn("event=lock.timeout key={} waitMs={}", key, waitMs);
            throw new SyncInProgressException(key, "lock_timeout");
        }

        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
