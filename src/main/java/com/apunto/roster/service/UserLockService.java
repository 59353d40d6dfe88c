package com.apunto.roster.service;

import java.time.Duration;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Serializes profile syncs per user.
 *
 * Implementations must guarantee that two actions for the same user never overlap,
 * and throw {@link com.apunto.roster.shared.exception.SyncInProgressException} when the
 * lock cannot be taken within {@code maxWait}.
 */
public interface UserLockService {

    String KEY_PREFIX = "profile-sync:";

    <T> T withUserLock(UUID userId, Duration maxWait, Supplier<T> action);

    static String lockKey(UUID userId) {
        return KEY_PREFIX + userId;
    }
}
