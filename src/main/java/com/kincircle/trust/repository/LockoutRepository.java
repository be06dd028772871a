package com.kincircle.trust.repository;

import com.kincircle.trust.service.model.LockoutState;

/**
 * Failed-attempt state. Every change goes through {@link #compareAndSet}, so
 * implementations shared between processes never lose a concurrent attempt.
 */
public interface LockoutRepository {

    LockoutState find(String principalId);

    /**
     * Stores {@code next} only if the current state still has the attempt count of
     * {@code expected}. {@link LockoutState#EMPTY} as {@code expected} means "no record yet".
     *
     * @return {@code false} when another writer got there first; the caller re-reads and retries
     */
    boolean compareAndSet(String principalId, LockoutState expected, LockoutState next);

    void clear(String principalId);
}
