package com.kincircle.trust.repository;

import com.kincircle.trust.service.model.LockoutState;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local lockout state. Only safe when a single process serves the principal.
 */
@Repository
@ConditionalOnProperty(prefix = "trust.store", name = "type", havingValue = "memory")
public class InMemoryLockoutRepository implements LockoutRepository {

    private final ConcurrentMap<String, LockoutState> states = new ConcurrentHashMap<>();

    @Override
    public LockoutState find(String principalId) {
        return states.getOrDefault(principalId, LockoutState.EMPTY);
    }

    @Override
    public boolean compareAndSet(String principalId, LockoutState expected, LockoutState next) {
        if (expected.failedAttempts() == 0) {
            return states.putIfAbsent(principalId, next) == null;
        }
        boolean[] swapped = {false};
        states.computeIfPresent(principalId, (id, current) -> {
            if (current.failedAttempts() != expected.failedAttempts()) return current;
            swapped[0] = true;
            return next;
        });
        return swapped[0];
    }

    @Override
    public void clear(String principalId) {
        states.remove(principalId);
    }
}
