package com.kincircle.trust.service;

import com.kincircle.trust.config.TrustProperties;
import com.kincircle.trust.repository.LockoutRepository;
import com.kincircle.trust.service.error.LockedOutException;
import com.kincircle.trust.service.model.LockoutState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Failed-attempt throttling with exponential backoff.
 *
 * <p>From the {@code threshold}-th consecutive failure on, each failure sets
 * {@code lockoutUntil = now + min(maxBackoff, 2^(attempts - threshold))} seconds.
 * Only {@link #recordSuccess} clears the counter; letting a window expire does not.
 * Every update is a compare-and-set on the stored attempt count.
 */
@Slf4j
@Service
public class LockoutPolicy {

    private final LockoutRepository repository;
    private final Clock clock;
    private final int threshold;
    private final long maxBackoffSeconds;

    @Autowired
    public LockoutPolicy(LockoutRepository repository, Clock clock, TrustProperties props) {
        this(repository, clock, props.getLockout().getThreshold(), props.getLockout().getMaxBackoffSeconds());
    }

    public LockoutPolicy(LockoutRepository repository, Clock clock, int threshold, long maxBackoffSeconds) {
        if (threshold < 1) throw new IllegalArgumentException("threshold must be >= 1");
        if (maxBackoffSeconds < 1) throw new IllegalArgumentException("maxBackoffSeconds must be >= 1");
        this.repository = repository;
        this.clock = clock;
        this.threshold = threshold;
        this.maxBackoffSeconds = maxBackoffSeconds;
    }

    /** Counts one failed attempt that was not reserved with {@link #acquireAttempt}. */
    public LockoutState recordFailure(String principalId) {
        while (true) {
            LockoutState current = repository.find(principalId);
            LockoutState next = advance(current, clock.instant());
            if (repository.compareAndSet(principalId, current, next)) {
                return logged(principalId, next);
            }
        }
    }

    /**
     * Reserves one attempt before the PIN is checked. The attempt is counted up front, and
     * the backoff window starts as soon as the threshold is reached, so concurrent callers
     * can never check more PINs than the threshold allows. A successful check must then call
     * {@link #recordSuccess}; a failed one needs no further call.
     *
     * @return the state including this attempt
     * @throws LockedOutException while a backoff window is running
     */
    public LockoutState acquireAttempt(String principalId) {
        while (true) {
            LockoutState current = repository.find(principalId);
            Instant now = clock.instant();
            if (current.isLockedOut(now)) {
                throw new LockedOutException(current.remainingSeconds(now));
            }
            LockoutState next = advance(current, now);
            if (repository.compareAndSet(principalId, current, next)) {
                return logged(principalId, next);
            }
        }
    }

    private LockoutState advance(LockoutState current, Instant now) {
        int attempts = current.failedAttempts() + 1;
        if (attempts < threshold) {
            return new LockoutState(attempts, current.lockoutUntil());
        }
        long backoff = backoffSeconds(attempts);
        Instant until = now.plusSeconds(backoff);
        if (current.lockoutUntil() != null && current.lockoutUntil().isAfter(until)) {
            until = current.lockoutUntil();
        }
        return new LockoutState(attempts, until);
    }

    public void recordSuccess(String principalId) {
        repository.clear(principalId);
    }

    public LockoutState state(String principalId) {
        return repository.find(principalId);
    }

    public boolean isLockedOut(String principalId) {
        return isLockedOut(principalId, clock.instant());
    }

    public boolean isLockedOut(String principalId, Instant now) {
        return repository.find(principalId).isLockedOut(now);
    }

    public long remainingSeconds(String principalId) {
        return repository.find(principalId).remainingSeconds(clock.instant());
    }

    private LockoutState logged(String principalId, LockoutState next) {
        if (next.failedAttempts() >= threshold) {
            log.warn("Principal {} locked out until {} after {} failed attempts",
                    principalId, next.lockoutUntil(), next.failedAttempts());
        }
        return next;
    }

    long backoffSeconds(int attempts) {
        int exponent = attempts - threshold;
        if (exponent >= 62) return maxBackoffSeconds;
        return Math.min(maxBackoffSeconds, 1L << exponent);
    }
}
