package com.kincircle.trust.repository;

import com.kincircle.trust.service.model.RateLimitBudget;
import com.kincircle.trust.service.model.RateLimitWindow;

import java.time.Instant;
import java.util.Optional;

/** Fixed-window counters keyed by budget name. */
public interface RateLimitRepository {

    /**
     * Counts one request against {@code key} if the current window has room,
     * opening a new window when the previous one has elapsed.
     *
     * @return {@code true} if the request was counted
     */
    boolean tryAcquire(String key, RateLimitBudget budget, Instant now);

    Optional<RateLimitWindow> find(String key);

    void delete(String key);
}
