package com.kincircle.trust.service;

import com.kincircle.trust.config.TrustProperties;
import com.kincircle.trust.repository.RateLimitRepository;
import com.kincircle.trust.service.error.RateLimitedException;
import com.kincircle.trust.service.model.RateLimitBudget;
import com.kincircle.trust.service.model.RateLimitWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Named fixed-window budgets for externally billed calls.
 *
 * <p>Windows are fixed, not sliding: up to {@code 2 * maxRequests} calls can land within
 * {@code windowMs} around a window boundary. That is accepted for quota protection.
 */
@Slf4j
@Service
public class RateLimiterRegistry {

    private final RateLimitRepository repository;
    private final Clock clock;
    private final Map<String, RateLimitBudget> budgets = new ConcurrentHashMap<>();

    @Autowired
    public RateLimiterRegistry(RateLimitRepository repository, Clock clock, TrustProperties props) {
        this(repository, clock);
        props.getRateLimit().getBudgets().forEach((key, b) -> register(key, b.toBudget()));
    }

    public RateLimiterRegistry(RateLimitRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public void register(String key, RateLimitBudget budget) {
        budgets.put(key, budget);
        log.debug("Rate-limit budget {} = {}/{}ms", key, budget.maxRequests(), budget.windowMs());
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(budgets.keySet());
    }

    public Optional<RateLimitBudget> budget(String key) {
        return Optional.ofNullable(budgets.get(key));
    }

    /** Counts the call and returns {@code true} if the current window had room. */
    public boolean isAllowed(String key) {
        return repository.tryAcquire(key, require(key), clock.instant());
    }

    public int getRemainingRequests(String key) {
        RateLimitBudget budget = require(key);
        Instant now = clock.instant();
        return repository.find(key)
                .filter(w -> !w.isExpired(now, budget.windowMs()))
                .map(w -> Math.max(0, budget.maxRequests() - w.count()))
                .orElse(budget.maxRequests());
    }

    /** Milliseconds until the current window ends; 0 when no window is open. */
    public long getResetTime(String key) {
        RateLimitBudget budget = require(key);
        Optional<RateLimitWindow> window = repository.find(key);
        if (window.isEmpty()) return 0;
        long elapsed = clock.millis() - window.get().windowStart().toEpochMilli();
        return elapsed >= budget.windowMs() ? 0 : budget.windowMs() - elapsed;
    }

    public void reset(String key) {
        require(key);
        repository.delete(key);
    }

    /** @throws RateLimitedException when the budget is spent */
    public void acquire(String key) {
        if (!isAllowed(key)) {
            long resetIn = getResetTime(key);
            log.warn("Rate limit exceeded for {}; resets in {}ms", key, resetIn);
            throw new RateLimitedException(key, resetIn);
        }
    }

    /** Runs {@code call} if the budget allows it, otherwise hands the rejection to {@code fallback}. */
    public <T> T callWithFallback(String key, Supplier<T> call, Function<RateLimitedException, T> fallback) {
        try {
            acquire(key);
        } catch (RateLimitedException limited) {
            return fallback.apply(limited);
        }
        return call.get();
    }

    private RateLimitBudget require(String key) {
        RateLimitBudget budget = budgets.get(key);
        if (budget == null) {
            throw new IllegalArgumentException("Unknown rate-limit budget: " + key);
        }
        return budget;
    }
}
