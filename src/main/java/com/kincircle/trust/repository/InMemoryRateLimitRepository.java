package com.kincircle.trust.repository;

import com.kincircle.trust.service.model.RateLimitBudget;
import com.kincircle.trust.service.model.RateLimitWindow;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(prefix = "trust.store", name = "type", havingValue = "memory")
public class InMemoryRateLimitRepository implements RateLimitRepository {

    private final Map<String, RateLimitWindow> windows = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(String key, RateLimitBudget budget, Instant now) {
        boolean[] counted = {false};
        windows.compute(key, (k, w) -> {
            if (w == null || w.isExpired(now, budget.windowMs())) {
                counted[0] = true;
                return new RateLimitWindow(1, now);
            }
            if (w.count() < budget.maxRequests()) {
                counted[0] = true;
                return new RateLimitWindow(w.count() + 1, w.windowStart());
            }
            return w;
        });
        return counted[0];
    }

    @Override
    public Optional<RateLimitWindow> find(String key) {
        return Optional.ofNullable(windows.get(key));
    }

    @Override
    public void delete(String key) {
        windows.remove(key);
    }
}
