package com.kincircle.trust.repository;

import com.kincircle.trust.service.model.RateLimitBudget;
import com.kincircle.trust.service.model.RateLimitWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "trust.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcRateLimitRepository implements RateLimitRepository {

    // a window is current while window_start_ms > now - windowMs
    private static final String COUNT_IN_WINDOW_SQL = """
        UPDATE trust_rate_limit SET request_count = request_count + 1
        WHERE budget_key = ? AND window_start_ms > ? AND request_count < ?
    """;
    private static final String OPEN_NEW_WINDOW_SQL = """
        UPDATE trust_rate_limit SET request_count = 1, window_start_ms = ?
        WHERE budget_key = ? AND window_start_ms <= ?
    """;

    private final JdbcTemplate jdbc;

    @Override
    public boolean tryAcquire(String key, RateLimitBudget budget, Instant now) {
        long nowMs = now.toEpochMilli();
        long floor = nowMs - budget.windowMs();

        if (jdbc.update(COUNT_IN_WINDOW_SQL, key, floor, budget.maxRequests()) == 1) return true;
        if (jdbc.update(OPEN_NEW_WINDOW_SQL, nowMs, key, floor) == 1) return true;
        try {
            jdbc.update("INSERT INTO trust_rate_limit (budget_key, request_count, window_start_ms) VALUES (?, 1, ?)",
                    key, nowMs);
            return true;
        } catch (DataIntegrityViolationException exists) {
            // row is there and its window is full, or another instance just opened it
            return jdbc.update(COUNT_IN_WINDOW_SQL, key, floor, budget.maxRequests()) == 1;
        }
    }

    @Override
    public Optional<RateLimitWindow> find(String key) {
        String sql = "SELECT request_count, window_start_ms FROM trust_rate_limit WHERE budget_key = ?";
        return jdbc.query(sql, (rs, i) -> new RateLimitWindow(
                rs.getInt("request_count"),
                Instant.ofEpochMilli(rs.getLong("window_start_ms"))
        ), key).stream().findFirst();
    }

    @Override
    public void delete(String key) {
        jdbc.update("DELETE FROM trust_rate_limit WHERE budget_key = ?", key);
    }
}
