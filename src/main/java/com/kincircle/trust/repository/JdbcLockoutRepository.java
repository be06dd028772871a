package com.kincircle.trust.repository;

import com.kincircle.trust.service.model.LockoutState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * Lockout counters in the shared database. Each change is a single conditional
 * statement keyed on the attempt count, so concurrent processes see one consistent count.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "trust.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcLockoutRepository implements LockoutRepository {

    private final JdbcTemplate jdbc;

    @Override
    public LockoutState find(String principalId) {
        String sql = "SELECT failed_attempts, lockout_until_ms FROM trust_lockout WHERE principal_id = ?";
        return jdbc.query(sql, rm(), principalId).stream().findFirst().orElse(LockoutState.EMPTY);
    }

    @Override
    public boolean compareAndSet(String principalId, LockoutState expected, LockoutState next) {
        Long until = next.lockoutUntil() == null ? null : next.lockoutUntil().toEpochMilli();
        try {
            if (expected.failedAttempts() == 0) {
                jdbc.update("INSERT INTO trust_lockout (principal_id, failed_attempts, lockout_until_ms) VALUES (?, ?, ?)",
                        principalId, next.failedAttempts(), until);
                return true;
            }
            return jdbc.update("""
                UPDATE trust_lockout SET failed_attempts = ?, lockout_until_ms = ?
                WHERE principal_id = ? AND failed_attempts = ?
            """, next.failedAttempts(), until, principalId, expected.failedAttempts()) == 1;
        } catch (DataIntegrityViolationException | ConcurrencyFailureException raced) {
            // another instance wrote the row first
            log.debug("Lost lockout update race for {}: {}", principalId, raced.getMessage());
            return false;
        }
    }

    @Override
    public void clear(String principalId) {
        jdbc.update("DELETE FROM trust_lockout WHERE principal_id = ?", principalId);
    }

    private RowMapper<LockoutState> rm() {
        return (rs, i) -> {
            long until = rs.getLong("lockout_until_ms");
            return new LockoutState(
                    rs.getInt("failed_attempts"),
                    rs.wasNull() ? null : Instant.ofEpochMilli(until)
            );
        };
    }
}
