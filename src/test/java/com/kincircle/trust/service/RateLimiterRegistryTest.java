package com.kincircle.trust.service;

import com.kincircle.trust.repository.InMemoryRateLimitRepository;
import com.kincircle.trust.service.error.RateLimitedException;
import com.kincircle.trust.service.model.RateLimitBudget;
import com.kincircle.trust.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterRegistryTest {

    private static final String KEY = "receipt-scan";

    private MutableClock clock;
    private RateLimiterRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        registry = new RateLimiterRegistry(new InMemoryRateLimitRepository(), clock);
        registry.register(KEY, new RateLimitBudget(5, 60_000));
    }

    @Test
    void sixthCallInWindowIsDenied() {
        for (int i = 0; i < 5; i++) {
            assertThat(registry.isAllowed(KEY)).as("call %d", i + 1).isTrue();
        }
        assertThat(registry.isAllowed(KEY)).isFalse();
        assertThat(registry.getRemainingRequests(KEY)).isZero();
    }

    @Test
    void windowRollsOver() {
        for (int i = 0; i < 5; i++) registry.isAllowed(KEY);
        clock.advanceMillis(59_999);
        assertThat(registry.isAllowed(KEY)).isFalse();

        clock.advanceMillis(1);

        assertThat(registry.isAllowed(KEY)).isTrue();
        assertThat(registry.getRemainingRequests(KEY)).isEqualTo(4);
    }

    @Test
    void resetTimeCountsDownAndIsZeroWithoutWindow() {
        assertThat(registry.getResetTime(KEY)).isZero();
        assertThat(registry.getRemainingRequests(KEY)).isEqualTo(5);

        registry.isAllowed(KEY);
        clock.advanceMillis(15_000);

        assertThat(registry.getResetTime(KEY)).isEqualTo(45_000);
        assertThat(registry.getRemainingRequests(KEY)).isEqualTo(4);

        clock.advanceMillis(45_000);
        assertThat(registry.getResetTime(KEY)).isZero();
        assertThat(registry.getRemainingRequests(KEY)).isEqualTo(5);
    }

    @Test
    void acquireThrowsWithResetTime() {
        for (int i = 0; i < 5; i++) registry.acquire(KEY);
        clock.advanceMillis(20_000);

        assertThatThrownBy(() -> registry.acquire(KEY))
                .isInstanceOf(RateLimitedException.class)
                .hasMessage("Rate limit exceeded. Try again in 40 seconds.")
                .satisfies(e -> {
                    RateLimitedException r = (RateLimitedException) e;
                    assertThat(r.getBudgetKey()).isEqualTo(KEY);
                    assertThat(r.getResetInMs()).isEqualTo(40_000);
                });
    }

    @Test
    void callWithFallbackUsesFallbackWhenSpent() {
        registry.register("tiny", new RateLimitBudget(1, 1_000));

        assertThat(registry.callWithFallback("tiny", () -> "remote", e -> "cached")).isEqualTo("remote");
        assertThat(registry.callWithFallback("tiny", () -> "remote", e -> "cached:" + e.getBudgetKey()))
                .isEqualTo("cached:tiny");
    }

    @Test
    void budgetsAreIndependent() {
        registry.register("chat-api", new RateLimitBudget(1, 60_000));
        registry.isAllowed("chat-api");

        assertThat(registry.isAllowed("chat-api")).isFalse();
        assertThat(registry.isAllowed(KEY)).isTrue();
    }

    @Test
    void resetReopensBudget() {
        for (int i = 0; i < 5; i++) registry.isAllowed(KEY);

        registry.reset(KEY);

        assertThat(registry.isAllowed(KEY)).isTrue();
    }

    @Test
    void unknownKeyIsRejected() {
        assertThatThrownBy(() -> registry.isAllowed("nope")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.getResetTime("nope")).isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.budget("nope")).isEmpty();
        assertThat(registry.keys()).containsExactly(KEY);
    }

    @Test
    void budgetMustBePositive() {
        assertThatThrownBy(() -> new RateLimitBudget(0, 1000)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RateLimitBudget(1, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
