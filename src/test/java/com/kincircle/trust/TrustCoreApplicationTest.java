package com.kincircle.trust;

import com.kincircle.trust.repository.JdbcCredentialRepository;
import com.kincircle.trust.repository.LockoutRepository;
import com.kincircle.trust.service.CredentialStore;
import com.kincircle.trust.service.RateLimiterRegistry;
import com.kincircle.trust.service.SessionGuard;
import com.kincircle.trust.service.model.SessionState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:trust-ctx;DB_CLOSE_DELAY=-1",
        "trust.session.onboarding-complete=true",
        "trust.audit.base-url=",
        "trust.assistant.base-url="
})
class TrustCoreApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private CredentialStore credentialStore;

    @Autowired
    private SessionGuard sessionGuard;

    @Autowired
    private RateLimiterRegistry rateLimiters;

    @Autowired
    private LockoutRepository lockoutRepository;

    @Test
    void wiresJdbcStoreAndConfiguredBudgets() {
        assertThat(context.getBeansOfType(JdbcCredentialRepository.class)).hasSize(1);
        assertThat(lockoutRepository.getClass().getSimpleName()).startsWith("JdbcLockoutRepository");
        assertThat(rateLimiters.keys()).contains("gemini-api", "chat-api", "receipt-scan");
        assertThat(rateLimiters.budget("receipt-scan").orElseThrow().maxRequests()).isEqualTo(5);
    }

    @Test
    void enrollmentArmsTheIdleTimer() {
        assertThat(sessionGuard.getState()).isEqualTo(SessionState.ACTIVE);

        credentialStore.enroll(sessionGuard.getPrincipalId(), "2468");
        assertThat(sessionGuard.isTimerArmed()).isTrue();

        credentialStore.reset(sessionGuard.getPrincipalId());
        assertThat(sessionGuard.isTimerArmed()).isFalse();
    }
}
