package com.kincircle.trust.service;

import com.kincircle.trust.repository.InMemoryCredentialRepository;
import com.kincircle.trust.repository.InMemoryLockoutRepository;
import com.kincircle.trust.service.error.AuthenticationFailureException;
import com.kincircle.trust.service.error.LockedOutException;
import com.kincircle.trust.service.error.ValidationException;
import com.kincircle.trust.service.model.AlgorithmVersion;
import com.kincircle.trust.service.model.AuditEventType;
import com.kincircle.trust.service.model.Credential;
import com.kincircle.trust.service.model.LockoutState;
import com.kincircle.trust.service.model.VerificationResult;
import com.kincircle.trust.support.ConcurrentCalls;
import com.kincircle.trust.support.MutableClock;
import com.kincircle.trust.support.RecordingAuditTrail;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialStoreTest {

    private static final String ID = "local";

    private final List<Object> published = new ArrayList<>();
    private InMemoryCredentialRepository repository;
    private LockoutPolicy lockout;
    private RecordingAuditTrail audit;
    private CredentialStore store;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        repository = new InMemoryCredentialRepository();
        lockout = new LockoutPolicy(new InMemoryLockoutRepository(), clock, 3, 300);
        audit = new RecordingAuditTrail();
        store = new CredentialStore(repository, new CredentialHasher(), lockout, audit,
                published::add, clock, Runnable::run, 4);
    }

    @Test
    void validatePinRejectsWrongLengthAndNonDigits() {
        assertThatThrownBy(() -> store.validatePin("123")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.validatePin("12345")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.validatePin("12a4")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.validatePin("١٢٣٤")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.validatePin(null)).isInstanceOf(ValidationException.class);
        store.validatePin("0000");
    }

    @Test
    void enrollStoresSaltedCredentialAndPublishes() {
        store.enroll(ID, "1234");

        Credential c = repository.find(ID).orElseThrow();
        assertThat(c.algorithmVersion()).isEqualTo(AlgorithmVersion.SALTED_PBKDF2);
        assertThat(store.isEnrolled(ID)).isTrue();
        assertThat(store.verify(ID, "1234").matched()).isTrue();
        assertThat(published).containsExactly(new CredentialChangedEvent(ID, true));
        assertThat(audit.count(AuditEventType.SETTINGS_CHANGE)).isEqualTo(1);
    }

    @Test
    void enrollTwiceIsRejected() {
        store.enroll(ID, "1234");

        assertThatThrownBy(() -> store.enroll(ID, "5678")).isInstanceOf(ValidationException.class);
        assertThat(store.verify(ID, "1234").matched()).isTrue();
    }

    @Test
    void changeRequiresCurrentPin() {
        store.enroll(ID, "1234");

        assertThatThrownBy(() -> store.change(ID, "9999", "5678"))
                .isInstanceOf(AuthenticationFailureException.class);
        assertThat(lockout.state(ID).failedAttempts()).isEqualTo(1);
        assertThat(audit.count(AuditEventType.AUTH_FAILURE)).isEqualTo(1);

        store.change(ID, "1234", "5678");

        assertThat(store.verify(ID, "5678").matched()).isTrue();
        assertThat(store.verify(ID, "1234").matched()).isFalse();
        assertThat(lockout.state(ID).failedAttempts()).isZero();
    }

    @Test
    void changeIsBlockedWhileLockedOut() {
        store.enroll(ID, "1234");
        for (int i = 0; i < 3; i++) lockout.recordFailure(ID);

        assertThatThrownBy(() -> store.change(ID, "1234", "5678")).isInstanceOf(LockedOutException.class);
        assertThat(store.verify(ID, "1234").matched()).isTrue();
    }

    @Test
    void parallelChangesWithWrongPinAreCappedAtThreshold() throws Exception {
        store.enroll(ID, "1234");

        List<Throwable> thrown = ConcurrentCalls.run(40, 16,
                i -> store.change(ID, String.format("%04d", 5000 + i), "5678"));

        assertThat(ConcurrentCalls.countOf(thrown, AuthenticationFailureException.class)).isEqualTo(3);
        assertThat(ConcurrentCalls.countOf(thrown, LockedOutException.class)).isEqualTo(37);
        assertThat(lockout.state(ID).failedAttempts()).isEqualTo(3);
        assertThat(store.verify(ID, "1234").matched()).isTrue();
    }

    @Test
    void correctPinAfterTwoFailuresStillSucceeds() {
        store.enroll(ID, "1234");
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> store.change(ID, "0000", "5678"))
                    .isInstanceOf(AuthenticationFailureException.class);
        }

        store.change(ID, "1234", "5678");

        assertThat(store.verify(ID, "5678").matched()).isTrue();
        assertThat(lockout.state(ID)).isEqualTo(LockoutState.EMPTY);
    }

    @Test
    void verifyWithoutCredentialIsMismatch() {
        assertThat(store.verify(ID, "1234")).isEqualTo(VerificationResult.MISMATCH);
    }

    @Test
    @SuppressWarnings("deprecation")
    void legacyStringHashIsMigratedOnSuccess() {
        store.importSerialized(ID, CredentialHasher.legacyHash("1234"));
        assertThat(repository.find(ID).orElseThrow().algorithmVersion())
                .isEqualTo(AlgorithmVersion.LEGACY_STRING_HASH);

        VerificationResult first = store.verify(ID, "1234");

        assertThat(first).isEqualTo(new VerificationResult(true, true));
        Credential migrated = repository.find(ID).orElseThrow();
        assertThat(migrated.algorithmVersion()).isEqualTo(AlgorithmVersion.SALTED_PBKDF2);
        assertThat(store.verify(ID, "1234")).isEqualTo(new VerificationResult(true, false));
    }

    @Test
    void legacyStaticSaltIsMigratedOnSuccessOnly() {
        store.importSerialized(ID, "a3f6335df71492c01c4ea9d12ea9d0fcc00003430e9119b188290e4f6ce950e5");

        assertThat(store.verify(ID, "0000").matched()).isFalse();
        assertThat(repository.find(ID).orElseThrow().algorithmVersion())
                .isEqualTo(AlgorithmVersion.LEGACY_STATIC_SALT);

        assertThat(store.verify(ID, "1234").migrated()).isTrue();
        assertThat(repository.find(ID).orElseThrow().isSecure()).isTrue();
    }

    @Test
    void importRejectsMalformedValue() {
        assertThatThrownBy(() -> store.importSerialized(ID, "abc$")).isInstanceOf(ValidationException.class);
        assertThat(store.isEnrolled(ID)).isFalse();
    }

    @Test
    void resetDropsCredentialAndLockout() {
        store.enroll(ID, "1234");
        lockout.recordFailure(ID);
        published.clear();

        store.reset(ID);

        assertThat(store.isEnrolled(ID)).isFalse();
        assertThat(lockout.state(ID).failedAttempts()).isZero();
        assertThat(published).containsExactly(new CredentialChangedEvent(ID, false));
        assertThat(audit.count(AuditEventType.DATA_RESET)).isEqualTo(1);
    }

    @Test
    void verifyAsyncCompletes() throws Exception {
        store.enroll(ID, "1234");

        assertThat(store.verifyAsync(ID, "1234").get(30, TimeUnit.SECONDS).matched()).isTrue();
        assertThat(store.verifyAsync(ID, "4321").get(30, TimeUnit.SECONDS).matched()).isFalse();
    }
}
