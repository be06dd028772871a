package com.kincircle.trust.service;

import com.kincircle.trust.config.TrustProperties;
import com.kincircle.trust.repository.CredentialRepository;
import com.kincircle.trust.service.error.AuthenticationFailureException;
import com.kincircle.trust.service.error.ValidationException;
import com.kincircle.trust.service.model.AuditEvent;
import com.kincircle.trust.service.model.AuditEventType;
import com.kincircle.trust.service.model.Credential;
import com.kincircle.trust.service.model.LockoutState;
import com.kincircle.trust.service.model.Severity;
import com.kincircle.trust.service.model.VerificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Owns the credential record of each principal: enrollment, PIN change, verification
 * with eager migration of legacy records, and full reset.
 */
@Slf4j
@Service
public class CredentialStore {

    private final CredentialRepository repository;
    private final CredentialHasher hasher;
    private final LockoutPolicy lockoutPolicy;
    private final AuditTrail auditTrail;
    private final ApplicationEventPublisher events;
    private final Clock clock;
    private final Executor kdfExecutor;
    private final int pinLength;

    @Autowired
    public CredentialStore(CredentialRepository repository, CredentialHasher hasher, LockoutPolicy lockoutPolicy,
                           AuditTrail auditTrail, ApplicationEventPublisher events, Clock clock,
                           @Qualifier("kdfExecutor") Executor kdfExecutor, TrustProperties props) {
        this(repository, hasher, lockoutPolicy, auditTrail, events, clock, kdfExecutor,
                props.getCredential().getPinLength());
    }

    public CredentialStore(CredentialRepository repository, CredentialHasher hasher, LockoutPolicy lockoutPolicy,
                           AuditTrail auditTrail, ApplicationEventPublisher events, Clock clock,
                           Executor kdfExecutor, int pinLength) {
        this.repository = repository;
        this.hasher = hasher;
        this.lockoutPolicy = lockoutPolicy;
        this.auditTrail = auditTrail;
        this.events = events;
        this.clock = clock;
        this.kdfExecutor = kdfExecutor;
        this.pinLength = pinLength;
    }

    /** @throws ValidationException unless the PIN is exactly {@code pinLength} ASCII digits */
    public void validatePin(String pin) {
        if (pin == null || pin.length() != pinLength) {
            throw new ValidationException("PIN must be exactly " + pinLength + " digits");
        }
        for (int i = 0; i < pin.length(); i++) {
            char c = pin.charAt(i);
            if (c < '0' || c > '9') {
                throw new ValidationException("PIN must contain only digits");
            }
        }
    }

    public boolean isEnrolled(String principalId) {
        return repository.find(principalId).isPresent();
    }

    public Optional<Credential> find(String principalId) {
        return repository.find(principalId);
    }

    /** First PIN for a principal. Replacing an existing PIN goes through {@link #change}. */
    public void enroll(String principalId, String pin) {
        validatePin(pin);
        if (repository.find(principalId).isPresent()) {
            throw new ValidationException("A PIN is already set; change it with the current PIN");
        }
        repository.save(principalId, hasher.hash(pin));
        lockoutPolicy.recordSuccess(principalId);
        log.info("PIN enrolled for principal {}", principalId);
        audit(AuditEventType.SETTINGS_CHANGE, Severity.INFO, "PIN enrolled", principalId);
        events.publishEvent(new CredentialChangedEvent(principalId, true));
    }

    /**
     * Replaces the PIN after checking the current one. A wrong current PIN counts as a
     * failed attempt, the same as on the lock screen.
     */
    public void change(String principalId, String currentPin, String newPin) {
        validatePin(currentPin);
        validatePin(newPin);
        LockoutState attempt = lockoutPolicy.acquireAttempt(principalId);
        if (!verify(principalId, currentPin).matched()) {
            audit(AuditEventType.AUTH_FAILURE, Severity.WARNING, "Invalid current PIN on PIN change", principalId);
            throw new AuthenticationFailureException(attempt.failedAttempts());
        }
        repository.save(principalId, hasher.hash(newPin));
        lockoutPolicy.recordSuccess(principalId);
        log.info("PIN changed for principal {}", principalId);
        audit(AuditEventType.SETTINGS_CHANGE, Severity.INFO, "PIN changed", principalId);
        events.publishEvent(new CredentialChangedEvent(principalId, true));
    }

    /**
     * Checks a PIN against the stored record. A successful match on a legacy record
     * re-hashes it into the salted format right away. Lockout is not consulted here;
     * callers that face the user go through {@link SessionGuard}.
     */
    public VerificationResult verify(String principalId, String pin) {
        Optional<Credential> stored = repository.find(principalId);
        if (stored.isEmpty() || !hasher.verify(pin, stored.get())) {
            return VerificationResult.MISMATCH;
        }
        if (stored.get().isSecure()) {
            return new VerificationResult(true, false);
        }
        repository.save(principalId, hasher.hash(pin));
        log.info("Migrated {} credential of principal {} to salted PBKDF2",
                stored.get().algorithmVersion(), principalId);
        events.publishEvent(new CredentialChangedEvent(principalId, true));
        return new VerificationResult(true, true);
    }

    /** {@link #verify} on the KDF executor. */
    public CompletableFuture<VerificationResult> verifyAsync(String principalId, String pin) {
        return CompletableFuture.supplyAsync(() -> verify(principalId, pin), kdfExecutor);
    }

    /**
     * Adopts a credential serialized by an older client ("salt$hash" or a bare legacy hash).
     * Legacy values are migrated on the next successful verification.
     */
    public void importSerialized(String principalId, String serialized) {
        Credential credential = Credential.parse(serialized)
                .orElseThrow(() -> new ValidationException("Malformed stored credential"));
        repository.save(principalId, credential);
        log.info("Imported {} credential for principal {}", credential.algorithmVersion(), principalId);
        events.publishEvent(new CredentialChangedEvent(principalId, true));
    }

    /** Full data reset: drops the credential and any lockout state. */
    public void reset(String principalId) {
        boolean existed = repository.delete(principalId);
        lockoutPolicy.recordSuccess(principalId);
        log.warn("Credential reset for principal {} (existed={})", principalId, existed);
        audit(AuditEventType.DATA_RESET, Severity.CRITICAL, "Credential and lockout state cleared", principalId);
        events.publishEvent(new CredentialChangedEvent(principalId, false));
    }

    private void audit(AuditEventType type, Severity severity, String detail, String principalId) {
        auditTrail.record(AuditEvent.of(clock.instant(), type, severity, detail, principalId));
    }
}
