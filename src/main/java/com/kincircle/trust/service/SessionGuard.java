package com.kincircle.trust.service;

import com.kincircle.trust.config.TrustProperties;
import com.kincircle.trust.service.error.AuthenticationFailureException;
import com.kincircle.trust.service.model.ActivitySignal;
import com.kincircle.trust.service.model.AuditEvent;
import com.kincircle.trust.service.model.AuditEventType;
import com.kincircle.trust.service.model.LockoutState;
import com.kincircle.trust.service.model.SessionSettings;
import com.kincircle.trust.service.model.SessionState;
import com.kincircle.trust.service.model.Severity;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * Idle-lock state machine for the single device session.
 *
 * <pre>
 *   ACTIVE --(idle for idleTimeoutMs)--> LOCKED      emits SESSION_TIMEOUT
 *   ACTIVE --(activity)--> ACTIVE                    re-arms the timer
 *   LOCKED --(PIN verified, not locked out)--> ACTIVE emits AUTH_SUCCESS
 * </pre>
 *
 * No timer is armed unless auto-lock is enabled, onboarding is complete and a PIN is
 * enrolled. At most one timer handle exists at any time: every path that arms first
 * cancels the previous handle, and a timer that fires after being superseded is ignored.
 */
@Slf4j
@Service
public class SessionGuard {

    private final TaskScheduler scheduler;
    private final CredentialStore credentialStore;
    private final LockoutPolicy lockoutPolicy;
    private final AuditTrail auditTrail;
    private final Clock clock;
    private final Executor kdfExecutor;
    private final String principalId;

    private SessionState state = SessionState.ACTIVE;
    private SessionSettings settings;
    private boolean credentialEnrolled;
    private ScheduledFuture<?> idleTimer;
    private long timerGeneration;
    private boolean disposed;

    @Autowired
    public SessionGuard(@Qualifier("sessionTimerScheduler") TaskScheduler scheduler, CredentialStore credentialStore,
                        LockoutPolicy lockoutPolicy, AuditTrail auditTrail, Clock clock,
                        @Qualifier("kdfExecutor") Executor kdfExecutor, TrustProperties props) {
        this(scheduler, credentialStore, lockoutPolicy, auditTrail, clock, kdfExecutor,
                props.getSession().getPrincipalId(), props.getSession().toSettings());
    }

    public SessionGuard(TaskScheduler scheduler, CredentialStore credentialStore, LockoutPolicy lockoutPolicy,
                        AuditTrail auditTrail, Clock clock, Executor kdfExecutor,
                        String principalId, SessionSettings settings) {
        this.scheduler = scheduler;
        this.credentialStore = credentialStore;
        this.lockoutPolicy = lockoutPolicy;
        this.auditTrail = auditTrail;
        this.clock = clock;
        this.kdfExecutor = kdfExecutor;
        this.principalId = principalId;
        this.settings = settings;
    }

    @PostConstruct
    public void start() {
        boolean armed;
        synchronized (this) {
            credentialEnrolled = credentialStore.isEnrolled(principalId);
            rearm();
            armed = idleTimer != null;
        }
        log.info("Session guard started for {} (timerArmed={})", principalId, armed);
        audit(AuditEventType.SYSTEM_INIT, Severity.INFO, "Session guard started");
    }

    public String getPrincipalId() {
        return principalId;
    }

    public synchronized SessionState getState() {
        return state;
    }

    public synchronized SessionSettings getSettings() {
        return settings;
    }

    public synchronized boolean isTimerArmed() {
        return idleTimer != null;
    }

    /** Activity postpones the lock while ACTIVE. It never unlocks a LOCKED session. */
    public synchronized SessionState onActivity(ActivitySignal signal) {
        if (state == SessionState.ACTIVE) {
            rearm();
        }
        return state;
    }

    /** Applies new settings. Any pending timer is cancelled before one is (maybe) armed again. */
    public SessionState reconfigure(SessionSettings newSettings) {
        SessionSettings previous;
        SessionState current;
        synchronized (this) {
            previous = settings;
            settings = newSettings;
            rearm();
            current = state;
        }
        if (previous.autoLockEnabled() != newSettings.autoLockEnabled()) {
            audit(AuditEventType.SETTINGS_CHANGE, Severity.INFO,
                    "Auto-lock " + (newSettings.autoLockEnabled() ? "enabled" : "disabled"));
        }
        return current;
    }

    /** Locks immediately, e.g. from a "lock now" control. */
    public synchronized SessionState lock() {
        cancelTimer();
        if (state != SessionState.LOCKED) {
            state = SessionState.LOCKED;
            log.info("Session locked manually for {}", principalId);
        }
        return state;
    }

    /**
     * Verifies the PIN and, on success, moves the session to ACTIVE.
     *
     * @throws com.kincircle.trust.service.error.ValidationException for a malformed PIN
     * @throws com.kincircle.trust.service.error.LockedOutException  while a backoff window runs
     * @throws AuthenticationFailureException                        for a wrong PIN
     */
    public SessionState unlock(String pin) {
        credentialStore.validatePin(pin);
        LockoutState attempt = lockoutPolicy.acquireAttempt(principalId);

        // derivation runs outside the monitor so activity and timer callbacks are not blocked
        if (!credentialStore.verify(principalId, pin).matched()) {
            audit(AuditEventType.AUTH_FAILURE, Severity.WARNING, "Invalid PIN attempt detected");
            throw new AuthenticationFailureException(attempt.failedAttempts());
        }
        lockoutPolicy.recordSuccess(principalId);
        synchronized (this) {
            state = SessionState.ACTIVE;
            credentialEnrolled = true;
            rearm();
        }
        audit(AuditEventType.AUTH_SUCCESS, Severity.INFO, "User successfully unlocked session via PIN");
        return SessionState.ACTIVE;
    }

    /** {@link #unlock} with the PIN derivation on the KDF executor. */
    public CompletableFuture<SessionState> unlockAsync(String pin) {
        return CompletableFuture.supplyAsync(() -> unlock(pin), kdfExecutor);
    }

    @EventListener
    public synchronized void onCredentialChanged(CredentialChangedEvent event) {
        if (!principalId.equals(event.principalId())) return;
        credentialEnrolled = event.enrolled();
        if (state == SessionState.ACTIVE) {
            rearm();
        }
    }

    @PreDestroy
    public synchronized void dispose() {
        disposed = true;
        cancelTimer();
    }

    // caller holds the monitor
    private void rearm() {
        cancelTimer();
        if (disposed || state != SessionState.ACTIVE || !canArm()) {
            return;
        }
        long generation = ++timerGeneration;
        try {
            idleTimer = scheduler.schedule(() -> onIdle(generation),
                    scheduler.getClock().instant().plusMillis(settings.idleTimeoutMs()));
        } catch (TaskRejectedException ex) {
            // no timer means no auto-lock, so fail closed
            log.error("Idle timer could not be scheduled; locking session", ex);
            state = SessionState.LOCKED;
        }
    }

    private boolean canArm() {
        return settings.autoLockEnabled() && settings.onboardingComplete() && credentialEnrolled;
    }

    private void cancelTimer() {
        if (idleTimer != null) {
            idleTimer.cancel(false);
            idleTimer = null;
        }
    }

    private void onIdle(long generation) {
        synchronized (this) {
            if (disposed || generation != timerGeneration || state != SessionState.ACTIVE) {
                return;
            }
            idleTimer = null;
            state = SessionState.LOCKED;
        }
        log.info("Session of {} auto-locked after idle timeout", principalId);
        audit(AuditEventType.SESSION_TIMEOUT, Severity.INFO, "Session timeout - Auto lock engaged");
    }

    private void audit(AuditEventType type, Severity severity, String detail) {
        auditTrail.record(AuditEvent.of(clock.instant(), type, severity, detail, principalId));
    }
}
