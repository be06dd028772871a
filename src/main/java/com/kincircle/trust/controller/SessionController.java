package com.kincircle.trust.controller;

import com.kincircle.trust.controller.dto.SessionDtos.*;
import com.kincircle.trust.service.LockoutPolicy;
import com.kincircle.trust.service.PermissionMatrix;
import com.kincircle.trust.service.SessionGuard;
import com.kincircle.trust.service.model.LockoutState;
import com.kincircle.trust.service.model.Permission;
import com.kincircle.trust.service.model.Principal;
import com.kincircle.trust.service.model.SessionSettings;
import com.kincircle.trust.service.model.SessionState;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;

@RestController
@RequestMapping("/api/session")
@RequiredArgsConstructor
public class SessionController {

    private final SessionGuard sessionGuard;
    private final LockoutPolicy lockoutPolicy;
    private final PermissionMatrix permissions;
    private final Clock clock;

    @GetMapping
    public SessionView get() {
        return view();
    }

    /** Pointer/keyboard/scroll heartbeat from the UI */
    @PostMapping("/activity")
    public SessionView activity(@RequestBody(required = false) ActivityRequest req) {
        sessionGuard.onActivity(req == null ? new ActivityRequest().signal : req.signal);
        return view();
    }

    @PostMapping("/unlock")
    public SessionView unlock(@Valid @RequestBody UnlockRequest req) {
        sessionGuard.unlock(req.pin);
        return view();
    }

    @PostMapping("/lock")
    public SessionView lock() {
        sessionGuard.lock();
        return view();
    }

    @PutMapping("/settings")
    public SessionView settings(Principal principal, @Valid @RequestBody SettingsRequest req) {
        if (sessionGuard.getState() == SessionState.LOCKED) {
            throw new ResponseStatusException(HttpStatus.LOCKED, "session is locked");
        }
        permissions.requirePermission(principal, Permission.SETTINGS_UPDATE, "change auto-lock settings");
        sessionGuard.reconfigure(new SessionSettings(req.autoLockEnabled, req.idleTimeoutMs, req.hasCompletedOnboarding));
        return view();
    }

    private SessionView view() {
        SessionSettings s = sessionGuard.getSettings();
        LockoutState lockout = lockoutPolicy.state(sessionGuard.getPrincipalId());
        SessionView v = new SessionView();
        v.state = sessionGuard.getState();
        v.autoLockEnabled = s.autoLockEnabled();
        v.idleTimeoutMs = s.idleTimeoutMs();
        v.hasCompletedOnboarding = s.onboardingComplete();
        v.timerArmed = sessionGuard.isTimerArmed();
        v.failedAttempts = lockout.failedAttempts();
        v.lockedOutSeconds = lockout.remainingSeconds(clock.instant());
        return v;
    }
}
