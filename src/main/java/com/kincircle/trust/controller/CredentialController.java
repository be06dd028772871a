package com.kincircle.trust.controller;

import com.kincircle.trust.controller.dto.CredentialDtos.*;
import com.kincircle.trust.service.CredentialStore;
import com.kincircle.trust.service.PermissionMatrix;
import com.kincircle.trust.service.SessionGuard;
import com.kincircle.trust.service.model.Permission;
import com.kincircle.trust.service.model.Principal;
import com.kincircle.trust.service.model.SessionState;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * PIN management for the device principal. Mutations need an unlocked session
 * and the matching permission.
 */
@RestController
@RequestMapping("/api/credentials")
@RequiredArgsConstructor
public class CredentialController {

    private final CredentialStore credentialStore;
    private final SessionGuard sessionGuard;
    private final PermissionMatrix permissions;

    @GetMapping
    public CredentialStatus status() {
        String id = sessionGuard.getPrincipalId();
        CredentialStatus s = new CredentialStatus();
        s.principalId = id;
        credentialStore.find(id).ifPresent(c -> {
            s.enrolled = true;
            s.algorithm = c.algorithmVersion().name();
            s.secure = c.isSecure();
        });
        return s;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CredentialStatus enroll(Principal principal, @Valid @RequestBody EnrollRequest req) {
        requireUnlocked();
        permissions.requirePermission(principal, Permission.SETTINGS_UPDATE, "set PIN");
        credentialStore.enroll(sessionGuard.getPrincipalId(), req.pin);
        return status();
    }

    @PutMapping
    public CredentialStatus change(Principal principal, @Valid @RequestBody ChangeRequest req) {
        requireUnlocked();
        permissions.requirePermission(principal, Permission.SETTINGS_UPDATE, "change PIN");
        credentialStore.change(sessionGuard.getPrincipalId(), req.currentPin, req.newPin);
        return status();
    }

    @DeleteMapping
    public CredentialStatus reset(Principal principal) {
        requireUnlocked();
        permissions.requirePermission(principal, Permission.DATA_RESET, "reset all data");
        credentialStore.reset(sessionGuard.getPrincipalId());
        return status();
    }

    private void requireUnlocked() {
        if (sessionGuard.getState() == SessionState.LOCKED) {
            throw new ResponseStatusException(HttpStatus.LOCKED, "session is locked");
        }
    }
}
