package com.kincircle.trust.controller;

import com.kincircle.trust.controller.dto.AccessDtos.*;
import com.kincircle.trust.service.PermissionMatrix;
import com.kincircle.trust.service.RateLimiterRegistry;
import com.kincircle.trust.service.model.Permission;
import com.kincircle.trust.service.model.Principal;
import com.kincircle.trust.service.model.RateLimitBudget;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * Read-only views for presentation gating: which controls to show, how much budget is left.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AccessController {

    private final PermissionMatrix permissions;
    private final RateLimiterRegistry rateLimiters;

    @GetMapping("/access/permissions")
    public PermissionsView permissions(Principal principal) {
        PermissionsView v = new PermissionsView();
        v.principalId = principal.id();
        v.role = principal.role().name();
        v.permissions = permissions.permissionsOf(principal.role()).stream().map(Permission::code).toList();
        v.admin = permissions.isAdmin(principal);
        v.canModify = permissions.canModify(principal);
        return v;
    }

    @GetMapping("/rate-limits/{key}")
    public BudgetView budget(@PathVariable String key) {
        RateLimitBudget b = rateLimiters.budget(key)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "unknown budget: " + key));
        BudgetView v = new BudgetView();
        v.key = key;
        v.maxRequests = b.maxRequests();
        v.windowMs = b.windowMs();
        v.remaining = rateLimiters.getRemainingRequests(key);
        v.resetInMs = rateLimiters.getResetTime(key);
        return v;
    }
}
