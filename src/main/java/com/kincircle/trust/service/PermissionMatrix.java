package com.kincircle.trust.service;

import com.kincircle.trust.service.error.PermissionDeniedException;
import com.kincircle.trust.service.model.Permission;
import com.kincircle.trust.service.model.Principal;
import com.kincircle.trust.service.model.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.kincircle.trust.service.model.Permission.*;

/**
 * Static role to permission grants.
 *
 * <p>{@link #requirePermission} is the enforcement point and belongs immediately before
 * every mutating operation. {@link #hasAnyPermission} and {@link #hasAllPermissions} are for
 * showing or hiding controls only; a caller that skips the UI skips them too.
 */
@Slf4j
@Component
public class PermissionMatrix {

    private static final Map<Role, Set<Permission>> GRANTS;

    static {
        EnumMap<Role, Set<Permission>> grants = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            grants.put(role, Collections.unmodifiableSet(grantsFor(role)));
        }
        GRANTS = Collections.unmodifiableMap(grants);
    }

    // exhaustive: adding a Role without a case here does not compile
    private static EnumSet<Permission> grantsFor(Role role) {
        return switch (role) {
            case ADMIN -> EnumSet.allOf(Permission.class);
            case CONTRIBUTOR -> EnumSet.of(
                    ENTRIES_CREATE, ENTRIES_READ, ENTRIES_UPDATE,
                    TASKS_CREATE, TASKS_READ, TASKS_UPDATE,
                    DOCUMENTS_CREATE, DOCUMENTS_READ,
                    SETTINGS_READ,
                    MEDICATIONS_READ, MEDICATIONS_UPDATE,
                    HELP_TASKS_CREATE, HELP_TASKS_READ, HELP_TASKS_CLAIM, HELP_TASKS_COMPLETE,
                    DATA_EXPORT);
            case VIEWER -> EnumSet.of(
                    ENTRIES_READ,
                    TASKS_READ,
                    DOCUMENTS_READ,
                    SETTINGS_READ,
                    MEDICATIONS_READ,
                    HELP_TASKS_READ);
        };
    }

    public Set<Permission> permissionsOf(Role role) {
        return GRANTS.get(role);
    }

    public boolean hasPermission(Principal principal, Permission permission) {
        return principal != null && permission != null && GRANTS.get(principal.role()).contains(permission);
    }

    public boolean hasAnyPermission(Principal principal, Collection<Permission> permissions) {
        return permissions.stream().anyMatch(p -> hasPermission(principal, p));
    }

    public boolean hasAllPermissions(Principal principal, Collection<Permission> permissions) {
        return permissions.stream().allMatch(p -> hasPermission(principal, p));
    }

    public boolean isAdmin(Principal principal) {
        return principal != null && principal.role() == Role.ADMIN;
    }

    public boolean canModify(Principal principal) {
        return principal != null && principal.role() != Role.VIEWER;
    }

    public void requirePermission(Principal principal, Permission permission) {
        requirePermission(principal, permission, permission.code());
    }

    /**
     * @param action human-readable name of what was attempted, used in the error message
     * @throws PermissionDeniedException when the principal's role lacks {@code permission}
     */
    public void requirePermission(Principal principal, Permission permission, String action) {
        if (!hasPermission(principal, permission)) {
            String who = principal == null ? "anonymous" : principal.id();
            log.warn("Denied {} to {} ({})", permission.code(), who, action);
            throw new PermissionDeniedException(who, permission.code(), action);
        }
    }

    /** Wire-code variant; an unknown code is denied, never silently allowed. */
    public void requirePermission(Principal principal, String permissionCode) {
        Permission permission = Permission.fromCode(permissionCode).orElse(null);
        if (permission == null) {
            String who = principal == null ? "anonymous" : principal.id();
            log.warn("Denied unknown permission {} to {}", permissionCode, who);
            throw new PermissionDeniedException(who, String.valueOf(permissionCode), String.valueOf(permissionCode));
        }
        requirePermission(principal, permission, permissionCode);
    }
}
