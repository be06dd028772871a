package com.kincircle.trust.service.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every action the surrounding application can gate. {@link #code()} is the
 * wire form used by call sites, e.g. {@code entries:delete}.
 */
public enum Permission {
    ENTRIES_CREATE("entries:create"),
    ENTRIES_READ("entries:read"),
    ENTRIES_UPDATE("entries:update"),
    ENTRIES_DELETE("entries:delete"),
    TASKS_CREATE("tasks:create"),
    TASKS_READ("tasks:read"),
    TASKS_UPDATE("tasks:update"),
    TASKS_DELETE("tasks:delete"),
    DOCUMENTS_CREATE("documents:create"),
    DOCUMENTS_READ("documents:read"),
    DOCUMENTS_DELETE("documents:delete"),
    SETTINGS_READ("settings:read"),
    SETTINGS_UPDATE("settings:update"),
    FAMILY_INVITE("family:invite"),
    FAMILY_MANAGE("family:manage"),
    MEDICATIONS_CREATE("medications:create"),
    MEDICATIONS_READ("medications:read"),
    MEDICATIONS_UPDATE("medications:update"),
    MEDICATIONS_DELETE("medications:delete"),
    HELP_TASKS_CREATE("help_tasks:create"),
    HELP_TASKS_READ("help_tasks:read"),
    HELP_TASKS_CLAIM("help_tasks:claim"),
    HELP_TASKS_COMPLETE("help_tasks:complete"),
    SECURITY_LOGS_READ("security_logs:read"),
    DATA_EXPORT("data:export"),
    DATA_IMPORT("data:import"),
    DATA_RESET("data:reset");

    private final String code;

    Permission(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<Permission> fromCode(String code) {
        if (code == null) return Optional.empty();
        return Arrays.stream(values()).filter(p -> p.code.equals(code)).findFirst();
    }
}
