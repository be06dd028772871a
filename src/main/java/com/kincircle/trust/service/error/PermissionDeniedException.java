package com.kincircle.trust.service.error;

public class PermissionDeniedException extends TrustException {

    private final String principalId;
    private final String permission;

    public PermissionDeniedException(String principalId, String permission, String action) {
        super("PERMISSION_DENIED", "Permission denied: " + action + " requires " + permission + " permission");
        this.principalId = principalId;
        this.permission = permission;
    }

    public String getPrincipalId() {
        return principalId;
    }

    public String getPermission() {
        return permission;
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
