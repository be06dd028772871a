package com.kincircle.trust.controller.dto;

import java.util.List;

public final class AccessDtos {
    private AccessDtos() {}

    public static class PermissionsView {
        public String principalId;
        public String role;
        public List<String> permissions;
        public boolean admin;
        public boolean canModify;
    }

    public static class BudgetView {
        public String key;
        public int maxRequests;
        public long windowMs;
        public int remaining;
        public long resetInMs;
    }
}
