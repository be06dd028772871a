package com.kincircle.trust.service.model;

public enum Role {
    ADMIN,
    CONTRIBUTOR,
    VIEWER
}
