package com.kincircle.trust.service.model;

public enum SessionState {
    ACTIVE,
    LOCKED
}
