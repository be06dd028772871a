package com.kincircle.trust.service.model;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
