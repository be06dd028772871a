package com.kincircle.trust.service.model;

import java.util.List;

/**
 * @param subjectName name of the person being cared for, redacted first
 * @param privacyMode redaction is a no-op when {@code false}
 * @param extraNames  further names to scrub, e.g. family members
 */
public record RedactionSettings(String subjectName, boolean privacyMode, List<String> extraNames) {

    public RedactionSettings {
        extraNames = extraNames == null ? List.of() : List.copyOf(extraNames);
    }

    public RedactionSettings(String subjectName, boolean privacyMode) {
        this(subjectName, privacyMode, List.of());
    }
}
