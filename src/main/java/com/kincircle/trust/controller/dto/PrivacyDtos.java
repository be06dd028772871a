package com.kincircle.trust.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kincircle.trust.service.model.RedactionSettings;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public final class PrivacyDtos {
    private PrivacyDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RedactRequest {
        @NotNull
        public String text;
        public String subjectName;
        public boolean privacyMode = true;
        public List<String> extraNames;

        public RedactionSettings settings() {
            return new RedactionSettings(subjectName, privacyMode, extraNames);
        }
    }

    public static class RedactResponse {
        public String text;

        public RedactResponse(String text) {
            this.text = text;
        }
    }
}
