package com.kincircle.trust.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

public final class CredentialDtos {
    private CredentialDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EnrollRequest {
        @NotBlank
        public String pin;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChangeRequest {
        @NotBlank
        public String currentPin;
        @NotBlank
        public String newPin;
    }

    public static class CredentialStatus {
        public String principalId;
        public boolean enrolled;
        public String algorithm;   // null when not enrolled
        public boolean secure;
    }
}
