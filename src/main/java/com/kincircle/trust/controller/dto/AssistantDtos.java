package com.kincircle.trust.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kincircle.trust.service.model.RedactionSettings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public final class AssistantDtos {
    private AssistantDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueryRequest {
        @NotBlank
        @Size(max = 2000)
        public String question;
        public List<String> context;     // ledger lines, redacted before sending
        public String subjectName;
        public boolean privacyMode = true;
        public List<String> familyNames;

        public RedactionSettings privacy() {
            return new RedactionSettings(subjectName, privacyMode, familyNames);
        }
    }

    public static class QueryResponse {
        public String answer;

        public QueryResponse(String answer) {
            this.answer = answer;
        }
    }
}
