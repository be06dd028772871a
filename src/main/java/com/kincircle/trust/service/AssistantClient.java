package com.kincircle.trust.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kincircle.trust.config.TrustProperties;
import com.kincircle.trust.service.error.AssistantUnavailableException;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the remote model proxy. Only ever called through {@link AssistantGateway},
 * which has already checked permission, spent budget and redacted the payload.
 */
@Component
@RequiredArgsConstructor
public class AssistantClient {

    private final RestTemplate restTemplate;
    private final TrustProperties props;

    /**
     * POST {base}/api/query-ledger with {@code {"query": ..., "context": [...]}}.
     * Expects {@code {"answer": "..."}}.
     */
    public Reply query(String question, List<String> context) {
        String base = props.getAssistant().getBaseUrl();
        if (base == null || base.isBlank()) {
            throw new AssistantUnavailableException("Assistant base URL is not configured");
        }
        try {
            URI uri = URI.create(base + "/api/query-ledger");
            var req = RequestEntity
                    .post(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("query", question, "context", context));
            ResponseEntity<Reply> resp = restTemplate.exchange(req, Reply.class);
            return resp.getBody();
        } catch (RestClientException ex) {
            throw new AssistantUnavailableException("Assistant call failed: " + ex.getMessage(), ex);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Reply {
        private String answer;
    }
}
