package com.kincircle.trust.service;

import com.kincircle.trust.config.TrustProperties;
import com.kincircle.trust.service.model.AuditEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

/**
 * Writes every event to the application log and, when {@code trust.audit.base-url}
 * is set, POSTs it to {@code {base}/events}. A failed POST is logged and dropped so
 * that the unlock flow never depends on the remote log being up.
 */
@Slf4j
@Component
public class HttpAuditTrail implements AuditTrail {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpAuditTrail(RestTemplate restTemplate, TrustProperties props) {
        this.restTemplate = restTemplate;
        String url = props.getAudit().getBaseUrl();
        this.baseUrl = (url == null || url.isBlank()) ? "" : (url.endsWith("/") ? url.substring(0, url.length() - 1) : url);
    }

    @Override
    public void record(AuditEvent event) {
        switch (event.severity()) {
            case INFO -> log.info("[AUDIT] {} principal={} {}", event.type(), event.principalId(), event.detail());
            case WARNING -> log.warn("[AUDIT] {} principal={} {}", event.type(), event.principalId(), event.detail());
            case CRITICAL -> log.error("[AUDIT] {} principal={} {}", event.type(), event.principalId(), event.detail());
        }
        if (baseUrl.isEmpty()) {
            return;
        }
        try {
            var req = RequestEntity
                    .post(URI.create(baseUrl + "/events"))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(event);
            restTemplate.exchange(req, Void.class);
        } catch (RestClientException ex) {
            log.warn("Audit delivery failed for {}: {}", event.type(), ex.toString());
        }
    }
}
