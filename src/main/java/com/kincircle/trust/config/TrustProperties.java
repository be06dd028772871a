package com.kincircle.trust.config;

import com.kincircle.trust.service.model.RateLimitBudget;
import com.kincircle.trust.service.model.SessionSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "trust")
public class TrustProperties {

    private Credential credential = new Credential();
    private Lockout lockout = new Lockout();
    private Session session = new Session();
    private RateLimit rateLimit = new RateLimit();
    private Store store = new Store();
    private Audit audit = new Audit();
    private Assistant assistant = new Assistant();
    private Http http = new Http();

    @Data
    public static class Credential {
        private int pinLength = 4;
    }

    @Data
    public static class Lockout {
        private int threshold = 3;
        private long maxBackoffSeconds = 300;
    }

    @Data
    public static class Session {
        private boolean autoLockEnabled = true;
        private long idleTimeoutMs = SessionSettings.DEFAULT_IDLE_TIMEOUT_MS;
        private boolean onboardingComplete = false;
        private String principalId = "local";

        public SessionSettings toSettings() {
            return new SessionSettings(autoLockEnabled, idleTimeoutMs, onboardingComplete);
        }
    }

    @Data
    public static class RateLimit {
        private Map<String, Budget> budgets = new LinkedHashMap<>();
    }

    @Data
    public static class Budget {
        private int maxRequests;
        private long windowMs = 60_000;

        public RateLimitBudget toBudget() {
            return new RateLimitBudget(maxRequests, windowMs);
        }
    }

    @Data
    public static class Store {
        /** jdbc | memory */
        private String type = "jdbc";
    }

    @Data
    public static class Audit {
        private String baseUrl = "";
    }

    @Data
    public static class Assistant {
        private String baseUrl = "";
    }

    @Data
    public static class Http {
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 8000;
    }
}
