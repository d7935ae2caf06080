package com.example.cardlobby.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "lobby")
public record LobbyProperties(
        Presence presence,
        Session session,
        Reconciliation reconciliation,
        Delivery delivery,
        Fallback fallback,
        Auth auth,
        Persistence persistence
) {

    public LobbyProperties {
        presence = presence != null ? presence : new Presence(null);
        session = session != null ? session : new Session(null);
        reconciliation = reconciliation != null ? reconciliation : new Reconciliation(null, null, 0);
        delivery = delivery != null ? delivery : new Delivery(0, null, null, 0, null, null, null);
        fallback = fallback != null ? fallback : new Fallback(null, null, null);
        auth = auth != null ? auth : new Auth(null, null);
        persistence = persistence != null ? persistence : new Persistence(null);
    }

    public static record Presence(Duration evictionTimeout) {
        public Presence {
            if (evictionTimeout == null) evictionTimeout = Duration.ofMinutes(5);
        }
    }

    public static record Session(Duration completionGrace) {
        public Session {
            if (completionGrace == null) completionGrace = Duration.ofMinutes(2);
        }
    }

    public static record Reconciliation(Boolean enabled, Duration interval, int historySize) {
        public Reconciliation {
            if (enabled == null) enabled = Boolean.TRUE;
            if (interval == null) interval = Duration.ofSeconds(30);
            if (historySize <= 0) historySize = 50;
        }
    }

    public static record Delivery(
            int maxRetries,
            Duration baseDelay,
            Duration maxDelay,
            double multiplier,
            Duration confirmationTimeout,
            Duration eventTtl,
            Duration cleanupInterval
    ) {
        public Delivery {
            if (maxRetries <= 0) maxRetries = 3;
            if (baseDelay == null) baseDelay = Duration.ofSeconds(1);
            if (maxDelay == null) maxDelay = Duration.ofSeconds(8);
            if (multiplier <= 0) multiplier = 2.0;
            if (confirmationTimeout == null) confirmationTimeout = Duration.ofSeconds(5);
            if (eventTtl == null) eventTtl = Duration.ofMinutes(5);
            if (cleanupInterval == null) cleanupInterval = Duration.ofSeconds(30);
        }
    }

    public static record Fallback(String baseUrl, Duration connectTimeout, Duration readTimeout) {
        public Fallback {
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://localhost:8080";
            if (connectTimeout == null) connectTimeout = Duration.ofSeconds(2);
            if (readTimeout == null) readTimeout = Duration.ofSeconds(5);
        }
    }

    public static record Auth(String secret, Duration serviceTokenTtl) {
        public Auth {
            if (serviceTokenTtl == null) serviceTokenTtl = Duration.ofMinutes(5);
        }
    }

    /** {@code memory} (default) or {@code jpa}. */
    public static record Persistence(String mode) {
        public Persistence {
            if (mode == null || mode.isBlank()) mode = "memory";
        }
    }
}
