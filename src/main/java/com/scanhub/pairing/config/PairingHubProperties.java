package com.scanhub.pairing.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for the pairing hub.
 */
@Data
@ConfigurationProperties(prefix = "scanhub.pairing")
public class PairingHubProperties {

    /**
     * WebSocket endpoint configuration
     */
    private WebSocketConfig websocket = new WebSocketConfig();

    /**
     * Identity resolution and bearer credential configuration
     */
    private IdentityConfig identity = new IdentityConfig();

    /**
     * Legacy system of record configuration
     */
    private LegacyConfig legacy = new LegacyConfig();

    /**
     * Background reconciliation configuration
     */
    private ReconciliationConfig reconciliation = new ReconciliationConfig();

    /**
     * Pairing commit configuration
     */
    private CommitConfig commit = new CommitConfig();

    @Data
    public static class WebSocketConfig {
        /**
         * Path the scanners and dashboards connect to
         */
        private String path = "/ws";

        /**
         * Allowed origin patterns for the handshake
         */
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        /**
         * Maximum time a single send may block before the session is considered stuck
         */
        private int sendTimeLimitMs = 10_000;

        /**
         * Maximum number of bytes buffered per session while a send is in progress
         */
        private int sendBufferSizeBytes = 512 * 1024;
    }

    @Data
    public static class IdentityConfig {
        /**
         * HMAC secret used to verify HS256 bearer credentials.
         * In production, use environment variable: SCANHUB_TOKEN_SECRET
         */
        private String tokenSecret = "change-me-scanhub-token-secret";

        /**
         * Accept a bare login in the register message when no token is given
         */
        private boolean allowBareLogin = true;

        /**
         * Accept any non-blank login, not only the ones listed in {@link #users}
         */
        private boolean acceptUnknown = true;

        /**
         * Known users
         */
        private List<KnownUser> users = new ArrayList<>();
    }

    @Data
    public static class KnownUser {
        private String login;
        private Long id;
        private String fullName;
    }

    @Data
    public static class LegacyConfig {
        /**
         * Which legacy sink implementation is active
         */
        private LegacyMode mode = LegacyMode.SIMULATED;

        /**
         * Legacy API base URL (HTTP mode)
         */
        private String apiUrl = "http://localhost:9680";

        /**
         * API key for service-to-service authentication (HTTP mode)
         */
        private String apiKey;

        /**
         * Optional request timeout for the HTTP sink. Unset means no timeout.
         */
        private Duration requestTimeout;

        /**
         * Simulated sink: lower bound of the artificial latency
         */
        private Duration simulatedMinDelay = Duration.ofSeconds(2);

        /**
         * Simulated sink: upper bound of the artificial latency
         */
        private Duration simulatedMaxDelay = Duration.ofSeconds(10);

        /**
         * Simulated sink: probability (0..1) that a save is rejected
         */
        private double simulatedFailureRate = 0.5;
    }

    public enum LegacyMode {
        SIMULATED,
        HTTP
    }

    @Data
    public static class ReconciliationConfig {
        /**
         * Core number of reconciliation threads
         */
        private int coreThreads = 4;

        /**
         * Maximum number of reconciliation threads
         */
        private int maxThreads = 16;

        /**
         * Queue capacity before extra threads are started
         */
        private int queueCapacity = 1000;
    }

    @Data
    public static class CommitConfig {
        /**
         * Number of lock stripes serializing commits per product id (power of two)
         */
        private int lockStripes = 64;
    }
}
