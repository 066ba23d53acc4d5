package com.kats.ingestion.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Krist ledger API client settings: base URL, local request budget and transport retry.
 */
@ConfigurationProperties(prefix = "kats.krist")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class KristProperties {

    /** Base URL of the Krist HTTP API (no trailing slash). */
    @NotBlank
    private String apiUrl = "https://krist.dev";

    /** Local request budget for the ledger API. Krist throttles aggressive clients. */
    private int maxRequestsPerSecond = 10;

    /** How long a call may wait for a local limiter permit before failing. */
    private long limiterTimeoutMs = 5_000;

    /** Subscribe to the push WebSocket after backfill. Disable to run timer-only. */
    private boolean pushEnabled = true;

    private Retry retry = new Retry();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {

        /** Delay before the first retry; doubles each attempt. */
        private long baseDelayMs = 1_000;

        /** Ceiling for a single backoff delay. */
        private long maxDelayMs = 30_000;

        /** Jitter factor 0..1 (0.2 = ±20%). */
        private double jitterFactor = 0.2;

        /** Total attempts per ledger call, including the first one. */
        private int maxAttempts = 5;
    }
}
