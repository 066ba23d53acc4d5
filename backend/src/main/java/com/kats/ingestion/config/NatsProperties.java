package com.kats.ingestion.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * NATS connection and JetStream layout. Host and credentials come from the environment
 * (NATS_HOST, NATS_USER, NATS_PASSWORD) through application.yml.
 */
@ConfigurationProperties(prefix = "kats.nats")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class NatsProperties {

    @NotBlank
    private String url = "nats://127.0.0.1:4222";

    private String user = "krist";

    private String password = "krist";

    /** Stream holding every published ledger transaction. */
    @NotBlank
    private String stream = "krist";

    /** Key-value bucket used by the nats checkpoint store. */
    @NotBlank
    private String kvBucket = "kats";

    /**
     * Server-side Msg-Id de-duplication window of the stream. Only republishes inside this window are
     * dropped: a backfill resumed after a longer crash or outage republishes its in-flight page (at most
     * one page) as new messages. Raise it to cover the expected restart time.
     */
    private long duplicateWindowMs = 120_000;

    /** Timeout for connect and JetStream API requests. */
    private long requestTimeoutMs = 5_000;
}
