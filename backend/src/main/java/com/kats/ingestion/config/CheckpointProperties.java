package com.kats.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Selects the checkpoint backend: {@code nats} (JetStream KV bucket) or {@code mongo}.
 */
@ConfigurationProperties(prefix = "kats.checkpoint")
@NoArgsConstructor
@Getter
@Setter
public class CheckpointProperties {

    public static final String STORE_NATS = "nats";
    public static final String STORE_MONGO = "mongo";

    private String store = STORE_NATS;
}
