package com.kats.config;

import com.kats.ingestion.config.NatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.Nats;
import io.nats.client.Options;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

/**
 * Process-scoped NATS connection. Closed by the context on every shutdown path.
 */
@Configuration
@Slf4j
public class NatsConfig {

    @Bean(destroyMethod = "close")
    public Connection natsConnection(NatsProperties properties) throws IOException, InterruptedException {
        Options options = new Options.Builder()
                .server(properties.getUrl())
                .userInfo(properties.getUser(), properties.getPassword())
                .connectionTimeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
                .connectionListener((conn, event) -> log.info("NATS connection event: {}", event))
                .build();
        Connection connection = Nats.connect(options);
        log.info("Connected to NATS at {}", properties.getUrl());
        return connection;
    }

    @Bean
    public JetStream jetStream(Connection natsConnection) throws IOException {
        return natsConnection.jetStream();
    }

    @Bean
    public JetStreamManagement jetStreamManagement(Connection natsConnection) throws IOException {
        return natsConnection.jetStreamManagement();
    }
}
