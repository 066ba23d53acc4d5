package com.kats.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kats.common.RetryPolicy;
import com.kats.domain.CheckpointRepository;
import com.kats.ingestion.adapter.KristApiClient;
import com.kats.ingestion.adapter.KristLedgerAdapter;
import com.kats.ingestion.adapter.LedgerClient;
import com.kats.ingestion.adapter.WebClientKristApiClient;
import com.kats.ingestion.checkpoint.CheckpointStore;
import com.kats.ingestion.checkpoint.MongoCheckpointStore;
import com.kats.ingestion.checkpoint.NatsKvCheckpointStore;
import com.kats.ingestion.job.tail.TailDispatcher;
import com.kats.ingestion.publish.JetStreamLastPublishedLookup;
import com.kats.ingestion.publish.LastPublishedLookup;
import com.kats.ingestion.publish.StreamProvisioner;
import com.kats.ingestion.push.KristPushListener;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.nats.client.Connection;
import io.nats.client.JetStreamManagement;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;

import java.io.IOException;
import java.time.Duration;

/**
 * Wires the ledger client, push listener, broker lookup and the selected checkpoint store from kats.* properties.
 */
@Configuration
@EnableConfigurationProperties({ KristProperties.class, NatsProperties.class, BackfillProperties.class, TailProperties.class, CheckpointProperties.class })
public class IngestionAdapterConfig {

    private static RetryPolicy retryPolicy(KristProperties properties) {
        KristProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
    }

    @Bean
    public KristApiClient kristApiClient(WebClient.Builder webClientBuilder, KristProperties properties) {
        return new WebClientKristApiClient(webClientBuilder, properties.getApiUrl());
    }

    @Bean(name = "kristRateLimiter")
    public RateLimiter kristRateLimiter(KristProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("krist-api", config);
    }

    @Bean
    public LedgerClient ledgerClient(KristApiClient kristApiClient, ObjectMapper objectMapper,
                                     RateLimiter kristRateLimiter, KristProperties properties) {
        return new KristLedgerAdapter(kristApiClient, objectMapper, kristRateLimiter, retryPolicy(properties));
    }

    @Bean
    public WebSocketClient kristWebSocketClient() {
        return new ReactorNettyWebSocketClient();
    }

    @Bean
    public KristPushListener kristPushListener(KristApiClient kristApiClient, WebSocketClient kristWebSocketClient,
                                               TailDispatcher tailDispatcher, ObjectMapper objectMapper,
                                               KristProperties properties) {
        return new KristPushListener(kristApiClient, kristWebSocketClient, tailDispatcher, objectMapper,
                retryPolicy(properties));
    }

    @Bean
    public LastPublishedLookup lastPublishedLookup(JetStreamManagement jetStreamManagement, ObjectMapper objectMapper,
                                                   NatsProperties properties) {
        return new JetStreamLastPublishedLookup(jetStreamManagement, objectMapper, properties.getStream());
    }

    /** Default store: JetStream KV bucket, created on first start. */
    @Bean
    @ConditionalOnProperty(prefix = "kats.checkpoint", name = "store", havingValue = CheckpointProperties.STORE_NATS, matchIfMissing = true)
    public CheckpointStore natsCheckpointStore(Connection natsConnection, StreamProvisioner streamProvisioner,
                                               NatsProperties properties) throws IOException {
        streamProvisioner.ensureKeyValueBucket();
        return new NatsKvCheckpointStore(natsConnection.keyValue(properties.getKvBucket()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "kats.checkpoint", name = "store", havingValue = CheckpointProperties.STORE_MONGO)
    public CheckpointStore mongoCheckpointStore(CheckpointRepository checkpointRepository) {
        return new MongoCheckpointStore(checkpointRepository);
    }
}
