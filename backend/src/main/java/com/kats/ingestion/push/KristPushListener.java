package com.kats.ingestion.push;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kats.common.RetryPolicy;
import com.kats.domain.MalformedRecordException;
import com.kats.ingestion.adapter.KristApiClient;
import com.kats.ingestion.adapter.LedgerException;
import com.kats.ingestion.job.tail.TailDispatcher;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Krist WebSocket subscription to the {@code transactions} event. Each transaction event triggers a tail run;
 * the payload itself is not used, the tail job reads the ledger.
 *
 * <p>Session setup: {@code POST /ws/start} returns a one-time socket URL, then the client subscribes.
 * Closed or failed sessions are re-established with backoff until {@link #stop()}.
 */
@Slf4j
public class KristPushListener {

    static final String START_PATH = "/ws/start";
    static final String SUBSCRIBE_MESSAGE = "{\"id\":1,\"type\":\"subscribe\",\"event\":\"transactions\"}";

    private final KristApiClient apiClient;
    private final WebSocketClient webSocketClient;
    private final TailDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final RetryPolicy reconnectPolicy;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile Disposable subscription;

    public KristPushListener(KristApiClient apiClient, WebSocketClient webSocketClient, TailDispatcher dispatcher,
                             ObjectMapper objectMapper, RetryPolicy reconnectPolicy) {
        this.apiClient = apiClient;
        this.webSocketClient = webSocketClient;
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
        this.reconnectPolicy = reconnectPolicy;
    }

    public synchronized void start() {
        if (subscription != null && !subscription.isDisposed()) {
            return;
        }
        subscription = Mono.defer(this::connectOnce)
                .then(Mono.<Void>error(new LedgerException("Krist push session ended", true, null)))
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    int failures = consecutiveFailures.getAndIncrement();
                    log.warn("Krist push connection lost ({}); reconnect attempt {}",
                            signal.failure().getMessage(), failures + 1);
                    return Mono.delay(reconnectPolicy.delay(failures));
                })))
                .subscribe(
                        ignored -> { },
                        e -> log.error("Krist push listener stopped", e));
        log.info("Krist push listener started");
    }

    @PreDestroy
    public synchronized void stop() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
            log.info("Krist push listener stopped");
        }
    }

    public boolean isActive() {
        Disposable current = subscription;
        return current != null && !current.isDisposed();
    }

    private Mono<Void> connectOnce() {
        return apiClient.post(START_PATH)
                .map(this::parseSocketUrl)
                .flatMap(url -> webSocketClient.execute(URI.create(url), this::handleSession));
    }

    private Mono<Void> handleSession(WebSocketSession session) {
        log.info("Krist push session {} open", session.getId());
        Mono<Void> subscribe = session.send(Mono.just(session.textMessage(SUBSCRIBE_MESSAGE)));
        Mono<Void> inbound = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(this::onMessage)
                .then();
        return subscribe.then(inbound)
                .doOnError(e -> log.warn("Krist push session {} error: {}", session.getId(), e.getMessage()))
                .doFinally(signal -> log.info("Krist push session {} closed ({})", session.getId(), signal));
    }

    String parseSocketUrl(String json) {
        JsonNode root = readTree(json);
        if (!root.path("ok").asBoolean(false) || !root.hasNonNull("url")) {
            throw new LedgerException("Krist " + START_PATH + " returned no socket URL: " + json);
        }
        return root.get("url").asText();
    }

    void onMessage(String text) {
        JsonNode message;
        try {
            message = readTree(text);
        } catch (MalformedRecordException e) {
            log.warn("Ignoring undecodable Krist push message: {}", text);
            return;
        }
        String type = message.path("type").asText("");
        switch (type) {
            case "event" -> onEvent(message);
            case "hello" -> {
                consecutiveFailures.set(0);
                log.info("Krist push hello (motd: {})", message.path("motd").asText(""));
            }
            case "keepalive" -> log.trace("Krist push keepalive");
            default -> log.debug("Krist push message: {}", text);
        }
    }

    private void onEvent(JsonNode message) {
        if (!"transaction".equals(message.path("event").asText())) {
            log.debug("Krist push event {} ignored", message.path("event").asText());
            return;
        }
        log.debug("Krist push transaction {}", message.path("transaction").path("id").asLong(-1));
        dispatcher.trigger("push");
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("Undecodable Krist push payload", e);
        }
    }
}
