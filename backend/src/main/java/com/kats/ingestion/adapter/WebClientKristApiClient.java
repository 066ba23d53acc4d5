package com.kats.ingestion.adapter;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Krist HTTP client on WebClient. Maps connection failures, 429 and 5xx to retryable {@link LedgerException}s.
 */
public class WebClientKristApiClient implements KristApiClient {

    private final WebClient webClient;

    public WebClientKristApiClient(WebClient.Builder builder, String apiUrl) {
        this.webClient = builder.baseUrl(apiUrl).build();
    }

    @Override
    public Mono<String> get(String path, Map<String, ?> queryParams) {
        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path(path);
                    queryParams.forEach((name, value) -> uriBuilder.queryParam(name, value));
                    return uriBuilder.build();
                })
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class, WebClientKristApiClient::fromResponse)
                .onErrorMap(WebClientRequestException.class,
                        e -> new LedgerException("Krist request failed: " + e.getMessage(), true, e));
    }

    @Override
    public Mono<String> post(String path) {
        return webClient.post()
                .uri(path)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class, WebClientKristApiClient::fromResponse)
                .onErrorMap(WebClientRequestException.class,
                        e -> new LedgerException("Krist request failed: " + e.getMessage(), true, e));
    }

    private static LedgerException fromResponse(WebClientResponseException e) {
        boolean retryable = e.getStatusCode().is5xxServerError()
                || e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value();
        return new LedgerException("Krist HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(),
                retryable, e);
    }
}
