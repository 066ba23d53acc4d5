package com.kats.ingestion.adapter;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Raw HTTP access to the Krist API, returning response bodies as JSON strings.
 * Retries and rate limiting are handled by {@link KristLedgerAdapter}.
 */
public interface KristApiClient {

    Mono<String> get(String path, Map<String, ?> queryParams);

    Mono<String> post(String path);
}
