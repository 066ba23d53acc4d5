package com.kats.ingestion.adapter;

import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * KristApiClient returning scripted responses in order and recording each request as {@code path?limit=..&offset=..}.
 */
class ScriptedKristApiClient implements KristApiClient {

    private final Deque<Mono<String>> responses = new ArrayDeque<>();
    private final List<String> requests = new ArrayList<>();

    ScriptedKristApiClient respond(String body) {
        responses.add(Mono.just(body));
        return this;
    }

    ScriptedKristApiClient fail(LedgerException e) {
        responses.add(Mono.error(e));
        return this;
    }

    @Override
    public Mono<String> get(String path, Map<String, ?> queryParams) {
        requests.add(path + "?limit=" + queryParams.get("limit") + "&offset=" + queryParams.get("offset"));
        return next();
    }

    @Override
    public Mono<String> post(String path) {
        requests.add("POST " + path);
        return next();
    }

    private Mono<String> next() {
        Mono<String> response = responses.poll();
        if (response == null) {
            throw new IllegalStateException("No scripted response left");
        }
        return response;
    }

    List<String> requests() {
        return requests;
    }
}
