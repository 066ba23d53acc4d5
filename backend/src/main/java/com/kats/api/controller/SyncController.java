package com.kats.api.controller;

import com.kats.api.dto.ErrorBody;
import com.kats.api.dto.SyncRefreshResponse;
import com.kats.api.dto.SyncStatusResponse;
import com.kats.ingestion.status.SyncStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * GET /sync/status: checkpoints and tail dispatcher state. POST /sync/refresh: request a tail run.
 */
@RestController
@RequestMapping("/api/v1/sync")
@RequiredArgsConstructor
public class SyncController {

    private final SyncStatusService syncStatusService;

    @GetMapping("/status")
    public Mono<SyncStatusResponse> status() {
        // checkpoint reads block on the store
        return Mono.fromCallable(syncStatusService::getStatus)
                .subscribeOn(Schedulers.boundedElastic())
                .map(SyncStatusResponse::from);
    }

    @PostMapping("/refresh")
    public ResponseEntity<?> refresh() {
        if (syncStatusService.requestRefresh()) {
            return ResponseEntity.accepted().body(new SyncRefreshResponse("Tail sync triggered"));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorBody.of("SYNC_BUSY", "A tail run is already queued or tailing has not started"));
    }
}
