package com.kats.ingestion.job.tail;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fixed-period tail trigger. Covers gaps in push delivery (missed events, reconnect windows).
 */
@Component
@RequiredArgsConstructor
public class TailTriggerScheduler {

    private final TailDispatcher dispatcher;

    @Scheduled(fixedDelayString = "${kats.tail.interval-ms:1000}")
    public void tick() {
        dispatcher.trigger("timer");
    }
}
