package com.kats.ingestion.job.lifecycle;

import com.kats.domain.BackfillState;
import com.kats.ingestion.config.KristProperties;
import com.kats.ingestion.job.backfill.LedgerBackfillJob;
import com.kats.ingestion.job.tail.TailDispatcher;
import com.kats.ingestion.publish.StreamProvisioner;
import com.kats.ingestion.push.KristPushListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.function.IntConsumer;

/**
 * Startup order: declare the stream, run the backfill to completion, then open the tail dispatcher and
 * subscribe to push events. Tailing never starts before the backfill finished; a provisioning or backfill
 * failure stops the process with exit code 1.
 */
@Component
@Slf4j
public class SyncLifecycle {

    private final StreamProvisioner streamProvisioner;
    private final LedgerBackfillJob backfillJob;
    private final TailDispatcher dispatcher;
    private final KristPushListener pushListener;
    private final KristProperties kristProperties;
    private final IntConsumer processExit;

    @Autowired
    public SyncLifecycle(StreamProvisioner streamProvisioner, LedgerBackfillJob backfillJob, TailDispatcher dispatcher,
                         KristPushListener pushListener, KristProperties kristProperties) {
        this(streamProvisioner, backfillJob, dispatcher, pushListener, kristProperties, System::exit);
    }

    SyncLifecycle(StreamProvisioner streamProvisioner, LedgerBackfillJob backfillJob, TailDispatcher dispatcher,
                  KristPushListener pushListener, KristProperties kristProperties, IntConsumer processExit) {
        this.streamProvisioner = streamProvisioner;
        this.backfillJob = backfillJob;
        this.dispatcher = dispatcher;
        this.pushListener = pushListener;
        this.kristProperties = kristProperties;
        this.processExit = processExit;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        try {
            start();
        } catch (RuntimeException e) {
            log.error("Startup sync failed, shutting down", e);
            shutdown(event.getApplicationContext());
        }
    }

    void start() {
        streamProvisioner.provision();
        BackfillState backfill = backfillJob.run();
        log.info("Backfill finished at offset {}; starting tail", backfill.offset());
        dispatcher.open();
        if (kristProperties.isPushEnabled()) {
            pushListener.start();
        } else {
            log.info("Krist push disabled; tailing on timer only");
        }
        dispatcher.trigger("startup");
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        dispatcher.close();
        pushListener.stop();
    }

    private void shutdown(ApplicationContext context) {
        int code = SpringApplication.exit(context, () -> 1);
        processExit.accept(code);
    }
}
