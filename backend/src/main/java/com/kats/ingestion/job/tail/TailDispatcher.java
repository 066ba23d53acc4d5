package com.kats.ingestion.job.tail;

import com.kats.config.AsyncConfig;
import com.kats.ingestion.config.TailProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-flight gate in front of {@link LedgerTailJob}.
 *
 * <p>Runs execute one at a time on a single-thread executor. A trigger is dropped when pending plus
 * running runs already exceed {@code maxQueueDepth}, so any burst of timer ticks and push events
 * leaves at most one run queued behind the one in flight. A failed run is logged and does not affect
 * later triggers.
 *
 * <p>The gate stays closed until {@link #open()}; tailing must not start before the backfill finished.
 */
@Component
@Slf4j
public class TailDispatcher {

    private final LedgerTailJob tailJob;
    private final Executor executor;
    private final int maxQueueDepth;

    private final AtomicInteger depth = new AtomicInteger();
    private final AtomicBoolean open = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong coalescedTriggers = new AtomicLong();
    private final AtomicLong failedRuns = new AtomicLong();

    @Autowired
    public TailDispatcher(LedgerTailJob tailJob,
                          @Qualifier(AsyncConfig.TAIL_EXECUTOR) Executor executor,
                          TailProperties properties) {
        this(tailJob, executor, properties.getMaxQueueDepth());
    }

    TailDispatcher(LedgerTailJob tailJob, Executor executor, int maxQueueDepth) {
        this.tailJob = tailJob;
        this.executor = executor;
        this.maxQueueDepth = maxQueueDepth;
    }

    public void open() {
        if (open.compareAndSet(false, true)) {
            log.info("Tail dispatcher open");
        }
    }

    public void close() {
        if (open.compareAndSet(true, false)) {
            log.info("Tail dispatcher closed");
        }
    }

    /**
     * Requests a tail run. Safe to call from any thread, any number of times.
     *
     * @param source label for logs (timer, push, api, startup)
     * @return true if a run was scheduled, false if the trigger was coalesced or the gate is closed
     */
    public boolean trigger(String source) {
        if (!open.get()) {
            log.debug("Tail trigger from {} ignored: dispatcher not open", source);
            return false;
        }
        int current;
        do {
            current = depth.get();
            if (current > maxQueueDepth) {
                coalescedTriggers.incrementAndGet();
                log.debug("Tail trigger from {} coalesced (depth {})", source, current);
                return false;
            }
        } while (!depth.compareAndSet(current, current + 1));

        try {
            executor.execute(() -> runOnce(source));
            return true;
        } catch (RejectedExecutionException e) {
            depth.decrementAndGet();
            log.warn("Tail trigger from {} rejected by executor: {}", source, e.getMessage());
            return false;
        }
    }

    private void runOnce(String source) {
        running.set(true);
        try {
            TailRunResult result = tailJob.run();
            log.debug("Tail run from {} finished: {} found, lastSeen {}", source, result.found(), result.lastSeen());
        } catch (RuntimeException e) {
            failedRuns.incrementAndGet();
            log.error("Tail run triggered by {} failed", source, e);
        } finally {
            running.set(false);
            depth.decrementAndGet();
        }
    }

    public boolean isOpen() {
        return open.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Pending plus running tail runs. */
    public int getDepth() {
        return depth.get();
    }

    public long getCoalescedTriggers() {
        return coalescedTriggers.get();
    }

    public long getFailedRuns() {
        return failedRuns.get();
    }
}
