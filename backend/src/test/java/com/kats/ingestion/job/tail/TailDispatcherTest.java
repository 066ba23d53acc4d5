package com.kats.ingestion.job.tail;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TailDispatcherTest {

    @Mock
    private LedgerTailJob tailJob;

    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void closedDispatcher_ignoresTriggers() {
        TailDispatcher dispatcher = new TailDispatcher(tailJob, Runnable::run, 1);

        assertThat(dispatcher.trigger("timer")).isFalse();

        verify(tailJob, never()).run();
        assertThat(dispatcher.isOpen()).isFalse();
    }

    @Test
    void burstWhileRunning_leavesOneQueuedRun() throws Exception {
        executor = Executors.newSingleThreadExecutor();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(tailJob.run()).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return TailRunResult.nothingNew(0);
        });
        TailDispatcher dispatcher = new TailDispatcher(tailJob, executor, 1);
        dispatcher.open();

        assertThat(dispatcher.trigger("startup")).isTrue();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(dispatcher.trigger("push")).isTrue();
        for (int i = 0; i < 8; i++) {
            assertThat(dispatcher.trigger("timer")).isFalse();
        }
        assertThat(dispatcher.getDepth()).isEqualTo(2);
        assertThat(dispatcher.getCoalescedTriggers()).isEqualTo(8);

        release.countDown();

        verify(tailJob, timeout(5_000).times(2)).run();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        verify(tailJob, times(2)).run();
        assertThat(dispatcher.getDepth()).isZero();
        assertThat(dispatcher.isRunning()).isFalse();
    }

    @Test
    void failedRun_doesNotBlockLaterTriggers() {
        when(tailJob.run())
                .thenThrow(new IllegalStateException("ledger down"))
                .thenReturn(TailRunResult.nothingNew(7));
        TailDispatcher dispatcher = new TailDispatcher(tailJob, Runnable::run, 1);
        dispatcher.open();

        assertThat(dispatcher.trigger("timer")).isTrue();
        assertThat(dispatcher.getFailedRuns()).isEqualTo(1);
        assertThat(dispatcher.trigger("timer")).isTrue();

        verify(tailJob, times(2)).run();
        assertThat(dispatcher.getDepth()).isZero();
    }

    @Test
    void closeAfterOpen_stopsAcceptingTriggers() {
        TailDispatcher dispatcher = new TailDispatcher(tailJob, Runnable::run, 1);
        when(tailJob.run()).thenReturn(TailRunResult.nothingNew(0));
        dispatcher.open();
        dispatcher.trigger("startup");

        dispatcher.close();

        assertThat(dispatcher.trigger("push")).isFalse();
        verify(tailJob, times(1)).run();
    }
}
