package com.kats.ingestion.status;

import com.kats.domain.BackfillState;
import com.kats.domain.TailState;
import com.kats.ingestion.checkpoint.CheckpointService;
import com.kats.ingestion.job.tail.TailDispatcher;
import com.kats.ingestion.push.KristPushListener;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Read-only sync status for the API: stored checkpoints plus live dispatcher counters.
 * Also forwards manual refresh requests to the dispatcher.
 */
@Service
@RequiredArgsConstructor
public class SyncStatusService {

    private final CheckpointService checkpointService;
    private final TailDispatcher tailDispatcher;
    private final KristPushListener pushListener;

    public SyncStatusSnapshot getStatus() {
        BackfillState backfill = checkpointService.findBackfillState();
        Long lastSeen = checkpointService.findTailState().map(TailState::lastSeen).orElse(null);
        return new SyncStatusSnapshot(
                backfill.done(),
                backfill.offset(),
                lastSeen,
                tailDispatcher.isOpen(),
                tailDispatcher.isRunning(),
                tailDispatcher.getDepth(),
                tailDispatcher.getCoalescedTriggers(),
                tailDispatcher.getFailedRuns(),
                pushListener.isActive());
    }

    /**
     * @return true if a tail run was scheduled
     */
    public boolean requestRefresh() {
        return tailDispatcher.trigger("api");
    }
}
