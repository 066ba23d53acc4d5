package com.kats.api.dto;

import com.kats.ingestion.status.SyncStatusSnapshot;

/**
 * GET /api/v1/sync/status body.
 */
public record SyncStatusResponse(
        BackfillStatus backfill,
        TailStatus tail
) {

    public record BackfillStatus(boolean done, long offset) {
    }

    public record TailStatus(Long lastSeen, boolean open, boolean running, int depth,
                             long coalescedTriggers, long failedRuns, boolean pushActive) {
    }

    public static SyncStatusResponse from(SyncStatusSnapshot s) {
        return new SyncStatusResponse(
                new BackfillStatus(s.backfillDone(), s.backfillOffset()),
                new TailStatus(s.lastSeen(), s.tailOpen(), s.tailRunning(), s.tailDepth(),
                        s.coalescedTriggers(), s.failedTailRuns(), s.pushActive()));
    }
}
