package com.kats.ingestion.status;

/**
 * Point-in-time view of sync progress. {@code lastSeen} is null until the first tail checkpoint is written.
 */
public record SyncStatusSnapshot(
        boolean backfillDone,
        long backfillOffset,
        Long lastSeen,
        boolean tailOpen,
        boolean tailRunning,
        int tailDepth,
        long coalescedTriggers,
        long failedTailRuns,
        boolean pushActive
) {
}
