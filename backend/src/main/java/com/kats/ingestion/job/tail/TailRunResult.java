package com.kats.ingestion.job.tail;

/**
 * Outcome of one tail run: transactions newer than the checkpoint, how many were forwarded
 * (the rest were reserved), and the checkpoint after the run.
 */
public record TailRunResult(int found, int published, long lastSeen) {

    public static TailRunResult nothingNew(long lastSeen) {
        return new TailRunResult(0, 0, lastSeen);
    }
}
