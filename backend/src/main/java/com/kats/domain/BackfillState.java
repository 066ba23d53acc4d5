package com.kats.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Backfill progress. {@code done} means the historical walk reached the end of the ledger at least once;
 * {@code offset} is the start of the next page to fetch.
 */
public record BackfillState(boolean done, long offset) {

    public static final BackfillState INITIAL = new BackfillState(false, 0);

    @JsonCreator
    public BackfillState(@JsonProperty(value = "done", required = true) boolean done,
                         @JsonProperty(value = "offset", required = true) long offset) {
        if (offset < 0) {
            throw new MalformedRecordException("Backfill offset must be >= 0, got " + offset);
        }
        this.done = done;
        this.offset = offset;
    }

    public BackfillState advance(int count) {
        return new BackfillState(false, offset + count);
    }

    public BackfillState complete() {
        return new BackfillState(true, offset);
    }
}
