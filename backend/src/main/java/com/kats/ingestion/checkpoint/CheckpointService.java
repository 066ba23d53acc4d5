package com.kats.ingestion.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kats.domain.BackfillState;
import com.kats.domain.MalformedRecordException;
import com.kats.domain.TailState;
import com.kats.ingestion.publish.LastPublishedLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Typed access to the two checkpoints: backfill progress ({@value #BACKFILL_KEY}) and the last
 * published transaction id ({@value #TAIL_KEY}). Blobs are JSON and validated on read.
 */
@Service
@Slf4j
public class CheckpointService {

    public static final String BACKFILL_KEY = "catchup_state";
    public static final String TAIL_KEY = "latest_state";

    private final CheckpointStore store;
    private final LastPublishedLookup lastPublishedLookup;
    private final ObjectMapper objectMapper;

    /** Last backfill state read or written by this process; guards offset monotonicity. */
    private volatile BackfillState lastBackfillState;

    public CheckpointService(CheckpointStore store, LastPublishedLookup lastPublishedLookup, ObjectMapper objectMapper) {
        this.store = store;
        this.lastPublishedLookup = lastPublishedLookup;
        this.objectMapper = objectMapper;
    }

    /**
     * Stored backfill progress, or {@link BackfillState#INITIAL} when none was ever written.
     */
    public BackfillState loadBackfillState() {
        BackfillState state = findBackfillState();
        lastBackfillState = state;
        return state;
    }

    /**
     * Read-only variant of {@link #loadBackfillState()} for status reporting.
     */
    public BackfillState findBackfillState() {
        return store.get(BACKFILL_KEY)
                .map(bytes -> decode(BACKFILL_KEY, bytes, BackfillState.class))
                .orElse(BackfillState.INITIAL);
    }

    public void saveBackfillState(BackfillState state) {
        BackfillState previous = lastBackfillState;
        if (previous != null) {
            if (state.offset() < previous.offset()) {
                throw new IllegalStateException("Backfill offset would move back from "
                        + previous.offset() + " to " + state.offset());
            }
            if (previous.done() && !state.done()) {
                throw new IllegalStateException("Completed backfill cannot be reopened");
            }
        }
        store.put(BACKFILL_KEY, encode(BACKFILL_KEY, state));
        lastBackfillState = state;
    }

    /**
     * Stored tail checkpoint. When absent, derives {@code lastSeen} from the last message on the broker
     * stream (0 if the stream is empty). The derived value is not written back.
     */
    public TailState loadTailState() {
        Optional<byte[]> stored = store.get(TAIL_KEY);
        if (stored.isPresent()) {
            return decode(TAIL_KEY, stored.get(), TailState.class);
        }
        OptionalLong lastPublished = lastPublishedLookup.lastPublishedId();
        if (lastPublished.isEmpty()) {
            log.warn("No {} checkpoint and no published transactions; tailing from id 0", TAIL_KEY);
            return new TailState(0);
        }
        log.info("No {} checkpoint; bootstrapped lastSeen={} from broker", TAIL_KEY, lastPublished.getAsLong());
        return new TailState(lastPublished.getAsLong());
    }

    public void saveTailState(TailState state) {
        store.put(TAIL_KEY, encode(TAIL_KEY, state));
    }

    /**
     * Raw view for status reporting: never bootstraps from the broker.
     */
    public Optional<TailState> findTailState() {
        return store.get(TAIL_KEY).map(bytes -> decode(TAIL_KEY, bytes, TailState.class));
    }

    private <T> T decode(String key, byte[] bytes, Class<T> type) {
        T value;
        try {
            value = objectMapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new MalformedRecordException("Checkpoint " + key + " is not a valid " + type.getSimpleName(), e);
        }
        if (value == null) {
            throw new MalformedRecordException("Checkpoint " + key + " is null");
        }
        return value;
    }

    private byte[] encode(String key, Object state) {
        try {
            return objectMapper.writeValueAsBytes(state);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Cannot encode checkpoint " + key, e);
        }
    }
}
