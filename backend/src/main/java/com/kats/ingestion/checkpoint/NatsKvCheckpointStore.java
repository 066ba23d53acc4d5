package com.kats.ingestion.checkpoint;

import io.nats.client.JetStreamApiException;
import io.nats.client.KeyValue;
import io.nats.client.api.KeyValueEntry;
import lombok.RequiredArgsConstructor;

import java.io.IOException;
import java.util.Optional;

/**
 * Checkpoints in a JetStream key-value bucket.
 */
@RequiredArgsConstructor
public class NatsKvCheckpointStore implements CheckpointStore {

    private final KeyValue keyValue;

    @Override
    public Optional<byte[]> get(String key) {
        try {
            KeyValueEntry entry = keyValue.get(key);
            if (entry == null || entry.getValue() == null) {
                return Optional.empty();
            }
            return Optional.of(entry.getValue());
        } catch (IOException | JetStreamApiException e) {
            throw new CheckpointException("KV get " + key + " failed", e);
        }
    }

    @Override
    public void put(String key, byte[] value) {
        try {
            keyValue.put(key, value);
        } catch (IOException | JetStreamApiException e) {
            throw new CheckpointException("KV put " + key + " failed", e);
        }
    }
}
