package com.kats.ingestion.checkpoint;

import java.util.Optional;

/**
 * Durable key/value storage for checkpoint blobs. Single writer; failures surface as
 * {@link CheckpointException} and are never retried here.
 */
public interface CheckpointStore {

    Optional<byte[]> get(String key);

    void put(String key, byte[] value);
}
