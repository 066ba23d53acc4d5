package com.kats.ingestion.checkpoint;

import com.kats.domain.Checkpoint;
import com.kats.domain.CheckpointRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;

/**
 * Checkpoints in the {@code checkpoints} Mongo collection, one document per key.
 */
@RequiredArgsConstructor
public class MongoCheckpointStore implements CheckpointStore {

    private final CheckpointRepository repository;

    @Override
    public Optional<byte[]> get(String key) {
        try {
            return repository.findById(key)
                    .map(Checkpoint::getValue)
                    .map(v -> v.getBytes(StandardCharsets.UTF_8));
        } catch (DataAccessException e) {
            throw new CheckpointException("Mongo read of checkpoint " + key + " failed", e);
        }
    }

    @Override
    public void put(String key, byte[] value) {
        Checkpoint checkpoint = new Checkpoint();
        checkpoint.setKey(key);
        checkpoint.setValue(new String(value, StandardCharsets.UTF_8));
        checkpoint.setUpdatedAt(Instant.now());
        try {
            repository.save(checkpoint);
        } catch (DataAccessException e) {
            throw new CheckpointException("Mongo write of checkpoint " + key + " failed", e);
        }
    }
}
