package com.kats.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for checkpoint blobs keyed by checkpoint name.
 */
public interface CheckpointRepository extends MongoRepository<Checkpoint, String> {
}
