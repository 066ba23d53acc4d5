package com.kats.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One checkpoint blob keyed by name (catchup_state, latest_state). Used by the Mongo checkpoint store.
 */
@Document(collection = "checkpoints")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Checkpoint {

    @Id
    @EqualsAndHashCode.Include
    private String key;
    /** JSON blob exactly as written by CheckpointService. */
    private String value;
    private Instant updatedAt;
}
