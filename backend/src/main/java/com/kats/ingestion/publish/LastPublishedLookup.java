package com.kats.ingestion.publish;

import java.util.OptionalLong;

/**
 * Reads the id of the most recently published transaction back from the broker.
 * Only used to bootstrap the tail checkpoint when none was ever stored.
 */
public interface LastPublishedLookup {

    OptionalLong lastPublishedId();
}
