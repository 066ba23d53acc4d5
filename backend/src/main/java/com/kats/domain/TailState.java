package com.kats.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Highest transaction id known to have been published to the broker.
 */
public record TailState(long lastSeen) {

    @JsonCreator
    public TailState(@JsonProperty(value = "lastSeen", required = true) long lastSeen) {
        if (lastSeen < 0) {
            throw new MalformedRecordException("lastSeen must be >= 0, got " + lastSeen);
        }
        this.lastSeen = lastSeen;
    }
}
