package com.kats.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single Krist ledger transaction as returned by the ledger API. Immutable; ordered strictly by {@code id}.
 * Serialized with the ledger's own field names so broker payloads keep the upstream JSON shape.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public record KristTransaction(
        @JsonProperty("id") long id,
        @JsonProperty("from") String from,
        @JsonProperty("to") String to,
        @JsonProperty("value") long value,
        @JsonProperty("time") String time,
        @JsonProperty("name") String name,
        @JsonProperty("metadata") String metadata,
        @JsonProperty("sent_metaname") String sentMetaname,
        @JsonProperty("sent_name") String sentName,
        @JsonProperty("type") String type
) {

    /**
     * Boundary check for records decoded from the ledger. Rejects ids that cannot be ordered and
     * transactions without a recipient.
     */
    public KristTransaction validate() {
        if (id <= 0) {
            throw new MalformedRecordException("Transaction id must be positive, got " + id);
        }
        if (to == null || to.isBlank()) {
            throw new MalformedRecordException("Transaction " + id + " has no recipient");
        }
        return this;
    }
}
