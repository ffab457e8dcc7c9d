package com.libragraph.depot.core.registry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.depot.types.BinaryState;

/**
 * Partial update of a binary; null fields are left unchanged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateBinaryRequest(
        @JsonProperty("state") BinaryState state,
        @JsonProperty("hash") String hash,
        @JsonProperty("size") Long size) {

    public static UpdateBinaryRequest state(BinaryState state) {
        return new UpdateBinaryRequest(state, null, null);
    }

    public static UpdateBinaryRequest content(String hash, long size) {
        return new UpdateBinaryRequest(null, hash, size);
    }
}
