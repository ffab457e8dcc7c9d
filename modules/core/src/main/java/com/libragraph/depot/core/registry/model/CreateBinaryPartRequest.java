package com.libragraph.depot.core.registry.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateBinaryPartRequest(
        @JsonProperty("index") int index,
        @JsonProperty("size") long size,
        @JsonProperty("hash") String hash,
        @JsonProperty("expected_binary_size") long expectedBinarySize) {
}
