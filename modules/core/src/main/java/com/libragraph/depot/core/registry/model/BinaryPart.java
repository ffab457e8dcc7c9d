package com.libragraph.depot.core.registry.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.depot.types.PartState;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BinaryPart(
        @JsonProperty("binary_prn") String binaryPrn,
        @JsonProperty("index") int index,
        @JsonProperty("size") long size,
        @JsonProperty("hash") String hash,
        @JsonProperty("presigned_upload_url") String presignedUploadUrl,
        @JsonProperty("state") PartState state) {

    public BinaryPart {
        state = state == null ? PartState.UNRECOGNIZED : state;
    }

    @JsonIgnore
    public boolean isValid() {
        return state == PartState.VALID;
    }
}
