package com.libragraph.depot.core.registry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A binary reference inside a bundle. Empty custom metadata is left off the wire.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BundleBinary(
        @JsonProperty("prn") String binaryPrn,
        @JsonProperty("custom_metadata") @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> customMetadata) {

    public BundleBinary {
        customMetadata = customMetadata == null || customMetadata.isEmpty() ? null : customMetadata;
    }
}
