package com.libragraph.depot.core.registry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateBinaryRequest(
        @JsonProperty("artifact_version_prn") String artifactVersionPrn,
        @JsonProperty("id") String id,
        @JsonProperty("target") String target,
        @JsonProperty("hash") String hash,
        @JsonProperty("size") long size,
        @JsonProperty("description") String description,
        @JsonProperty("custom_metadata") @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> customMetadata) {
}
