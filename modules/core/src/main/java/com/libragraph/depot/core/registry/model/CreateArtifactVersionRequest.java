package com.libragraph.depot.core.registry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateArtifactVersionRequest(
        @JsonProperty("artifact_prn") String artifactPrn,
        @JsonProperty("id") String id,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description) {
}
