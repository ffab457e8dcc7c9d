package com.libragraph.depot.core.registry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ArtifactVersion(
        @JsonProperty("prn") String prn,
        @JsonProperty("artifact_prn") String artifactPrn,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description) {
}
