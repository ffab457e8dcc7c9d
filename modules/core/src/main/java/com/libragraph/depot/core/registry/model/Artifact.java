package com.libragraph.depot.core.registry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Artifact(
        @JsonProperty("prn") String prn,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description) {
}
