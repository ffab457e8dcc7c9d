package com.libragraph.depot.core.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.depot.core.registry.model.BinaryBundle;
import com.libragraph.depot.core.registry.model.Bundle;
import com.libragraph.depot.core.registry.model.BundleBinary;
import com.libragraph.depot.core.registry.model.LegacyBundle;

import java.util.List;

/**
 * Bundle as it appears on the wire. Which of the two lists is present decides the schema.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record BundleWire(
        @JsonProperty("prn") String prn,
        @JsonProperty("name") String name,
        @JsonProperty("hash") String hash,
        @JsonProperty("artifact_versions") List<String> artifactVersions,
        @JsonProperty("binaries") List<BundleBinary> binaries) {

    Bundle toBundle() {
        if (binaries != null) {
            return new BinaryBundle(prn, name, hash, binaries);
        }
        return new LegacyBundle(prn, name, artifactVersions);
    }
}
