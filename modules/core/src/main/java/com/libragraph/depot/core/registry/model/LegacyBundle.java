package com.libragraph.depot.core.registry.model;

import java.util.List;

/**
 * API version 1 bundle: a list of artifact versions.
 */
public record LegacyBundle(String prn, String name, List<String> artifactVersionPrns) implements Bundle {

    public LegacyBundle {
        artifactVersionPrns = artifactVersionPrns == null ? List.of() : List.copyOf(artifactVersionPrns);
    }
}
