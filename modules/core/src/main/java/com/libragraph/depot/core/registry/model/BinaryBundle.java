package com.libragraph.depot.core.registry.model;

import java.util.List;

/**
 * API version 2 bundle: an ordered list of binaries.
 */
public record BinaryBundle(String prn, String name, String hash, List<BundleBinary> binaries) implements Bundle {

    public BinaryBundle {
        binaries = binaries == null ? List.of() : List.copyOf(binaries);
    }
}
