package com.libragraph.depot.core.registry.model;

/**
 * A named release. Two schemas exist: {@link LegacyBundle} groups artifact versions,
 * {@link BinaryBundle} lists binaries with per-binary custom metadata.
 */
public sealed interface Bundle permits LegacyBundle, BinaryBundle {

    String prn();

    String name();
}
