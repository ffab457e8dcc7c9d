package com.libragraph.depot.core.bundle;

import java.nio.file.Path;

/**
 * @param output            archive to write, or null for a name derived from the bundle
 * @param allowPlaceholders write zero-filled payloads for binaries the registry offers no download for
 */
public record PullOptions(Path output, boolean allowPlaceholders) {

    public static PullOptions defaults() {
        return new PullOptions(null, false);
    }
}
