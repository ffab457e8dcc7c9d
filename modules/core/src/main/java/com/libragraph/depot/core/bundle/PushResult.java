package com.libragraph.depot.core.bundle;

import com.libragraph.depot.core.registry.model.Binary;
import com.libragraph.depot.core.registry.model.Bundle;

import java.util.List;

/**
 * The created bundle and its binaries in manifest order, as last seen by the pipeline.
 */
public record PushResult(Bundle bundle, List<Binary> binaries) {

    public PushResult {
        binaries = List.copyOf(binaries);
    }
}
