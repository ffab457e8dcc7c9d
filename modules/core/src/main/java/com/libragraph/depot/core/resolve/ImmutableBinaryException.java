package com.libragraph.depot.core.resolve;

import com.libragraph.depot.core.IntegrityException;
import com.libragraph.depot.core.registry.model.Binary;

/**
 * A signed binary already occupies the slot but holds different content.
 */
public class ImmutableBinaryException extends IntegrityException {

    public ImmutableBinaryException(BinaryRequest request, Binary existing) {
        super("Binary " + existing.prn() + " for artifact version " + request.artifactVersionPrn()
                + " and target " + request.target() + " is signed with hash " + existing.hash()
                + " and size " + existing.size() + "; it cannot take hash " + request.hash()
                + " and size " + request.size());
    }
}
