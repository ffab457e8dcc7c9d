package com.libragraph.depot.core.signing;

import java.nio.file.Path;

/**
 * Produces a raw signature over a message with a private key stored on disk.
 */
public interface BinarySigner {

    byte[] sign(Path privateKeyPath, byte[] message);

    /**
     * Fails with a {@link com.libragraph.depot.core.ValidationException} when the key cannot be used.
     */
    default void checkKey(Path privateKeyPath) {
        sign(privateKeyPath, new byte[0]);
    }
}
