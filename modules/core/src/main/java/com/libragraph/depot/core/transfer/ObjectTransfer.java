package com.libragraph.depot.core.transfer;

import com.libragraph.depot.util.ContentHash;
import com.libragraph.depot.util.buffer.Buffer;

import java.net.URI;

/**
 * Moves raw bytes to and from pre-signed object storage URLs.
 */
public interface ObjectTransfer {

    /**
     * Uploads one part. The storage service verifies {@code hash} against the body.
     *
     * @throws com.libragraph.depot.core.registry.RegistryException on a non-2xx response
     */
    void put(URI url, byte[] body, ContentHash hash);

    /**
     * Downloads an object into a buffer positioned at 0.
     *
     * @param expectedSize exact size the object must have
     * @throws com.libragraph.depot.core.IntegrityException when the object is shorter or longer
     */
    Buffer download(URI url, long expectedSize);
}
