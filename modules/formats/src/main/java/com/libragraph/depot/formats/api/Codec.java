package com.libragraph.depot.formats.api;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;

/**
 * Interface for codecs that handle transport-level transformations of archive files.
 *
 * Codecs are bidirectional stream wrappers.
 */
public interface Codec {
    /**
     * Wraps a stream of encoded bytes. Closing the returned stream closes {@code in}.
     */
    InputStream decodingStream(InputStream in) throws IOException;

    /**
     * Wraps a sink so that everything written to it is encoded. Closing the returned
     * stream finishes the encoding and closes {@code out}.
     */
    OutputStream encodingStream(OutputStream out, Map<String, Object> parameters) throws IOException;

    /**
     * Returns the default encoding parameters for this codec.
     */
    Map<String, Object> getEncodingParameters();
}
