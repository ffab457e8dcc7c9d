package com.libragraph.depot.formats.archive;

import com.libragraph.depot.util.ContentHash;
import com.libragraph.depot.util.buffer.BinaryData;

/**
 * A named payload record of a bundle archive.
 */
public record ArchivePayload(String name, BinaryData content) {

    public long size() {
        return content.size();
    }

    public ContentHash hash() {
        return content.hash();
    }
}
