package com.libragraph.depot.formats.archive;

/**
 * A bundle archive could not be written, read or matched against its manifest.
 */
public class ArchiveException extends RuntimeException {

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }

    public ArchiveException(String message) {
        super(message);
    }
}
