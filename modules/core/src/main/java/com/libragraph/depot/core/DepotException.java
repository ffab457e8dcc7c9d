package com.libragraph.depot.core;

/**
 * Base class for failures of the ingestion pipeline and bundle operations.
 * Messages name the offending resource wherever it is known.
 */
public class DepotException extends RuntimeException {

    public DepotException(String message, Throwable cause) {
        super(message, cause);
    }

    public DepotException(String message) {
        super(message);
    }
}
