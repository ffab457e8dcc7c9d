package com.libragraph.depot.core;

/**
 * Local content disagrees with what the registry or an archive declares.
 */
public class IntegrityException extends DepotException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
