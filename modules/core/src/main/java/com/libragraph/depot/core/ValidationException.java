package com.libragraph.depot.core;

/**
 * Input rejected before any network call: bad settings, missing content or flags,
 * unsupported API versions.
 */
public class ValidationException extends DepotException {

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ValidationException(String message) {
        super(message);
    }
}
