package com.libragraph.depot.core.registry;

import com.libragraph.depot.core.DepotException;

/**
 * A registry or storage call failed. Carries the HTTP status when one was received
 * ({@code 0} for transport failures) and the response body for diagnostics.
 */
public class RegistryException extends DepotException {

    private final int statusCode;
    private final String responseBody;

    public RegistryException(String message, int statusCode, String responseBody) {
        super(statusCode > 0 ? message + " (HTTP " + statusCode + ")" : message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.responseBody = null;
    }

    public int statusCode() {
        return statusCode;
    }

    public String responseBody() {
        return responseBody;
    }

    public boolean isConflict() {
        return statusCode == 409;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }
}
