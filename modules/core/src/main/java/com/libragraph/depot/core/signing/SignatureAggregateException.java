package com.libragraph.depot.core.signing;

import com.libragraph.depot.core.DepotException;

import java.util.List;

/**
 * One or more signatures could not be created. The individual failures are attached as
 * suppressed exceptions.
 */
public class SignatureAggregateException extends DepotException {

    private final List<String> failedKeyIds;

    public SignatureAggregateException(String binaryPrn, List<String> failedKeyIds, List<? extends Throwable> causes) {
        super("Failed to create signatures for binary " + binaryPrn
                + " (failed keyids: " + String.join(", ", failedKeyIds) + ")");
        this.failedKeyIds = List.copyOf(failedKeyIds);
        causes.forEach(this::addSuppressed);
    }

    public List<String> failedKeyIds() {
        return failedKeyIds;
    }
}
