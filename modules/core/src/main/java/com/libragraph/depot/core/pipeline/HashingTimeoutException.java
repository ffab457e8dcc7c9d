package com.libragraph.depot.core.pipeline;

import com.libragraph.depot.core.DepotException;

/**
 * The registry did not finish hashing a binary within the polling budget.
 */
public class HashingTimeoutException extends DepotException {

    public HashingTimeoutException(String binaryPrn, int attempts) {
        super("Binary " + binaryPrn + " did not become signable after " + attempts + " attempts");
    }
}
