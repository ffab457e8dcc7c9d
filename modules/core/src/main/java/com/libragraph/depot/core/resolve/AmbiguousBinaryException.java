package com.libragraph.depot.core.resolve;

import com.libragraph.depot.core.IntegrityException;

import java.util.List;

/**
 * More than one binary matches an artifact version and target.
 */
public class AmbiguousBinaryException extends IntegrityException {

    public AmbiguousBinaryException(String artifactVersionPrn, String target, List<String> binaryPrns) {
        super("Found " + binaryPrns.size() + " binaries for artifact version " + artifactVersionPrn
                + " and target " + target + ": " + String.join(", ", binaryPrns));
    }
}
