package com.libragraph.depot.core.resolve;

import java.util.Map;

/**
 * What a binary should look like: where it belongs and which content it holds.
 *
 * @param binaryId    resource UUID to use for a deterministic PRN, or null to let the registry pick one
 * @param hash        lowercase hex SHA-256 of the content
 */
public record BinaryRequest(String artifactVersionPrn, String target, String hash, long size,
                            String binaryId, String description, Map<String, Object> customMetadata) {

    public static BinaryRequest of(String artifactVersionPrn, String target, String hash, long size) {
        return new BinaryRequest(artifactVersionPrn, target, hash, size, null, null, null);
    }
}
