package com.libragraph.depot.core.registry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.depot.core.ValidationException;

import java.util.List;

/**
 * Bundle creation parameters in either schema. {@link #forApiVersion} picks the schema.
 */
public sealed interface CreateBundleRequest {

    int LEGACY_API_VERSION = 1;
    int CURRENT_API_VERSION = 2;

    String id();

    String name();

    /**
     * @throws ValidationException for API versions other than 1 and 2
     */
    static void checkApiVersion(int apiVersion) {
        if (apiVersion != LEGACY_API_VERSION && apiVersion != CURRENT_API_VERSION) {
            throw new ValidationException("Unsupported bundle API version " + apiVersion
                    + " (supported: " + LEGACY_API_VERSION + ", " + CURRENT_API_VERSION + ")");
        }
    }

    /**
     * @param binaries            bundle contents, used by version 2
     * @param artifactVersionPrns bundle contents, used by version 1
     */
    static CreateBundleRequest forApiVersion(int apiVersion, String id, String name,
                                             List<BundleBinary> binaries, List<String> artifactVersionPrns) {
        checkApiVersion(apiVersion);
        if (apiVersion == LEGACY_API_VERSION) {
            return new Legacy(id, name, artifactVersionPrns);
        }
        return new Current(id, name, binaries);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Legacy(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("artifact_versions") List<String> artifactVersionPrns) implements CreateBundleRequest {

        public Legacy {
            artifactVersionPrns = List.copyOf(artifactVersionPrns);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Current(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("binaries") List<BundleBinary> binaries) implements CreateBundleRequest {

        public Current {
            binaries = List.copyOf(binaries);
        }
    }
}
