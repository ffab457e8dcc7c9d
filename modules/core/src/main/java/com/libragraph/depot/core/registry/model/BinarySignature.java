package com.libragraph.depot.core.registry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BinarySignature(
        @JsonProperty("prn") String prn,
        @JsonProperty("binary_prn") String binaryPrn,
        @JsonProperty("signing_key_prn") String signingKeyPrn,
        @JsonProperty("keyid") String keyId,
        @JsonProperty("signature") String signature) {

    /** The key id when the registry reports one, else the signing key PRN. */
    public String keyIdentifier() {
        return keyId != null ? keyId : signingKeyPrn;
    }
}
