package com.libragraph.depot.core.registry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A signature submission. Computed signatures name the signing key by PRN;
 * pre-computed ones by key id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateSignatureRequest(
        @JsonProperty("binary_prn") String binaryPrn,
        @JsonProperty("signature") String signature,
        @JsonProperty("signing_key_prn") String signingKeyPrn,
        @JsonProperty("signing_key_keyid") String signingKeyKeyId) {

    public static CreateSignatureRequest withSigningKey(String binaryPrn, String signingKeyPrn, String signature) {
        return new CreateSignatureRequest(binaryPrn, signature, signingKeyPrn, null);
    }

    public static CreateSignatureRequest withKeyId(String binaryPrn, String keyId, String signature) {
        return new CreateSignatureRequest(binaryPrn, signature, null, keyId);
    }
}
