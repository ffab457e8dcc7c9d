package com.libragraph.depot.core.registry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.depot.types.BinaryState;

import java.util.List;
import java.util.Map;

/**
 * A content-addressed artifact record. {@code hash} is lowercase hex SHA-256;
 * {@code hash} and {@code size} are frozen once the binary is {@link BinaryState#SIGNED}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Binary(
        @JsonProperty("prn") String prn,
        @JsonProperty("artifact_version_prn") String artifactVersionPrn,
        @JsonProperty("target") String target,
        @JsonProperty("size") Long size,
        @JsonProperty("hash") String hash,
        @JsonProperty("state") BinaryState state,
        @JsonProperty("description") String description,
        @JsonProperty("custom_metadata") Map<String, Object> customMetadata,
        @JsonProperty("signatures") List<BinarySignature> signatures) {

    public Binary {
        state = state == null ? BinaryState.UNRECOGNIZED : state;
        signatures = signatures == null ? List.of() : List.copyOf(signatures);
    }

    public Binary withState(BinaryState next) {
        return new Binary(prn, artifactVersionPrn, target, size, hash, next, description, customMetadata, signatures);
    }

    public boolean hasSignatureFor(String keyIdentifier) {
        return signatures.stream().anyMatch(s -> keyIdentifier.equals(s.keyId())
                || keyIdentifier.equals(s.signingKeyPrn()));
    }

    /**
     * Short description for log and error messages.
     */
    public String describe() {
        return "binary " + prn + " (target " + target + ", artifact version " + artifactVersionPrn + ")";
    }
}
