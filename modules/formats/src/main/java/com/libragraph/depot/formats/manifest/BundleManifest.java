package com.libragraph.depot.formats.manifest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code bundle.json} record of a bundle archive.
 *
 * <p>{@code artifacts} describes the resource graph (artifact → version → binary, keyed by
 * resource id); {@code bundle.manifest} lists the binary payloads in archive order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BundleManifest(
        @JsonProperty("artifacts") Map<String, ArtifactEntry> artifacts,
        @JsonProperty("bundle") BundleEntry bundle) {

    public BundleManifest {
        artifacts = artifacts == null ? new LinkedHashMap<>() : artifacts;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ArtifactEntry(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("versions") Map<String, VersionEntry> versions) {

        public ArtifactEntry {
            versions = versions == null ? new LinkedHashMap<>() : versions;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VersionEntry(
            @JsonProperty("version") String version,
            @JsonProperty("description") String description,
            @JsonProperty("binaries") Map<String, BinaryEntry> binaries) {

        public VersionEntry {
            binaries = binaries == null ? new LinkedHashMap<>() : binaries;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BinaryEntry(
            @JsonProperty("description") String description,
            @JsonProperty("signatures") List<SignatureEntry> signatures) {

        public BinaryEntry {
            signatures = signatures == null ? List.of() : List.copyOf(signatures);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SignatureEntry(
            @JsonProperty("keyid") String keyId,
            @JsonProperty("sig") String signature) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BundleEntry(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("hash") @JsonInclude(JsonInclude.Include.NON_NULL) String hash,
            @JsonProperty("signatures") List<SignatureEntry> signatures,
            @JsonProperty("manifest") List<ManifestItem> manifest) {

        public BundleEntry {
            signatures = signatures == null ? List.of() : List.copyOf(signatures);
            manifest = manifest == null ? List.of() : List.copyOf(manifest);
        }
    }

    /**
     * One binary payload of the archive, in payload order.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ManifestItem(
            @JsonProperty("hash") String hash,
            @JsonProperty("size") long size,
            @JsonProperty("binary_id") String binaryId,
            @JsonProperty("target") String target,
            @JsonProperty("artifact_version_id") String artifactVersionId,
            @JsonProperty("artifact_id") String artifactId,
            @JsonProperty("custom_metadata") Map<String, Object> customMetadata) {
    }

    /**
     * Looks up the binary entry for a manifest item through its artifact and version.
     *
     * @return the entry, or null when the graph does not describe the binary
     */
    public BinaryEntry binaryEntry(ManifestItem item) {
        ArtifactEntry artifact = artifacts.get(item.artifactId());
        if (artifact == null) return null;
        VersionEntry version = artifact.versions().get(item.artifactVersionId());
        if (version == null) return null;
        return version.binaries().get(item.binaryId());
    }
}
