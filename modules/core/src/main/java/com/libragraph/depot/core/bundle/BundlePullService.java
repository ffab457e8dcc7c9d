package com.libragraph.depot.core.bundle;

import com.libragraph.depot.core.DepotException;
import com.libragraph.depot.core.IntegrityException;
import com.libragraph.depot.core.registry.RegistryClient;
import com.libragraph.depot.core.registry.ResourceNotFoundException;
import com.libragraph.depot.core.registry.model.Artifact;
import com.libragraph.depot.core.registry.model.ArtifactVersion;
import com.libragraph.depot.core.registry.model.Binary;
import com.libragraph.depot.core.registry.model.BinaryBundle;
import com.libragraph.depot.core.registry.model.Bundle;
import com.libragraph.depot.core.registry.model.BundleBinary;
import com.libragraph.depot.core.registry.model.LegacyBundle;
import com.libragraph.depot.core.transfer.ObjectTransfer;
import com.libragraph.depot.formats.archive.BundleArchiveWriter;
import com.libragraph.depot.formats.manifest.BundleManifest;
import com.libragraph.depot.formats.manifest.BundleManifest.ArtifactEntry;
import com.libragraph.depot.formats.manifest.BundleManifest.BinaryEntry;
import com.libragraph.depot.formats.manifest.BundleManifest.ManifestItem;
import com.libragraph.depot.formats.manifest.BundleManifest.SignatureEntry;
import com.libragraph.depot.formats.manifest.BundleManifest.VersionEntry;
import com.libragraph.depot.types.Prn;
import com.libragraph.depot.util.buffer.BinaryData;
import com.libragraph.depot.util.buffer.Buffer;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Downloads a published bundle into a local bundle archive.
 *
 * <p>Every payload is checked against the hash and size the registry reports for its binary.
 */
public class BundlePullService {

    private static final Logger log = Logger.getLogger(BundlePullService.class);

    static final String ARCHIVE_SUFFIX = ".cpio.zst";

    private final RegistryClient registry;
    private final ObjectTransfer transfer;
    private final BundleArchiveWriter writer;

    public BundlePullService(RegistryClient registry, ObjectTransfer transfer, BundleArchiveWriter writer) {
        this.registry = registry;
        this.transfer = transfer;
        this.writer = writer;
    }

    private record Member(Binary binary, Map<String, Object> customMetadata) {
    }

    /**
     * @return the archive written
     */
    public Path pull(String bundlePrn, PullOptions options) {
        Bundle bundle = registry.getBundle(bundlePrn)
                .orElseThrow(() -> new ResourceNotFoundException("Bundle", bundlePrn));
        List<Member> members = members(bundle);
        log.infof("Pulling bundle %s (%d binaries)", bundle.prn(), members.size());

        Map<String, ArtifactVersion> versions = new HashMap<>();
        Map<String, Artifact> artifacts = new HashMap<>();
        Map<String, ArtifactEntry> graph = new LinkedHashMap<>();
        List<ManifestItem> items = new ArrayList<>();
        List<BinaryData> payloads = new ArrayList<>();

        try {
            for (Member member : members) {
                Binary binary = member.binary();
                if (binary.hash() == null || binary.size() == null) {
                    throw new IntegrityException("Binary " + binary.prn() + " has no content yet");
                }
                ArtifactVersion version = versions.computeIfAbsent(binary.artifactVersionPrn(),
                        prn -> registry.getArtifactVersion(prn)
                                .orElseThrow(() -> new ResourceNotFoundException("Artifact version", prn)));
                Artifact artifact = artifacts.computeIfAbsent(version.artifactPrn(),
                        prn -> registry.getArtifact(prn)
                                .orElseThrow(() -> new ResourceNotFoundException("Artifact", prn)));

                String artifactId = Prn.parse(artifact.prn()).resourceId();
                String versionId = Prn.parse(version.prn()).resourceId();
                String binaryId = Prn.parse(binary.prn()).resourceId();

                List<SignatureEntry> signatures = binary.signatures().stream()
                        .map(s -> new SignatureEntry(s.keyIdentifier(), s.signature()))
                        .toList();
                graph.computeIfAbsent(artifactId, id -> new ArtifactEntry(artifact.name(), artifact.description(), null))
                        .versions()
                        .computeIfAbsent(versionId, id -> new VersionEntry(version.version(), version.description(), null))
                        .binaries()
                        .put(binaryId, new BinaryEntry(binary.description(), signatures));

                items.add(new ManifestItem(binary.hash().toLowerCase(Locale.ROOT), binary.size(), binaryId, binary.target(),
                        versionId, artifactId, member.customMetadata()));
                payloads.add(payload(binary, options.allowPlaceholders()));
            }

            String bundleHash = bundle instanceof BinaryBundle b ? b.hash() : null;
            BundleManifest manifest = new BundleManifest(graph, new BundleManifest.BundleEntry(
                    Prn.parse(bundle.prn()).resourceId(), bundle.name(), bundleHash, List.of(), items));

            Path output = options.output() != null ? options.output() : defaultOutput(bundle);
            writer.write(output, manifest, payloads);
            log.infof("Pulled bundle %s into %s", bundle.prn(), output);
            return output;
        } finally {
            payloads.forEach(BundlePullService::closeQuietly);
        }
    }

    private List<Member> members(Bundle bundle) {
        List<Member> members = new ArrayList<>();
        if (bundle instanceof BinaryBundle binaryBundle) {
            for (BundleBinary entry : binaryBundle.binaries()) {
                Binary binary = registry.getBinary(entry.binaryPrn())
                        .orElseThrow(() -> new ResourceNotFoundException("Binary", entry.binaryPrn()));
                members.add(new Member(binary, entry.customMetadata()));
            }
        } else {
            for (String versionPrn : ((LegacyBundle) bundle).artifactVersionPrns()) {
                registry.findBinaries(versionPrn, null)
                        .forEach(binary -> members.add(new Member(binary, binary.customMetadata())));
            }
        }
        return members;
    }

    private BinaryData payload(Binary binary, boolean allowPlaceholders) {
        long size = binary.size();
        Optional<URI> url = registry.binaryDownloadUrl(binary.prn());
        if (url.isEmpty()) {
            if (!allowPlaceholders) {
                throw new DepotException("Registry offers no download for binary " + binary.prn()
                        + "; allow placeholders to write zero-filled content instead");
            }
            log.warnf("No download for binary %s, writing %d zero bytes as a placeholder", binary.prn(), size);
            return zeros(size);
        }

        Buffer content = transfer.download(url.get(), size);
        if (!content.hash().matchesHex(binary.hash())) {
            String actual = content.hash().toHex();
            closeQuietly(content);
            throw new IntegrityException("Downloaded content of binary " + binary.prn() + " has hash "
                    + actual + ", expected " + binary.hash());
        }
        return content;
    }

    private static Buffer zeros(long size) {
        Buffer buffer = Buffer.allocate(size);
        byte[] block = new byte[8192];
        try {
            long remaining = size;
            while (remaining > 0) {
                int n = (int) Math.min(block.length, remaining);
                buffer.write(ByteBuffer.wrap(block, 0, n));
                remaining -= n;
            }
            buffer.position(0);
        } catch (IOException e) {
            closeQuietly(buffer);
            throw new DepotException("Failed to create placeholder of " + size + " bytes", e);
        }
        return buffer;
    }

    static Path defaultOutput(Bundle bundle) {
        String base = bundle.name() != null && !bundle.name().isBlank() ? bundle.name() : bundle.prn();
        return Path.of(base.replaceAll("[^A-Za-z0-9._-]", "_") + ARCHIVE_SUFFIX);
    }

    private static void closeQuietly(BinaryData data) {
        try {
            data.close();
        } catch (IOException e) {
            log.debugf("Failed to release payload buffer: %s", e.getMessage());
        }
    }
}
