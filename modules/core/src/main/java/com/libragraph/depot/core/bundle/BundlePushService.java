package com.libragraph.depot.core.bundle;

import com.libragraph.depot.core.DepotException;
import com.libragraph.depot.core.pipeline.BinaryProcessor;
import com.libragraph.depot.core.registry.RegistryClient;
import com.libragraph.depot.core.registry.model.Artifact;
import com.libragraph.depot.core.registry.model.ArtifactVersion;
import com.libragraph.depot.core.registry.model.Binary;
import com.libragraph.depot.core.registry.model.Bundle;
import com.libragraph.depot.core.registry.model.BundleBinary;
import com.libragraph.depot.core.registry.model.CreateBundleRequest;
import com.libragraph.depot.core.resolve.BinaryRequest;
import com.libragraph.depot.core.resolve.ResourceResolver;
import com.libragraph.depot.core.signing.SignatureConfig;
import com.libragraph.depot.formats.archive.ArchivePayload;
import com.libragraph.depot.formats.archive.BundleArchive;
import com.libragraph.depot.formats.archive.BundleArchiveReader;
import com.libragraph.depot.formats.archive.PayloadMatcher;
import com.libragraph.depot.formats.manifest.BundleManifest;
import com.libragraph.depot.formats.manifest.BundleManifest.ManifestItem;
import com.libragraph.depot.types.PrnException;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Publishes a bundle archive: creates the artifacts, versions and binaries it describes,
 * uploads and signs every payload, then creates the bundle.
 *
 * <p>The archive is validated locally before the first registry call. Failing to create an
 * artifact or version is logged and skipped; any failing binary aborts the push.
 */
public class BundlePushService {

    private static final Logger log = Logger.getLogger(BundlePushService.class);

    private final RegistryClient registry;
    private final ResourceResolver resolver;
    private final BinaryProcessor processor;
    private final BundleArchiveReader reader;

    public BundlePushService(RegistryClient registry, ResourceResolver resolver,
                             BinaryProcessor processor, BundleArchiveReader reader) {
        this.registry = registry;
        this.resolver = resolver;
        this.processor = processor;
        this.reader = reader;
    }

    public PushResult push(Path archivePath, PushOptions options) {
        CreateBundleRequest.checkApiVersion(options.apiVersion());
        log.infof("Opening bundle archive %s", archivePath);

        try (BundleArchive archive = reader.read(archivePath)) {
            BundleManifest manifest = archive.manifest();
            List<PayloadMatcher.Match> matches = new PayloadMatcher(options.payloadMatching())
                    .match(manifest.bundle().manifest(), archive.payloads());

            String organizationPrn = registry.currentUser().organizationPrn();
            Map<String, String> versionPrns = createArtifactsAndVersions(manifest, organizationPrn);

            List<Binary> binaries = new ArrayList<>();
            List<BundleBinary> bundleBinaries = new ArrayList<>();
            Set<String> bundleVersions = new LinkedHashSet<>();
            for (PayloadMatcher.Match match : matches) {
                Binary binary = pushBinary(manifest, match, versionPrns);
                binaries.add(binary);
                bundleBinaries.add(new BundleBinary(binary.prn(), match.item().customMetadata()));
                bundleVersions.add(binary.artifactVersionPrn());
            }

            BundleManifest.BundleEntry entry = manifest.bundle();
            Bundle bundle = registry.createBundle(CreateBundleRequest.forApiVersion(options.apiVersion(),
                    entry.id(), entry.name(), bundleBinaries, new ArrayList<>(bundleVersions)));
            log.infof("Pushed bundle %s with %d binaries", bundle.prn(), binaries.size());
            return new PushResult(bundle, binaries);
        }
    }

    /**
     * @return artifact version PRN by manifest version id, for every version that could be created
     */
    private Map<String, String> createArtifactsAndVersions(BundleManifest manifest, String organizationPrn) {
        Map<String, String> versionPrns = new HashMap<>();
        manifest.artifacts().forEach((artifactId, artifactEntry) -> {
            Artifact artifact;
            try {
                artifact = resolver.getOrCreateArtifact(organizationPrn, artifactId,
                        artifactEntry.name(), artifactEntry.description());
            } catch (DepotException | PrnException e) {
                log.errorf("Skipping artifact %s (%s): %s", artifactId, artifactEntry.name(), e.getMessage());
                return;
            }
            artifactEntry.versions().forEach((versionId, versionEntry) -> {
                try {
                    ArtifactVersion version = resolver.getOrCreateArtifactVersion(artifact.prn(), versionId,
                            versionEntry.version(), versionEntry.description());
                    versionPrns.put(versionId, version.prn());
                } catch (DepotException | PrnException e) {
                    log.errorf("Skipping version %s of artifact %s: %s", versionEntry.version(), artifactEntry.name(), e.getMessage());
                }
            });
        });
        return versionPrns;
    }

    private Binary pushBinary(BundleManifest manifest, PayloadMatcher.Match match, Map<String, String> versionPrns) {
        ManifestItem item = match.item();
        ArchivePayload payload = match.payload();
        String versionPrn = versionPrns.get(item.artifactVersionId());
        if (versionPrn == null) {
            throw new DepotException("Artifact version " + item.artifactVersionId() + " of binary "
                    + item.binaryId() + " (target " + item.target() + ") is not available");
        }

        String hash = payload.hash().toHex();
        long size = payload.size();
        if (!payload.hash().matchesHex(item.hash()) || size != item.size()) {
            log.warnf("Payload %s differs from the manifest for binary %s (hash %s, size %d); using the payload's hash %s and size %d",
                    payload.name(), item.binaryId(), item.hash(), item.size(), hash, size);
        }

        BundleManifest.BinaryEntry binaryEntry = manifest.binaryEntry(item);
        List<SignatureConfig> signatures = new ArrayList<>();
        String description = null;
        if (binaryEntry != null) {
            description = binaryEntry.description();
            binaryEntry.signatures().forEach(s -> signatures.add(new SignatureConfig.PreComputed(s.keyId(), s.signature())));
        }

        Binary binary = resolver.getOrCreateBinary(new BinaryRequest(versionPrn, item.target(), hash, size,
                item.binaryId(), description, item.customMetadata()));
        Binary processed = processor.process(binary, payload.content(), signatures);
        log.infof("Binary %s for target %s is %s", processed.prn(), item.target(), processed.state().wireName());
        return processed;
    }
}
