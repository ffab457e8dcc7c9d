package com.libragraph.depot.core.resolve;

import com.libragraph.depot.core.registry.RegistryClient;
import com.libragraph.depot.core.registry.RegistryException;
import com.libragraph.depot.core.registry.model.Artifact;
import com.libragraph.depot.core.registry.model.ArtifactVersion;
import com.libragraph.depot.core.registry.model.Binary;
import com.libragraph.depot.core.registry.model.CreateArtifactRequest;
import com.libragraph.depot.core.registry.model.CreateArtifactVersionRequest;
import com.libragraph.depot.core.registry.model.CreateBinaryRequest;
import com.libragraph.depot.core.registry.model.UpdateBinaryRequest;
import com.libragraph.depot.types.BinaryState;
import com.libragraph.depot.types.PrnBuilder;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Idempotent get-or-create for artifacts, artifact versions and binaries.
 */
public class ResourceResolver {

    private static final Logger log = Logger.getLogger(ResourceResolver.class);

    private final RegistryClient registry;

    public ResourceResolver(RegistryClient registry) {
        this.registry = registry;
    }

    /**
     * Returns the binary matching the request, creating it or resetting its content as needed.
     *
     * @throws ImmutableBinaryException when a signed binary holds different content
     * @throws AmbiguousBinaryException when several binaries share the artifact version and target
     */
    public Binary getOrCreateBinary(BinaryRequest request) {
        List<Binary> matches = request.binaryId() != null
                ? registry.getBinary(PrnBuilder.fromPrn(request.artifactVersionPrn()).binary(request.binaryId()))
                        .map(List::of).orElse(List.of())
                : registry.findBinaries(request.artifactVersionPrn(), request.target());

        if (matches.isEmpty()) {
            Binary created = registry.createBinary(new CreateBinaryRequest(request.artifactVersionPrn(),
                    request.binaryId(), request.target(), request.hash(), request.size(),
                    request.description(), request.customMetadata()));
            log.infof("Created binary %s for target %s", created.prn(), request.target());
            return created;
        }
        if (matches.size() > 1) {
            throw new AmbiguousBinaryException(request.artifactVersionPrn(), request.target(),
                    matches.stream().map(Binary::prn).toList());
        }

        Binary existing = matches.get(0);
        if (sameContent(existing, request)) {
            log.debugf("Binary %s already holds the requested content", existing.prn());
            return existing;
        }
        if (existing.state() == BinaryState.SIGNED) {
            throw new ImmutableBinaryException(request, existing);
        }
        log.warnf("Binary %s content changed (hash %s -> %s), resetting to uploadable",
                existing.prn(), existing.hash(), request.hash());
        if (existing.state() != BinaryState.UPLOADABLE) {
            existing.state().requireTransition(BinaryState.UPLOADABLE);
            registry.updateBinary(existing.prn(), UpdateBinaryRequest.state(BinaryState.UPLOADABLE));
        }
        return registry.updateBinary(existing.prn(), UpdateBinaryRequest.content(request.hash(), request.size()));
    }

    public Artifact getOrCreateArtifact(String organizationPrn, String artifactId, String name, String description) {
        String prn = PrnBuilder.fromPrn(organizationPrn).artifact(artifactId);
        return getOrCreate("artifact", prn,
                () -> registry.getArtifact(prn),
                () -> registry.createArtifact(new CreateArtifactRequest(artifactId, name, description)));
    }

    public ArtifactVersion getOrCreateArtifactVersion(String artifactPrn, String versionId, String version,
                                                      String description) {
        String prn = PrnBuilder.fromPrn(artifactPrn).artifactVersion(versionId);
        return getOrCreate("artifact version", prn,
                () -> registry.getArtifactVersion(prn),
                () -> registry.createArtifactVersion(
                        new CreateArtifactVersionRequest(artifactPrn, versionId, version, description)));
    }

    private <T> T getOrCreate(String type, String prn, Supplier<Optional<T>> lookup, Supplier<T> create) {
        Optional<T> found = lookup.get();
        if (found.isPresent()) {
            log.debugf("Using existing %s %s", type, prn);
            return found.get();
        }
        try {
            T created = create.get();
            log.infof("Created %s %s", type, prn);
            return created;
        } catch (RegistryException e) {
            if (!e.isConflict()) {
                throw e;
            }
            log.debugf("Concurrent creation of %s %s, reading it back", type, prn);
            return lookup.get().orElseThrow(() -> e);
        }
    }

    private static boolean sameContent(Binary binary, BinaryRequest request) {
        return binary.hash() != null && binary.hash().equalsIgnoreCase(request.hash())
                && binary.size() != null && binary.size() == request.size();
    }
}
