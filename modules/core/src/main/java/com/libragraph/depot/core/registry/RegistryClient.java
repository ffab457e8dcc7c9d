package com.libragraph.depot.core.registry;

import com.libragraph.depot.core.registry.model.Artifact;
import com.libragraph.depot.core.registry.model.ArtifactVersion;
import com.libragraph.depot.core.registry.model.Binary;
import com.libragraph.depot.core.registry.model.BinaryPart;
import com.libragraph.depot.core.registry.model.BinarySignature;
import com.libragraph.depot.core.registry.model.Bundle;
import com.libragraph.depot.core.registry.model.CreateArtifactRequest;
import com.libragraph.depot.core.registry.model.CreateArtifactVersionRequest;
import com.libragraph.depot.core.registry.model.CreateBinaryPartRequest;
import com.libragraph.depot.core.registry.model.CreateBinaryRequest;
import com.libragraph.depot.core.registry.model.CreateBundleRequest;
import com.libragraph.depot.core.registry.model.CreateSignatureRequest;
import com.libragraph.depot.core.registry.model.UpdateBinaryRequest;
import com.libragraph.depot.core.registry.model.User;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * The artifact registry as seen by the pipeline.
 *
 * <p>Every call is a synchronous round trip. Lookups return {@link Optional#empty()} when
 * the resource does not exist; every other failure is a {@link RegistryException}.
 */
public interface RegistryClient {

    /**
     * Identity behind the configured credentials; carries the organization used to build PRNs.
     */
    User currentUser();

    Optional<Artifact> getArtifact(String prn);

    Artifact createArtifact(CreateArtifactRequest request);

    Optional<ArtifactVersion> getArtifactVersion(String prn);

    ArtifactVersion createArtifactVersion(CreateArtifactVersionRequest request);

    Optional<Binary> getBinary(String prn);

    /**
     * Lists binaries of an artifact version.
     *
     * @param target only binaries with this target label, or all when null
     */
    List<Binary> findBinaries(String artifactVersionPrn, String target);

    Binary createBinary(CreateBinaryRequest request);

    Binary updateBinary(String prn, UpdateBinaryRequest request);

    List<BinaryPart> listBinaryParts(String binaryPrn);

    /**
     * Registers (or re-registers) one part and returns it with a time-limited upload URL.
     */
    BinaryPart createBinaryPart(String binaryPrn, CreateBinaryPartRequest request);

    BinarySignature createBinarySignature(CreateSignatureRequest request);

    /**
     * A URL the binary's content can be fetched from, if the registry issues one.
     */
    Optional<URI> binaryDownloadUrl(String binaryPrn);

    Optional<Bundle> getBundle(String prn);

    Bundle createBundle(CreateBundleRequest request);
}
