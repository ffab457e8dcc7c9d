package com.libragraph.depot.core.resolve;

import com.libragraph.depot.core.registry.InMemoryRegistry;
import com.libragraph.depot.core.registry.RegistryException;
import com.libragraph.depot.core.registry.model.Artifact;
import com.libragraph.depot.core.registry.model.ArtifactVersion;
import com.libragraph.depot.core.registry.model.Binary;
import com.libragraph.depot.core.registry.model.CreateArtifactRequest;
import com.libragraph.depot.types.BinaryState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceResolverTest {

    private static final String HASH_A = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";
    private static final String HASH_B = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
    private static final String ARTIFACT_ID = "3f1e2d3c-4b5a-4697-8877-665544332211";
    private static final String VERSION_ID = "9a8b7c6d-5e4f-4a3b-9c2d-1e0f11223344";

    private InMemoryRegistry registry;
    private ResourceResolver resolver;
    private ArtifactVersion version;

    @BeforeEach
    void setUp() {
        registry = new InMemoryRegistry();
        resolver = new ResourceResolver(registry);
        version = registry.seedVersion(registry.seedArtifact("firmware"), "1.0.0");
    }

    @Test
    void shouldCreateBinaryWhenNoneExists() {
        Binary binary = resolver.getOrCreateBinary(BinaryRequest.of(version.prn(), "arm64", HASH_A, 3));

        assertThat(binary.state()).isEqualTo(BinaryState.UPLOADABLE);
        assertThat(binary.hash()).isEqualTo(HASH_A);
        assertThat(registry.binaries()).hasSize(1);
    }

    @Test
    void shouldReturnSameBinaryOnRepeatedCalls() {
        Binary first = resolver.getOrCreateBinary(BinaryRequest.of(version.prn(), "arm64", HASH_A, 3));
        registry.clearCalls();

        Binary second = resolver.getOrCreateBinary(BinaryRequest.of(version.prn(), "arm64", HASH_A.toUpperCase(), 3));

        assertThat(second.prn()).isEqualTo(first.prn());
        assertThat(registry.binaries()).hasSize(1);
        assertThat(registry.calls()).noneMatch(c -> c.startsWith("createBinary") || c.startsWith("updateBinary"));
    }

    @Test
    void shouldLookUpDeterministicPrnWhenIdGiven() {
        String binaryId = "0a1b2c3d-4e5f-4a6b-8c7d-9e0f1a2b3c4d";
        BinaryRequest request = new BinaryRequest(version.prn(), "arm64", HASH_A, 3, binaryId, "main image", null);

        Binary created = resolver.getOrCreateBinary(request);
        Binary again = resolver.getOrCreateBinary(request);

        assertThat(created.prn()).endsWith(":binary:" + binaryId);
        assertThat(again.prn()).isEqualTo(created.prn());
        assertThat(registry.calls()).noneMatch(c -> c.startsWith("findBinaries"));
    }

    @Test
    void shouldRefuseToChangeSignedBinary() {
        Binary signed = registry.seedBinary(version, "arm64", HASH_A, 3, BinaryState.SIGNED);

        assertThatThrownBy(() -> resolver.getOrCreateBinary(BinaryRequest.of(version.prn(), "arm64", HASH_B, 0)))
                .isInstanceOf(ImmutableBinaryException.class)
                .hasMessageContaining(signed.prn())
                .hasMessageContaining(version.prn())
                .hasMessageContaining("arm64");
        assertThat(registry.binary(signed.prn()).hash()).isEqualTo(HASH_A);
        assertThat(registry.calls()).noneMatch(c -> c.startsWith("updateBinary"));
    }

    @Test
    void shouldResetUnsignedBinaryWithNewContent() {
        Binary hashing = registry.seedBinary(version, "arm64", HASH_A, 3, BinaryState.HASHING);

        Binary reset = resolver.getOrCreateBinary(BinaryRequest.of(version.prn(), "arm64", HASH_B, 0));

        assertThat(reset.prn()).isEqualTo(hashing.prn());
        assertThat(reset.state()).isEqualTo(BinaryState.UPLOADABLE);
        assertThat(reset.hash()).isEqualTo(HASH_B);
        assertThat(reset.size()).isZero();
    }

    @Test
    void shouldTreatSizeDifferenceAsChangedContent() {
        registry.seedBinary(version, "arm64", HASH_A, 3, BinaryState.UPLOADABLE);

        Binary updated = resolver.getOrCreateBinary(BinaryRequest.of(version.prn(), "arm64", HASH_A, 4));

        assertThat(updated.size()).isEqualTo(4L);
        assertThat(registry.calls()).filteredOn(c -> c.startsWith("updateBinary")).hasSize(1);
    }

    @Test
    void shouldRejectAmbiguousMatches() {
        Binary one = registry.seedBinary(version, "arm64", HASH_A, 3, BinaryState.UPLOADABLE);
        Binary two = registry.seedBinary(version, "arm64", HASH_B, 0, BinaryState.UPLOADABLE);

        assertThatThrownBy(() -> resolver.getOrCreateBinary(BinaryRequest.of(version.prn(), "arm64", HASH_A, 3)))
                .isInstanceOf(AmbiguousBinaryException.class)
                .hasMessageContaining(one.prn())
                .hasMessageContaining(two.prn());
    }

    @Test
    void shouldCreateArtifactAndVersionOnce() {
        Artifact artifact = resolver.getOrCreateArtifact(InMemoryRegistry.ORGANIZATION_PRN, ARTIFACT_ID, "bootloader", null);
        ArtifactVersion created = resolver.getOrCreateArtifactVersion(artifact.prn(), VERSION_ID, "2.1.0", null);

        Artifact again = resolver.getOrCreateArtifact(InMemoryRegistry.ORGANIZATION_PRN, ARTIFACT_ID, "bootloader", null);
        ArtifactVersion versionAgain = resolver.getOrCreateArtifactVersion(artifact.prn(), VERSION_ID, "2.1.0", null);

        assertThat(again).isEqualTo(artifact);
        assertThat(versionAgain).isEqualTo(created);
        assertThat(artifact.prn()).isEqualTo(InMemoryRegistry.ORGANIZATION_PRN + ":artifact:" + ARTIFACT_ID);
        assertThat(registry.calls()).filteredOn(c -> c.startsWith("create")).hasSize(2);
    }

    @Test
    void shouldReadBackArtifactCreatedConcurrently() {
        InMemoryRegistry racing = new InMemoryRegistry() {
            private boolean hidden = true;

            @Override
            public synchronized Optional<Artifact> getArtifact(String prn) {
                if (hidden) {
                    hidden = false;
                    return Optional.empty();
                }
                return super.getArtifact(prn);
            }
        };
        Artifact existing = racing.createArtifact(new CreateArtifactRequest(ARTIFACT_ID, "bootloader", null));

        Artifact resolved = new ResourceResolver(racing)
                .getOrCreateArtifact(InMemoryRegistry.ORGANIZATION_PRN, ARTIFACT_ID, "bootloader", null);

        assertThat(resolved).isEqualTo(existing);
    }

    @Test
    void shouldPropagateCreationErrorsOtherThanConflict() {
        registry.rejectArtifactIds.add(ARTIFACT_ID);

        assertThatThrownBy(() -> resolver.getOrCreateArtifact(InMemoryRegistry.ORGANIZATION_PRN, ARTIFACT_ID, "x", null))
                .isInstanceOfSatisfying(RegistryException.class, e -> assertThat(e.statusCode()).isEqualTo(422));
    }
}
