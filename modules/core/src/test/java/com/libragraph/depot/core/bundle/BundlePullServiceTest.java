package com.libragraph.depot.core.bundle;

import com.libragraph.depot.core.DepotException;
import com.libragraph.depot.core.IntegrityException;
import com.libragraph.depot.core.registry.InMemoryRegistry;
import com.libragraph.depot.core.registry.model.ArtifactVersion;
import com.libragraph.depot.core.registry.model.Binary;
import com.libragraph.depot.core.registry.model.BinaryBundle;
import com.libragraph.depot.core.registry.model.BundleBinary;
import com.libragraph.depot.core.registry.model.CreateSignatureRequest;
import com.libragraph.depot.core.registry.model.LegacyBundle;
import com.libragraph.depot.core.transfer.RecordingObjectTransfer;
import com.libragraph.depot.formats.archive.BundleArchive;
import com.libragraph.depot.formats.archive.BundleArchiveReader;
import com.libragraph.depot.formats.archive.BundleArchiveWriter;
import com.libragraph.depot.formats.codecs.ZstdCodec;
import com.libragraph.depot.formats.manifest.BundleManifest;
import com.libragraph.depot.formats.manifest.BundleManifest.ManifestItem;
import com.libragraph.depot.formats.manifest.ManifestJson;
import com.libragraph.depot.types.BinaryState;
import com.libragraph.depot.types.Prn;
import com.libragraph.depot.util.ContentHash;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BundlePullServiceTest {

    private static final byte[] KERNEL = "kernel image\n".repeat(100).getBytes(StandardCharsets.UTF_8);
    private static final byte[] ROOTFS = "root filesystem\n".repeat(300).getBytes(StandardCharsets.UTF_8);
    private static final String BUNDLE_ID = "c0ffee00-1234-4abc-8def-0123456789ab";

    @TempDir
    Path dir;

    private InMemoryRegistry registry;
    private RecordingObjectTransfer transfer;
    private BundlePullService service;
    private BundleArchiveReader reader;
    private ArtifactVersion version;
    private Binary kernel;
    private Binary rootfs;

    @BeforeEach
    void setUp() {
        registry = new InMemoryRegistry();
        transfer = new RecordingObjectTransfer();
        ZstdCodec codec = new ZstdCodec();
        ManifestJson json = new ManifestJson();
        reader = new BundleArchiveReader(codec, json);
        service = new BundlePullService(registry, transfer, new BundleArchiveWriter(codec, json));

        version = registry.seedVersion(registry.seedArtifact("gateway-os"), "4.2.0");
        kernel = registry.seedBinary(version, "arm64", ContentHash.of(KERNEL).toHex(), KERNEL.length, BinaryState.SIGNED);
        rootfs = registry.seedBinary(version, "arm64-rootfs", ContentHash.of(ROOTFS).toHex(), ROOTFS.length, BinaryState.SIGNED);
        registry.createBinarySignature(CreateSignatureRequest.withKeyId(kernel.prn(), "release-key", "ABCD"));
        serve(kernel, KERNEL);
        serve(rootfs, ROOTFS);
    }

    private void serve(Binary binary, byte[] content) {
        URI url = URI.create("http://storage.test/download/" + Prn.parse(binary.prn()).resourceId());
        registry.seedDownload(binary.prn(), url);
        transfer.seedObject(url, content);
    }

    private String seedBinaryBundle() {
        String prn = registry.prns.bundle(BUNDLE_ID);
        registry.seedBundle(new BinaryBundle(prn, "gateway 4.2.0", null, List.of(
                new BundleBinary(kernel.prn(), Map.of("slot", "a")),
                new BundleBinary(rootfs.prn(), null))));
        return prn;
    }

    @Test
    void shouldWriteArchiveWithManifestAndVerifiedPayloads() {
        String bundlePrn = seedBinaryBundle();
        Path output = dir.resolve("pulled.cpio.zst");

        Path written = service.pull(bundlePrn, new PullOptions(output, false));

        assertThat(written).isEqualTo(output);
        try (BundleArchive archive = reader.read(output)) {
            BundleManifest manifest = archive.manifest();
            assertThat(manifest.bundle().id()).isEqualTo(BUNDLE_ID);
            assertThat(manifest.bundle().name()).isEqualTo("gateway 4.2.0");
            assertThat(manifest.bundle().signatures()).isEmpty();
            assertThat(manifest.bundle().manifest()).extracting(ManifestItem::target)
                    .containsExactly("arm64", "arm64-rootfs");

            ManifestItem first = manifest.bundle().manifest().get(0);
            assertThat(first.binaryId()).isEqualTo(Prn.parse(kernel.prn()).resourceId());
            assertThat(first.artifactVersionId()).isEqualTo(Prn.parse(version.prn()).resourceId());
            assertThat(first.customMetadata()).containsEntry("slot", "a");
            assertThat(manifest.binaryEntry(first).signatures())
                    .extracting(BundleManifest.SignatureEntry::keyId).containsExactly("release-key");
            assertThat(manifest.artifacts()).hasSize(1);

            assertThat(archive.payloads().get(0).hash()).isEqualTo(ContentHash.of(KERNEL));
            assertThat(archive.payloads().get(1).content().readRange(0, ROOTFS.length)).isEqualTo(ROOTFS);
        }
    }

    @Test
    void shouldExpandLegacyBundleThroughItsVersions() {
        String prn = registry.prns.bundle(BUNDLE_ID);
        registry.seedBundle(new LegacyBundle(prn, "legacy", List.of(version.prn())));
        Path output = dir.resolve("legacy.cpio.zst");

        service.pull(prn, new PullOptions(output, false));

        try (BundleArchive archive = reader.read(output)) {
            assertThat(archive.manifest().bundle().manifest()).hasSize(2);
        }
        assertThat(registry.calls()).contains("findBinaries " + version.prn() + " null");
    }

    @Test
    void shouldFetchEachVersionAndArtifactOnce() {
        service.pull(seedBinaryBundle(), new PullOptions(dir.resolve("once.cpio.zst"), false));

        assertThat(registry.calls()).filteredOn(c -> c.startsWith("getArtifactVersion")).hasSize(1);
        assertThat(registry.calls()).filteredOn(c -> c.startsWith("getArtifact ")).hasSize(1);
    }

    @Test
    void shouldRejectDownloadWithWrongContent() {
        byte[] tampered = KERNEL.clone();
        tampered[0] ^= 1;
        serve(kernel, tampered);
        String bundlePrn = seedBinaryBundle();
        Path output = dir.resolve("tampered.cpio.zst");

        assertThatThrownBy(() -> service.pull(bundlePrn, new PullOptions(output, false)))
                .isInstanceOf(IntegrityException.class)
                .hasMessageContaining(kernel.prn());
        assertThat(output).doesNotExist();
    }

    @Test
    void shouldFailWithoutDownloadUnlessPlaceholdersAllowed() {
        Binary pending = registry.seedBinary(version, "x86_64", ContentHash.of(new byte[16]).toHex(), 16, BinaryState.SIGNED);
        String prn = registry.prns.bundle(BUNDLE_ID);
        registry.seedBundle(new BinaryBundle(prn, "partial", null, List.of(new BundleBinary(pending.prn(), null))));

        assertThatThrownBy(() -> service.pull(prn, new PullOptions(dir.resolve("a.cpio.zst"), false)))
                .isInstanceOf(DepotException.class)
                .hasMessageContaining(pending.prn());

        Path output = dir.resolve("b.cpio.zst");
        service.pull(prn, new PullOptions(output, true));
        try (BundleArchive archive = reader.read(output)) {
            assertThat(archive.payloads().get(0).content().readRange(0, 16)).containsOnly(0);
        }
    }

    @Test
    void shouldRejectBinaryWithoutContent() {
        Binary empty = registry.seedBinary(version, "riscv", null, 0, BinaryState.UPLOADABLE);
        String prn = registry.prns.bundle(BUNDLE_ID);
        registry.seedBundle(new BinaryBundle(prn, "broken", null, List.of(new BundleBinary(empty.prn(), null))));

        assertThatThrownBy(() -> service.pull(prn, PullOptions.defaults()))
                .isInstanceOf(IntegrityException.class)
                .hasMessageContaining(empty.prn());
    }

    @Test
    void shouldDeriveOutputNameFromBundleName() {
        BinaryBundle bundle = new BinaryBundle(registry.prns.bundle(BUNDLE_ID), "gateway 4.2.0/rc", null, List.of());

        assertThat(BundlePullService.defaultOutput(bundle)).isEqualTo(Path.of("gateway_4.2.0_rc.cpio.zst"));
    }
}
