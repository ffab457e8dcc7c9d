package com.libragraph.depot.formats.archive;

import com.libragraph.depot.formats.api.Codec;
import com.libragraph.depot.formats.manifest.BundleManifest;
import com.libragraph.depot.formats.manifest.BundleManifest.ManifestItem;
import com.libragraph.depot.formats.manifest.ManifestJson;
import com.libragraph.depot.util.buffer.BinaryData;
import org.apache.commons.compress.archivers.cpio.CpioArchiveEntry;
import org.apache.commons.compress.archivers.cpio.CpioArchiveOutputStream;
import org.apache.commons.compress.archivers.cpio.CpioConstants;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes bundle archives: a cpio (newc) stream compressed by the codec, holding
 * {@code bundle.json} first and then one payload per manifest item, in manifest order.
 */
public class BundleArchiveWriter {

    private static final Logger log = Logger.getLogger(BundleArchiveWriter.class);

    public static final String MANIFEST_NAME = "bundle.json";
    private static final int REGULAR_FILE = CpioConstants.C_ISREG | 0644;

    private final Codec codec;
    private final ManifestJson manifestJson;

    public BundleArchiveWriter(Codec codec, ManifestJson manifestJson) {
        this.codec = codec;
        this.manifestJson = manifestJson;
    }

    /**
     * Writes the archive to {@code target}, replacing any existing file.
     *
     * @param payloads content of each manifest item, in the same order as {@code bundle.manifest}
     */
    public void write(Path target, BundleManifest manifest, List<BinaryData> payloads) {
        try (OutputStream out = Files.newOutputStream(target)) {
            write(out, manifest, payloads);
        } catch (IOException e) {
            throw new ArchiveException("Failed to write bundle archive " + target, e);
        }
        log.infof("Wrote bundle archive %s (%d binaries)", target, payloads.size());
    }

    /**
     * Writes the archive to {@code out}. The stream is closed when the archive is complete.
     */
    public void write(OutputStream out, BundleManifest manifest, List<BinaryData> payloads) throws IOException {
        List<ManifestItem> items = manifest.bundle().manifest();
        if (items.size() != payloads.size()) {
            throw new ArchiveException("Manifest lists " + items.size() + " binaries but "
                    + payloads.size() + " payloads were supplied");
        }
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).size() != payloads.get(i).size()) {
                throw new ArchiveException("Payload for binary " + items.get(i).binaryId() + " has "
                        + payloads.get(i).size() + " bytes, manifest declares " + items.get(i).size());
            }
        }

        OutputStream compressed = codec.encodingStream(out, codec.getEncodingParameters());
        try (CpioArchiveOutputStream cpio = new CpioArchiveOutputStream(compressed,
                CpioConstants.FORMAT_NEW, CpioConstants.BLOCK_SIZE, "UTF-8")) {

            byte[] json = manifestJson.write(manifest);
            cpio.putArchiveEntry(entry(MANIFEST_NAME, json.length));
            cpio.write(json);
            cpio.closeArchiveEntry();

            Set<String> used = new HashSet<>();
            used.add(MANIFEST_NAME);
            for (int i = 0; i < items.size(); i++) {
                String name = payloadName(items.get(i), used);
                BinaryData payload = payloads.get(i);
                cpio.putArchiveEntry(entry(name, payload.size()));
                try (InputStream in = payload.inputStream(0)) {
                    in.transferTo(cpio);
                }
                cpio.closeArchiveEntry();
                log.debugf("Archived %s (%d bytes)", name, payload.size());
            }
            cpio.finish();
        }
    }

    /**
     * Payloads are named by target; a target already used in the archive falls back to the binary id.
     */
    static String payloadName(ManifestItem item, Set<String> used) {
        String target = item.target();
        if (target != null && !target.isBlank() && used.add(target)) {
            return target;
        }
        if (!used.add(item.binaryId())) {
            throw new ArchiveException("Duplicate binary id in manifest: " + item.binaryId());
        }
        return item.binaryId();
    }

    private static CpioArchiveEntry entry(String name, long size) {
        CpioArchiveEntry entry = new CpioArchiveEntry(CpioConstants.FORMAT_NEW, name, size);
        entry.setMode(REGULAR_FILE);
        entry.setNumberOfLinks(1);
        return entry;
    }
}
