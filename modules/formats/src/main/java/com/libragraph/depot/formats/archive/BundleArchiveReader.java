package com.libragraph.depot.formats.archive;

import com.libragraph.depot.formats.api.Codec;
import com.libragraph.depot.formats.manifest.BundleManifest;
import com.libragraph.depot.formats.manifest.ManifestJson;
import com.libragraph.depot.util.buffer.Buffer;
import org.apache.commons.compress.archivers.cpio.CpioArchiveEntry;
import org.apache.commons.compress.archivers.cpio.CpioArchiveInputStream;
import org.jboss.logging.Logger;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads bundle archives written by {@link BundleArchiveWriter} (or any zstd-compressed
 * newc cpio stream with a {@code bundle.json} record).
 *
 * <p>The first record whose name ends in {@code bundle.json} is the manifest. Every other
 * non-empty regular record is kept as a payload; payloads of 4 MB or more are spooled to
 * temp files.
 */
public class BundleArchiveReader {

    private static final Logger log = Logger.getLogger(BundleArchiveReader.class);

    private final Codec codec;
    private final ManifestJson manifestJson;

    public BundleArchiveReader(Codec codec, ManifestJson manifestJson) {
        this.codec = codec;
        this.manifestJson = manifestJson;
    }

    public BundleArchive read(Path source) {
        if (!Files.isRegularFile(source)) {
            throw new ArchiveException("Bundle archive not found: " + source);
        }
        try (InputStream in = new BufferedInputStream(Files.newInputStream(source))) {
            return read(in);
        } catch (IOException e) {
            throw new ArchiveException("Failed to read bundle archive " + source, e);
        }
    }

    public BundleArchive read(InputStream in) throws IOException {
        BundleManifest manifest = null;
        List<ArchivePayload> payloads = new ArrayList<>();

        try (CpioArchiveInputStream cpio = new CpioArchiveInputStream(codec.decodingStream(in), "UTF-8")) {
            CpioArchiveEntry entry;
            while ((entry = cpio.getNextEntry()) != null) {
                String name = entry.getName();
                if (manifest == null && name.endsWith(BundleArchiveWriter.MANIFEST_NAME)) {
                    manifest = manifestJson.read(cpio.readAllBytes());
                    continue;
                }
                if (!entry.isRegularFile()) {
                    log.debugf("Skipping archive record %s", name);
                    continue;
                }
                payloads.add(new ArchivePayload(name, Buffer.spool(cpio, entry.getSize())));
            }
        } catch (IOException | UncheckedIOException | ArchiveException e) {
            new BundleArchive(null, payloads).close();
            throw e;
        }

        if (manifest == null) {
            new BundleArchive(null, payloads).close();
            throw new ArchiveException("Bundle archive has no " + BundleArchiveWriter.MANIFEST_NAME + " record");
        }
        log.debugf("Read bundle archive with %d payloads", payloads.size());
        return new BundleArchive(manifest, payloads);
    }
}
