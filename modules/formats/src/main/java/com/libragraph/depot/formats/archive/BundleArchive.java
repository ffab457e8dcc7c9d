package com.libragraph.depot.formats.archive;

import com.libragraph.depot.formats.manifest.BundleManifest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * A parsed bundle archive: its manifest plus every payload in archive order.
 * Payloads may be spooled to temp files; close the archive to release them.
 */
public record BundleArchive(BundleManifest manifest, List<ArchivePayload> payloads) implements AutoCloseable {

    public BundleArchive {
        payloads = List.copyOf(payloads);
    }

    @Override
    public void close() {
        UncheckedIOException failure = null;
        for (ArchivePayload payload : payloads) {
            try {
                payload.content().close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = new UncheckedIOException("Failed to release archive payloads", e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) throw failure;
    }
}
