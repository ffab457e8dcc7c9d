package com.libragraph.depot.formats.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.depot.formats.archive.ArchiveException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads and writes {@code bundle.json}. Output is pretty-printed UTF-8.
 */
public class ManifestJson {

    private final ObjectMapper mapper;

    public ManifestJson() {
        this(new ObjectMapper());
    }

    public ManifestJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] write(BundleManifest manifest) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(manifest);
        } catch (JsonProcessingException e) {
            throw new ArchiveException("Failed to serialize bundle manifest", e);
        }
    }

    public BundleManifest read(byte[] json) {
        try {
            BundleManifest manifest = mapper.readValue(json, BundleManifest.class);
            if (manifest.bundle() == null) {
                throw new ArchiveException("Bundle manifest has no bundle section");
            }
            return manifest;
        } catch (IOException e) {
            throw new ArchiveException("Failed to parse bundle manifest: "
                    + new String(json, 0, Math.min(json.length, 200), StandardCharsets.UTF_8), e);
        }
    }
}
