package com.libragraph.depot.formats.codecs;

import com.libragraph.depot.formats.api.Codec;
import org.apache.commons.compress.compressors.zstandard.ZstdCompressorInputStream;
import org.apache.commons.compress.compressors.zstandard.ZstdCompressorOutputStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;

/**
 * Codec for Zstandard compression (.zst files), the outer layer of bundle archives.
 * Backed by commons-compress with the zstd-jni native library.
 */
public class ZstdCodec implements Codec {
    public static final String LEVEL = "level";
    public static final int DEFAULT_LEVEL = 3;

    @Override
    public InputStream decodingStream(InputStream in) throws IOException {
        return new ZstdCompressorInputStream(in);
    }

    @Override
    public OutputStream encodingStream(OutputStream out, Map<String, Object> parameters) throws IOException {
        return new ZstdCompressorOutputStream(out, level(parameters));
    }

    @Override
    public Map<String, Object> getEncodingParameters() {
        return Map.of(LEVEL, DEFAULT_LEVEL);
    }

    private static int level(Map<String, Object> parameters) {
        Object level = parameters == null ? null : parameters.get(LEVEL);
        if (level == null) return DEFAULT_LEVEL;
        if (level instanceof Number n) return n.intValue();
        return Integer.parseInt(level.toString());
    }
}
