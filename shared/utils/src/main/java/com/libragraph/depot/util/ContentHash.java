package com.libragraph.depot.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * Represents a SHA-256 content hash (32 bytes).
 * Immutable value object that can be used as a map key.
 *
 * <p>The registry stores hashes as lowercase hex; part uploads carry the raw digest
 * base64-encoded in the {@code x-amz-checksum-sha256} header.
 */
public record ContentHash(byte[] bytes) {
    private static final int HASH_LENGTH = 32; // 256 bits
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException(
                "Content hash must be 32 bytes (SHA-256), got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    public static ContentHash of(byte[] data) {
        return new ContentHash(DigestUtils.sha256(data));
    }

    public static ContentHash of(byte[] data, int offset, int length) {
        MessageDigest digest = DigestUtils.getSha256Digest();
        digest.update(data, offset, length);
        return new ContentHash(digest.digest());
    }

    /**
     * Hashes the stream to its end. The stream is not closed.
     */
    public static ContentHash of(InputStream in) {
        try {
            return new ContentHash(DigestUtils.sha256(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to hash stream", e);
        }
    }

    /**
     * Creates ContentHash from hex string (64 characters, either case).
     */
    public static ContentHash fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != 64) {
            throw new IllegalArgumentException(
                "SHA-256 hex string must be 64 characters, got: " + hex.length()
            );
        }
        try {
            return new ContentHash(HEX_FORMAT.parseHex(hex.toLowerCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    /**
     * Returns lowercase hex representation (64 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    public String toUpperHex() {
        return toHex().toUpperCase(Locale.ROOT);
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(bytes);
    }

    /**
     * Compares against a hex string without caring about case.
     */
    public boolean matchesHex(String hex) {
        return hex != null && toHex().equalsIgnoreCase(hex);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
