package com.libragraph.depot.util.buffer;

import com.libragraph.depot.util.ContentHash;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.security.MessageDigest;

/**
 * Writable buffer that extends BinaryData with write capabilities.
 *
 * Supports incremental hash computation during sequential writes:
 * - Tailing writes (appending) update hash incrementally
 * - Overwrites invalidate hash and trigger recomputation
 * - Gaps in writes fall back to full hash computation
 *
 * Factory method allocates appropriate backend (RAM or file)
 * based on size thresholds.
 */
public abstract class Buffer extends BinaryData {

    private MessageDigest incrementalHash = DigestUtils.getSha256Digest();
    private long hashedUpTo = 0;
    private ContentHash cachedHash = null;

    /** Threshold above which allocate() uses a temp file instead of RAM. */
    private static final long FILE_THRESHOLD = 4L * 1024 * 1024; // 4 MB

    /**
     * Allocates a buffer of the given size.
     * Chooses backend automatically based on size:
     * <ul>
     *   <li>&lt; 4 MB: {@link RamBuffer} (heap byte array)</li>
     *   <li>&gt;= 4 MB: {@link FileBuffer} (temp-file backed {@link java.nio.channels.FileChannel})</li>
     * </ul>
     */
    public static Buffer allocate(long size) {
        if (size < FILE_THRESHOLD) {
            return new RamBuffer((int) size);
        }
        try {
            return new FileBuffer();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to allocate file-backed buffer", e);
        }
    }

    /**
     * Copies exactly {@code size} bytes from the stream into a newly allocated buffer,
     * hashing as it goes. The stream is not closed.
     */
    public static Buffer spool(InputStream in, long size) {
        Buffer buffer = allocate(size);
        try {
            byte[] chunk = new byte[8192];
            long remaining = size;
            while (remaining > 0) {
                int read = in.read(chunk, 0, (int) Math.min(chunk.length, remaining));
                if (read == -1) {
                    throw new IOException("Stream ended " + remaining + " bytes early");
                }
                buffer.write(ByteBuffer.wrap(chunk, 0, read));
                remaining -= read;
            }
            buffer.position(0);
            return buffer;
        } catch (IOException e) {
            closeQuietly(buffer, e);
            throw new UncheckedIOException("Failed to spool " + size + " bytes", e);
        }
    }

    /**
     * Opens an OutputStream positioned at the given offset.
     *
     * Uses standard JDK Channels.newOutputStream() wrapper.
     * All writes go through write(ByteBuffer) for hash tracking.
     * Closing the stream leaves this buffer open.
     *
     * @param pos starting position (0-based)
     * @return OutputStream positioned at offset
     */
    public OutputStream outputStream(long pos) {
        try {
            position(pos);
            return new FilterOutputStream(Channels.newOutputStream(this)) {
                @Override
                public void write(byte[] b, int off, int len) throws IOException {
                    out.write(b, off, len);
                }

                @Override
                public void close() throws IOException {
                    flush();
                }
            };
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create output stream at position " + pos, e);
        }
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        long writePos = position();
        cachedHash = null;

        if (writePos < hashedUpTo) {
            // Overwrite detected - invalidate incremental hash
            incrementalHash = DigestUtils.getSha256Digest();
            hashedUpTo = 0;
        } else if (writePos == hashedUpTo) {
            incrementalHash.update(src.duplicate());
            hashedUpTo += src.remaining();
        }
        // else: gap (writePos > hashedUpTo) - can't update incrementally

        return doWrite(src);
    }

    @Override
    public SeekableByteChannel truncate(long newSize) throws IOException {
        if (newSize < size()) {
            cachedHash = null;
            if (newSize < hashedUpTo) {
                incrementalHash = DigestUtils.getSha256Digest();
                hashedUpTo = 0;
            }
        }
        return doTruncate(newSize);
    }

    @Override
    public ContentHash hash() {
        if (cachedHash != null) {
            return cachedHash;
        }

        if (hashedUpTo == size()) {
            cachedHash = new ContentHash(snapshot(incrementalHash).digest());
            return cachedHash;
        }

        cachedHash = computeFullHash();
        return cachedHash;
    }

    /**
     * Subclasses implement actual write operation.
     */
    protected abstract int doWrite(ByteBuffer src) throws IOException;

    /**
     * Subclasses implement actual truncate operation.
     */
    protected abstract SeekableByteChannel doTruncate(long newSize) throws IOException;

    private ContentHash computeFullHash() {
        try {
            long originalPos = position();
            position(0);

            MessageDigest hasher = DigestUtils.getSha256Digest();
            ByteBuffer buffer = ByteBuffer.allocate(8192);
            while (read(buffer) != -1) {
                buffer.flip();
                hasher.update(buffer);
                buffer.clear();
            }

            position(originalPos);
            return new ContentHash(hasher.digest());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compute hash", e);
        }
    }

    private static MessageDigest snapshot(MessageDigest digest) {
        try {
            return (MessageDigest) digest.clone();
        } catch (CloneNotSupportedException e) {
            throw new IllegalStateException("SHA-256 digest does not support cloning", e);
        }
    }

    private static void closeQuietly(Buffer buffer, Exception primary) {
        try {
            buffer.close();
        } catch (IOException suppressed) {
            primary.addSuppressed(suppressed);
        }
    }
}
