package com.libragraph.depot.util.buffer;

import com.libragraph.depot.util.ContentHash;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Read-only binary data backed by RAM or a file.
 *
 * Implements SeekableByteChannel for direct channel-based access.
 * {@link #readRange(long, int)} reads without touching the channel position, so
 * concurrent part uploads can share one instance.
 *
 * Design principles:
 * - Hash and size are always available
 * - Stream access uses standard JDK wrappers (Channels.newInputStream)
 */
public abstract class BinaryData implements SeekableByteChannel {

    /**
     * Wraps an existing SeekableByteChannel as BinaryData.
     * Hash will be computed lazily on first access.
     */
    public static BinaryData wrap(SeekableByteChannel channel) {
        return new WrappedBinaryData(channel);
    }

    /**
     * Wraps a byte array without copying it.
     */
    public static BinaryData of(byte[] data) {
        return new RamBuffer(data);
    }

    /**
     * Opens a file read-only. Closing the returned data closes the file.
     */
    public static BinaryData open(Path path) {
        try {
            return new WrappedBinaryData(FileChannel.open(path, StandardOpenOption.READ));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open " + path, e);
        }
    }

    /**
     * Content hash (SHA-256) of this binary data.
     * May be computed lazily on first call.
     */
    public abstract ContentHash hash();

    /**
     * Total size in bytes.
     */
    public abstract long size();

    /**
     * Reads {@code length} bytes starting at {@code offset} without moving the channel position.
     * Safe to call from several threads at once.
     *
     * @throws IllegalArgumentException if the range extends past the end of the data
     */
    public byte[] readRange(long offset, int length) {
        checkRange(offset, length);
        synchronized (this) {
            try {
                long originalPos = position();
                position(offset);
                byte[] out = readFully(this, length);
                position(originalPos);
                return out;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + length + " bytes at " + offset, e);
            }
        }
    }

    /**
     * Opens an InputStream positioned at the given offset.
     *
     * Uses standard JDK Channels.newInputStream() wrapper. Closing the stream leaves
     * this data open.
     *
     * @param pos starting position (0-based)
     * @return InputStream positioned at offset
     */
    public InputStream inputStream(long pos) {
        try {
            position(pos);
            return new FilterInputStream(Channels.newInputStream(this)) {
                @Override
                public void close() {
                    // the channel outlives the stream
                }
            };
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create input stream at position " + pos, e);
        }
    }

    protected void checkRange(long offset, int length) {
        if (offset < 0 || length < 0 || offset + length > size()) {
            throw new IllegalArgumentException(
                    "Range [" + offset + ", " + (offset + length) + ") outside data of size " + size());
        }
    }

    static byte[] readFully(SeekableByteChannel channel, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) == -1) {
                throw new IOException("Unexpected end of data after " + buffer.position() + " bytes");
            }
        }
        return buffer.array();
    }
}
