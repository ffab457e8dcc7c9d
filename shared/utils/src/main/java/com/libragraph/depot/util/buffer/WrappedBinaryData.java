package com.libragraph.depot.util.buffer;

import com.libragraph.depot.util.ContentHash;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.security.MessageDigest;

/**
 * BinaryData implementation that wraps an existing SeekableByteChannel.
 * Hash is computed lazily on first access.
 */
class WrappedBinaryData extends BinaryData {

    private final SeekableByteChannel channel;
    private ContentHash cachedHash;

    WrappedBinaryData(SeekableByteChannel channel) {
        this.channel = channel;
    }

    @Override
    public synchronized ContentHash hash() {
        if (cachedHash == null) {
            cachedHash = computeHash();
        }
        return cachedHash;
    }

    @Override
    public long size() {
        try {
            return channel.size();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to get size", e);
        }
    }

    @Override
    public byte[] readRange(long offset, int length) {
        if (!(channel instanceof FileChannel file)) {
            return super.readRange(offset, length);
        }
        checkRange(offset, length);
        ByteBuffer buffer = ByteBuffer.allocate(length);
        try {
            while (buffer.hasRemaining()) {
                if (file.read(buffer, offset + buffer.position()) == -1) {
                    throw new IOException("Unexpected end of file at " + (offset + buffer.position()));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + length + " bytes at " + offset, e);
        }
        return buffer.array();
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        return channel.read(dst);
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        cachedHash = null;
        return channel.write(src);
    }

    @Override
    public long position() throws IOException {
        return channel.position();
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        channel.position(newPosition);
        return this;
    }

    @Override
    public SeekableByteChannel truncate(long size) throws IOException {
        cachedHash = null;
        channel.truncate(size);
        return this;
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    private ContentHash computeHash() {
        try {
            long originalPos = channel.position();
            channel.position(0);

            MessageDigest hasher = DigestUtils.getSha256Digest();
            ByteBuffer buffer = ByteBuffer.allocate(8192);
            while (channel.read(buffer) != -1) {
                buffer.flip();
                hasher.update(buffer);
                buffer.clear();
            }

            channel.position(originalPos);
            return new ContentHash(hasher.digest());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compute hash", e);
        }
    }
}
