package com.libragraph.depot.util.buffer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.util.Arrays;

/**
 * Buffer implementation using in-memory byte array.
 * Suitable for small payloads (< 4MB) and for content already held in memory.
 *
 * Supports simultaneous read/write operations with automatic growth.
 */
public class RamBuffer extends Buffer {
    private byte[] data;
    private long position;
    private long size;  // Logical size (may be less than data.length)

    /**
     * Creates empty buffer with initial capacity.
     */
    public RamBuffer(int initialCapacity) {
        this.data = new byte[initialCapacity];
        this.position = 0;
        this.size = 0;
    }

    /**
     * Creates buffer over existing data. The array is not copied.
     */
    public RamBuffer(byte[] data) {
        this.data = data;
        this.position = 0;
        this.size = data.length;
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public byte[] readRange(long offset, int length) {
        checkRange(offset, length);
        return Arrays.copyOfRange(data, (int) offset, (int) offset + length);
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        if (position >= size) {
            return -1;  // EOF
        }

        int remaining = (int) (size - position);
        int toRead = Math.min(remaining, dst.remaining());
        dst.put(data, (int) position, toRead);
        position += toRead;
        return toRead;
    }

    @Override
    protected int doWrite(ByteBuffer src) throws IOException {
        int toWrite = src.remaining();
        long endPosition = position + toWrite;

        if (endPosition > data.length) {
            grow(endPosition);
        }

        src.get(data, (int) position, toWrite);
        position += toWrite;

        if (position > size) {
            size = position;
        }

        return toWrite;
    }

    @Override
    protected SeekableByteChannel doTruncate(long newSize) throws IOException {
        if (newSize < size) {
            size = newSize;
            if (position > size) {
                position = size;
            }
        }
        return this;
    }

    @Override
    public long position() throws IOException {
        return position;
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        if (newPosition < 0) {
            throw new IllegalArgumentException("Negative position: " + newPosition);
        }
        this.position = newPosition;
        return this;
    }

    @Override
    public boolean isOpen() {
        return true;
    }

    @Override
    public void close() throws IOException {
        // No resources to close for RAM buffer
    }

    /**
     * Doubles capacity each time to amortize growth cost.
     */
    private void grow(long minCapacity) {
        long newCapacity = Math.max(data.length * 2L, minCapacity);
        if (newCapacity > Integer.MAX_VALUE - 8) {
            if (minCapacity > Integer.MAX_VALUE - 8) {
                throw new IllegalStateException("RAM buffer cannot hold " + minCapacity + " bytes");
            }
            newCapacity = Integer.MAX_VALUE - 8;
        }
        data = Arrays.copyOf(data, (int) newCapacity);
    }
}
