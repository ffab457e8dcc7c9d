package com.libragraph.depot.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits content of a known length into fixed-size chunks indexed from 1.
 * Every chunk has the requested size except the last, which holds the remainder.
 */
public final class ChunkPlanner {

    /** Highest part index the registry accepts. */
    public static final int MAX_CHUNKS = 10_000;

    private ChunkPlanner() {
    }

    public record Chunk(int index, long offset, int size) {
    }

    public static int chunkCount(long totalSize, long chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, got: " + chunkSize);
        }
        if (totalSize < 0) {
            throw new IllegalArgumentException("Total size must not be negative, got: " + totalSize);
        }
        long count = (totalSize + chunkSize - 1) / chunkSize;
        if (count > MAX_CHUNKS) {
            throw new IllegalArgumentException(
                    "Content of " + totalSize + " bytes needs " + count + " parts of " + chunkSize
                            + " bytes; at most " + MAX_CHUNKS + " parts are allowed");
        }
        return (int) count;
    }

    /**
     * @param totalSize content length in bytes
     * @param chunkSize size of every chunk but the last; must fit in an int
     * @return chunks in index order, empty for empty content
     */
    public static List<Chunk> plan(long totalSize, long chunkSize) {
        if (chunkSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Chunk size too large to buffer: " + chunkSize);
        }
        int count = chunkCount(totalSize, chunkSize);
        if (count == 0) return Collections.emptyList();

        List<Chunk> chunks = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            long offset = i * chunkSize;
            int size = (int) Math.min(chunkSize, totalSize - offset);
            chunks.add(new Chunk(i + 1, offset, size));
        }
        return chunks;
    }
}
