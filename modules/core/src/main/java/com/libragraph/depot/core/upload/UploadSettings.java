package com.libragraph.depot.core.upload;

import com.libragraph.depot.core.ValidationException;

/**
 * Part size and parallelism for multipart uploads.
 *
 * <p>Part size is bounded below by the object store's minimum part size and above by what a
 * single in-memory part can hold.
 */
public record UploadSettings(long partSize, int concurrency) {

    public static final long MIN_PART_SIZE = 5_242_880L;
    /** Exclusive upper bound imposed by the registry. */
    public static final long MAX_PART_SIZE = 50_000_000_000L;
    public static final long DEFAULT_PART_SIZE = MIN_PART_SIZE;

    public UploadSettings {
        if (partSize < MIN_PART_SIZE || partSize >= MAX_PART_SIZE) {
            throw new ValidationException("Binary part size must be at least " + MIN_PART_SIZE
                    + " and below " + MAX_PART_SIZE + " bytes, got: " + partSize);
        }
        if (partSize > Integer.MAX_VALUE) {
            throw new ValidationException("Binary part size " + partSize
                    + " exceeds the largest part that can be buffered (" + Integer.MAX_VALUE + " bytes)");
        }
        if (concurrency < 1) {
            throw new ValidationException("Upload concurrency must be at least 1, got: " + concurrency);
        }
    }

    public static int defaultConcurrency() {
        return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors() * 2, 16));
    }

    public static UploadSettings defaults() {
        return new UploadSettings(DEFAULT_PART_SIZE, defaultConcurrency());
    }

    public UploadSettings withPartSize(long size) {
        return new UploadSettings(size, concurrency);
    }

    public UploadSettings withConcurrency(int count) {
        return new UploadSettings(partSize, count);
    }
}
