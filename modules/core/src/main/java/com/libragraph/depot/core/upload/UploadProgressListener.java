package com.libragraph.depot.core.upload;

import com.libragraph.depot.core.registry.model.Binary;

/**
 * Receives upload progress. Called from upload worker threads, possibly concurrently.
 */
@FunctionalInterface
public interface UploadProgressListener {

    UploadProgressListener NONE = (binary, transferred, total) -> { };

    /**
     * @param transferred bytes accounted for so far, including parts that were already valid
     * @param total       size of the whole binary
     */
    void onProgress(Binary binary, long transferred, long total);
}
