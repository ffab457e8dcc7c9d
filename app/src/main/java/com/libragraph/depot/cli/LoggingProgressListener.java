package com.libragraph.depot.cli;

import com.libragraph.depot.core.registry.model.Binary;
import com.libragraph.depot.core.upload.UploadProgressListener;
import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Logs upload progress in steps of 10%.
 */
public class LoggingProgressListener implements UploadProgressListener {

    private static final Logger log = Logger.getLogger(LoggingProgressListener.class);

    private final Map<String, Integer> reported = new HashMap<>();

    @Override
    public synchronized void onProgress(Binary binary, long transferred, long total) {
        int step = step(transferred, total);
        Integer previous = reported.get(binary.prn());
        if (previous != null && previous >= step) {
            return;
        }
        reported.put(binary.prn(), step);
        log.infof("Uploading %s: %d%% (%d of %d bytes)", binary.prn(), step * 10, transferred, total);
    }

    synchronized int lastStep(String binaryPrn) {
        return reported.getOrDefault(binaryPrn, -1);
    }

    static int step(long transferred, long total) {
        if (total <= 0) {
            return 10;
        }
        return (int) Math.min(10, transferred * 10 / total);
    }
}
