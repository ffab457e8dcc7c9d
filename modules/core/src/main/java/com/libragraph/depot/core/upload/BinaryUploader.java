package com.libragraph.depot.core.upload;

import com.libragraph.depot.core.ValidationException;
import com.libragraph.depot.core.registry.RegistryClient;
import com.libragraph.depot.core.registry.model.Binary;
import com.libragraph.depot.core.registry.model.BinaryPart;
import com.libragraph.depot.core.registry.model.CreateBinaryPartRequest;
import com.libragraph.depot.core.transfer.ObjectTransfer;
import com.libragraph.depot.util.ChunkPlanner;
import com.libragraph.depot.util.ContentHash;
import com.libragraph.depot.util.buffer.BinaryData;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Uploads a binary's content as fixed-size parts to pre-signed URLs.
 *
 * <p>Parts the registry already reports as valid, with the size the current part size plans for
 * them, are skipped, so an interrupted upload resumes where it stopped. Up to {@link UploadSettings#concurrency()} parts are in flight at once; the
 * first failing part fails the whole upload.
 */
public class BinaryUploader {

    private static final Logger log = Logger.getLogger(BinaryUploader.class);

    private final RegistryClient registry;
    private final ObjectTransfer transfer;
    private final UploadSettings settings;
    private final UploadProgressListener progress;

    public BinaryUploader(RegistryClient registry, ObjectTransfer transfer,
                          UploadSettings settings, UploadProgressListener progress) {
        this.registry = registry;
        this.transfer = transfer;
        this.settings = settings;
        this.progress = progress;
    }

    public UploadSettings settings() {
        return settings;
    }

    public void upload(Binary binary, BinaryData content) {
        long size = content.size();
        if (binary.size() != null && binary.size() != size) {
            throw new ValidationException("Content is " + size + " bytes but " + binary.describe()
                    + " declares " + binary.size() + " bytes");
        }
        List<ChunkPlanner.Chunk> chunks;
        try {
            chunks = ChunkPlanner.plan(size, settings.partSize());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage() + " for " + binary.describe(), e);
        }

        Map<Integer, BinaryPart> existing = registry.listBinaryParts(binary.prn()).stream()
                .collect(Collectors.toMap(BinaryPart::index, Function.identity(), (a, b) -> b));

        AtomicLong transferred = new AtomicLong();
        List<ChunkPlanner.Chunk> pending = new ArrayList<>();
        for (ChunkPlanner.Chunk chunk : chunks) {
            BinaryPart part = existing.get(chunk.index());
            if (part != null && part.isValid() && part.size() == chunk.size()) {
                transferred.addAndGet(part.size());
            } else {
                pending.add(chunk);
            }
        }
        if (transferred.get() > 0) {
            progress.onProgress(binary, transferred.get(), size);
        }
        log.infof("Uploading %s: %d of %d parts pending (%d bytes)",
                binary.prn(), pending.size(), chunks.size(), size);
        if (pending.isEmpty()) {
            return;
        }

        ExecutorService pool = newPool(Math.min(settings.concurrency(), pending.size()));
        try {
            Multi.createFrom().iterable(pending)
                    .onItem().transformToUni(chunk -> Uni.createFrom()
                            .item(() -> uploadChunk(binary, content, chunk, size))
                            .runSubscriptionOn(pool))
                    .merge(settings.concurrency())
                    .onItem().invoke(bytes -> progress.onProgress(binary, transferred.addAndGet(bytes), size))
                    .collect().asList()
                    .await().indefinitely();
        } finally {
            pool.shutdownNow();
        }
        log.infof("Uploaded %s (%d parts)", binary.prn(), pending.size());
    }

    private Long uploadChunk(Binary binary, BinaryData content, ChunkPlanner.Chunk chunk, long totalSize) {
        byte[] body = content.readRange(chunk.offset(), chunk.size());
        ContentHash hash = ContentHash.of(body);
        BinaryPart part = registry.createBinaryPart(binary.prn(),
                new CreateBinaryPartRequest(chunk.index(), chunk.size(), hash.toHex(), totalSize));
        if (part.presignedUploadUrl() == null) {
            throw new ValidationException("Registry issued no upload URL for part " + chunk.index()
                    + " of " + binary.prn());
        }
        transfer.put(URI.create(part.presignedUploadUrl()), body, hash);
        log.debugf("Uploaded %s part %d (%d bytes)", binary.prn(), chunk.index(), chunk.size());
        return (long) chunk.size();
    }

    private static ExecutorService newPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "depot-upload-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
