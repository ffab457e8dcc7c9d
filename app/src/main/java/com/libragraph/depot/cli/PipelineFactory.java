package com.libragraph.depot.cli;

import com.libragraph.depot.cli.config.DepotConfig;
import com.libragraph.depot.core.bundle.BundlePushService;
import com.libragraph.depot.core.pipeline.BinaryProcessor;
import com.libragraph.depot.core.pipeline.PollingSettings;
import com.libragraph.depot.core.registry.RegistryClient;
import com.libragraph.depot.core.resolve.ResourceResolver;
import com.libragraph.depot.core.signing.SignatureOrchestrator;
import com.libragraph.depot.core.transfer.ObjectTransfer;
import com.libragraph.depot.core.upload.BinaryUploader;
import com.libragraph.depot.core.upload.UploadSettings;
import com.libragraph.depot.formats.archive.BundleArchiveReader;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Assembles processors whose upload settings may be overridden per command invocation.
 */
@ApplicationScoped
public class PipelineFactory {

    private final DepotConfig config;
    private final RegistryClient registry;
    private final ObjectTransfer transfer;
    private final ResourceResolver resolver;
    private final SignatureOrchestrator signatures;
    private final PollingSettings polling;
    private final BundleArchiveReader reader;

    PipelineFactory(DepotConfig config, RegistryClient registry, ObjectTransfer transfer, ResourceResolver resolver,
                    SignatureOrchestrator signatures, PollingSettings polling, BundleArchiveReader reader) {
        this.config = config;
        this.registry = registry;
        this.transfer = transfer;
        this.resolver = resolver;
        this.signatures = signatures;
        this.polling = polling;
        this.reader = reader;
    }

    /**
     * @param partSize    command-line override, or null for the configured value
     * @param concurrency command-line override, or null for the configured value
     */
    public UploadSettings uploadSettings(Long partSize, Integer concurrency) {
        long size = partSize != null ? partSize : config.upload().partSize();
        int parallel = concurrency != null ? concurrency
                : config.upload().concurrency().orElse(UploadSettings.defaultConcurrency());
        return new UploadSettings(size, parallel);
    }

    public BinaryProcessor processor(UploadSettings settings) {
        BinaryUploader uploader = new BinaryUploader(registry, transfer, settings, new LoggingProgressListener());
        return new BinaryProcessor(registry, uploader, signatures, polling);
    }

    public BundlePushService pushService(UploadSettings settings) {
        return new BundlePushService(registry, resolver, processor(settings), reader);
    }
}
