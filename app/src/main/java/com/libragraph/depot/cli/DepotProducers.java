package com.libragraph.depot.cli;

import com.libragraph.depot.cli.config.DepotConfig;
import com.libragraph.depot.core.bundle.BundlePullService;
import com.libragraph.depot.core.pipeline.PollingSettings;
import com.libragraph.depot.core.registry.HttpRegistryClient;
import com.libragraph.depot.core.registry.RegistryClient;
import com.libragraph.depot.core.registry.RegistrySettings;
import com.libragraph.depot.core.resolve.ResourceResolver;
import com.libragraph.depot.core.signing.Ed25519BinarySigner;
import com.libragraph.depot.core.signing.SignatureOrchestrator;
import com.libragraph.depot.core.signing.SigningKeyPair;
import com.libragraph.depot.core.transfer.HttpObjectTransfer;
import com.libragraph.depot.core.transfer.ObjectTransfer;
import com.libragraph.depot.formats.archive.BundleArchiveReader;
import com.libragraph.depot.formats.archive.BundleArchiveWriter;
import com.libragraph.depot.formats.codecs.ZstdCodec;
import com.libragraph.depot.formats.manifest.ManifestJson;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.net.URI;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the plain-Java pipeline services from {@link DepotConfig}.
 */
@ApplicationScoped
public class DepotProducers {

    private final DepotConfig config;

    DepotProducers(DepotConfig config) {
        this.config = config;
    }

    @Produces
    @Singleton
    public RegistryClient registryClient() {
        DepotConfig.Registry registry = config.registry();
        return new HttpRegistryClient(new RegistrySettings(URI.create(registry.baseUrl()), registry.apiKey(),
                registry.requestTimeout(), registry.rateLimitRetries(), registry.rateLimitBackoff()));
    }

    @Produces
    @Singleton
    public ObjectTransfer objectTransfer() {
        return new HttpObjectTransfer(config.registry().requestTimeout());
    }

    @Produces
    @Singleton
    public ResourceResolver resourceResolver(RegistryClient registry) {
        return new ResourceResolver(registry);
    }

    @Produces
    @Singleton
    public SignatureOrchestrator signatureOrchestrator(RegistryClient registry) {
        Map<String, SigningKeyPair> keyPairs = new LinkedHashMap<>();
        config.signingKeyPairs().forEach((name, pair) ->
                keyPairs.put(name, new SigningKeyPair(pair.signingKeyPrn(), Path.of(pair.privateKeyPath()))));
        return new SignatureOrchestrator(registry, new Ed25519BinarySigner(), keyPairs);
    }

    @Produces
    @Singleton
    public PollingSettings pollingSettings() {
        return new PollingSettings(config.hashing().pollInterval(), config.hashing().maxAttempts());
    }

    @Produces
    @Singleton
    public BundleArchiveReader bundleArchiveReader() {
        return new BundleArchiveReader(new ZstdCodec(), new ManifestJson());
    }

    @Produces
    @Singleton
    public BundleArchiveWriter bundleArchiveWriter() {
        return new BundleArchiveWriter(new ZstdCodec(), new ManifestJson());
    }

    @Produces
    @Singleton
    public BundlePullService bundlePullService(RegistryClient registry, ObjectTransfer transfer,
                                               BundleArchiveWriter writer) {
        return new BundlePullService(registry, transfer, writer);
    }
}
