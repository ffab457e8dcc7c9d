package com.libragraph.depot.cli.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.depot.cli.PipelineFactory;
import com.libragraph.depot.core.ValidationException;
import com.libragraph.depot.core.registry.model.Binary;
import com.libragraph.depot.core.resolve.BinaryRequest;
import com.libragraph.depot.core.resolve.ResourceResolver;
import com.libragraph.depot.core.signing.SignatureConfig;
import com.libragraph.depot.core.signing.SignatureOrchestrator;
import com.libragraph.depot.util.buffer.BinaryData;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Creates (or resumes) a binary from a local file and drives it through upload, hashing and
 * optionally signing.
 */
@Command(name = "create", mixinStandardHelpOptions = true,
        description = "Create a binary from a local file, upload it and optionally sign it.")
public class BinaryCreateCommand implements Callable<Integer> {

    private static final Logger log = Logger.getLogger(BinaryCreateCommand.class);

    @Spec
    CommandSpec spec;

    @Inject
    ResourceResolver resolver;

    @Inject
    PipelineFactory pipelines;

    @Inject
    SignatureOrchestrator signatures;

    @Inject
    ObjectMapper mapper;

    @Option(names = "--artifact-version-prn", required = true)
    String artifactVersionPrn;

    @Option(names = "--target", required = true)
    String target;

    @Option(names = "--content-path", required = true)
    Path contentPath;

    @Option(names = "--id", description = "Resource UUID for a deterministic binary PRN.")
    String id;

    @Option(names = "--description")
    String description;

    @Option(names = "--custom-metadata", paramLabel = "JSON", description = "JSON object stored with the binary.")
    String customMetadata;

    @Option(names = "--signing-key-pair", description = "Name of a configured signing key pair.")
    String signingKeyPair;

    @Option(names = "--signing-key-prn")
    String signingKeyPrn;

    @Option(names = "--signing-key-private", description = "PEM file holding the Ed25519 private key.")
    Path signingKeyPrivate;

    @Mixin
    UploadOptions upload;

    @Override
    public Integer call() throws IOException {
        List<SignatureConfig> signing = signing();
        signatures.validate(signing);
        Binary result;
        try (BinaryData content = BinaryData.open(contentPath)) {
            String hash = content.hash().toHex();
            log.infof("Content %s: %d bytes, sha256 %s", contentPath, content.size(), hash);

            Binary binary = resolver.getOrCreateBinary(new BinaryRequest(artifactVersionPrn, target, hash,
                    content.size(), id, description, metadata()));
            result = pipelines.processor(pipelines.uploadSettings(upload.partSize, upload.concurrency))
                    .process(binary, content, signing);
        }
        spec.commandLine().getOut().println(mapper.writeValueAsString(result));
        return 0;
    }

    private List<SignatureConfig> signing() {
        if (signingKeyPair != null) {
            if (signingKeyPrn != null || signingKeyPrivate != null) {
                throw new ValidationException("--signing-key-pair cannot be combined with --signing-key-prn");
            }
            return List.of(new SignatureConfig.KeyPair(signingKeyPair));
        }
        if (signingKeyPrn == null && signingKeyPrivate == null) {
            return List.of();
        }
        if (signingKeyPrn == null || signingKeyPrivate == null) {
            throw new ValidationException("--signing-key-prn and --signing-key-private must be given together");
        }
        return List.of(new SignatureConfig.PrivateKey(signingKeyPrn, signingKeyPrivate));
    }

    private Map<String, Object> metadata() throws JsonProcessingException {
        if (customMetadata == null) {
            return null;
        }
        return mapper.readValue(customMetadata, new TypeReference<Map<String, Object>>() {});
    }
}
