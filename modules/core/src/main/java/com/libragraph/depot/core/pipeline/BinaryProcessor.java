package com.libragraph.depot.core.pipeline;

import com.libragraph.depot.core.DepotException;
import com.libragraph.depot.core.ValidationException;
import com.libragraph.depot.core.registry.RegistryClient;
import com.libragraph.depot.core.registry.RegistryException;
import com.libragraph.depot.core.registry.ResourceNotFoundException;
import com.libragraph.depot.core.registry.model.Binary;
import com.libragraph.depot.core.registry.model.UpdateBinaryRequest;
import com.libragraph.depot.core.signing.SignatureConfig;
import com.libragraph.depot.core.signing.SignatureOrchestrator;
import com.libragraph.depot.core.upload.BinaryUploader;
import com.libragraph.depot.types.BinaryState;
import com.libragraph.depot.util.buffer.BinaryData;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Drives a binary as far through its lifecycle as the caller's inputs allow.
 *
 * <p>Each call starts from the registry's current view of the binary, so it is safe to call
 * again after any failure: an interrupted upload resumes, a binary already hashing is only
 * awaited, and signed or destroyed binaries are returned untouched without a registry call.
 *
 * <pre>
 * UPLOADABLE --upload--> HASHABLE --> HASHING --(registry)--> SIGNABLE --sign--> SIGNED
 * </pre>
 */
public class BinaryProcessor {

    private static final Logger log = Logger.getLogger(BinaryProcessor.class);

    private final RegistryClient registry;
    private final BinaryUploader uploader;
    private final SignatureOrchestrator signatures;
    private final PollingSettings polling;

    public BinaryProcessor(RegistryClient registry, BinaryUploader uploader,
                           SignatureOrchestrator signatures, PollingSettings polling) {
        this.registry = registry;
        this.uploader = uploader;
        this.signatures = signatures;
        this.polling = polling;
    }

    public Binary process(Binary binary, BinaryData content) {
        return process(binary, content, List.of());
    }

    /**
     * @param content bytes of the binary; required only while it is uploadable
     * @param signing signatures to attach; when empty processing stops once hashing has started
     */
    public Binary process(Binary binary, BinaryData content, List<SignatureConfig> signing) {
        if (!binary.state().isLive()) {
            log.debugf("Binary %s is %s, nothing to do", binary.prn(), binary.state().wireName());
            return binary;
        }
        boolean sign = signing != null && !signing.isEmpty();
        if (sign) {
            signatures.validate(signing);
        }
        Binary current = registry.getBinary(binary.prn())
                .orElseThrow(() -> new ResourceNotFoundException("Binary", binary.prn()));

        if (current.state() == BinaryState.UPLOADABLE) {
            if (content == null) {
                throw new ValidationException("Content is required to upload " + current.describe());
            }
            uploader.upload(current, content);
            current = transition(current, BinaryState.HASHABLE);
        }
        if (current.state() == BinaryState.HASHABLE) {
            current = transition(current, BinaryState.HASHING);
        }
        if (current.state() == BinaryState.HASHING) {
            if (!sign) {
                log.infof("Binary %s is hashing; no signatures requested", current.prn());
                return current;
            }
            current = awaitSignable(current);
        }
        if (current.state() == BinaryState.SIGNABLE) {
            if (!sign) {
                return current;
            }
            current = signatures.sign(current, signing);
        }
        return current;
    }

    private Binary transition(Binary binary, BinaryState next) {
        binary.state().requireTransition(next);
        Binary updated = registry.updateBinary(binary.prn(), UpdateBinaryRequest.state(next));
        log.infof("Binary %s moved from %s to %s", binary.prn(), binary.state().wireName(), next.wireName());
        return updated;
    }

    private Binary awaitSignable(Binary binary) {
        log.infof("Waiting for the registry to hash %s", binary.prn());
        for (int attempt = 1; attempt <= polling.maxAttempts(); attempt++) {
            Optional<Binary> fetched;
            try {
                fetched = registry.getBinary(binary.prn());
            } catch (RegistryException e) {
                log.warnf("Polling %s failed (attempt %d of %d): %s", binary.prn(), attempt, polling.maxAttempts(), e.getMessage());
                fetched = Optional.empty();
            }
            BinaryState state = fetched.map(Binary::state).orElse(null);
            if (state == BinaryState.SIGNABLE || state == BinaryState.SIGNED) {
                return fetched.get();
            }
            if (state == BinaryState.DESTROYED) {
                throw new DepotException("Binary " + binary.prn() + " was destroyed while hashing");
            }
            log.debugf("Binary %s not signable yet (attempt %d of %d)", binary.prn(), attempt, polling.maxAttempts());
            if (attempt < polling.maxAttempts()) {
                sleep(binary);
            }
        }
        throw new HashingTimeoutException(binary.prn(), polling.maxAttempts());
    }

    private void sleep(Binary binary) {
        try {
            Thread.sleep(polling.interval().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DepotException("Interrupted while waiting for " + binary.prn() + " to become signable", e);
        }
    }
}
