package com.libragraph.depot.core.signing;

import com.libragraph.depot.core.ValidationException;
import com.libragraph.depot.core.registry.RegistryClient;
import com.libragraph.depot.core.registry.model.Binary;
import com.libragraph.depot.core.registry.model.CreateSignatureRequest;
import com.libragraph.depot.core.registry.model.UpdateBinaryRequest;
import com.libragraph.depot.types.BinaryState;
import org.apache.commons.codec.binary.Hex;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Attaches every configured signature to a signable binary, then marks it signed.
 *
 * <p>Computed signatures cover the UTF-8 bytes of the binary's uppercase hex SHA-256.
 * Signatures the binary already carries are not submitted again. If any signature fails the
 * binary keeps its state and a {@link SignatureAggregateException} names the failed keys.
 */
public class SignatureOrchestrator {

    private static final Logger log = Logger.getLogger(SignatureOrchestrator.class);

    private final RegistryClient registry;
    private final BinarySigner signer;
    private final Map<String, SigningKeyPair> keyPairs;

    public SignatureOrchestrator(RegistryClient registry, BinarySigner signer, Map<String, SigningKeyPair> keyPairs) {
        this.registry = registry;
        this.signer = signer;
        this.keyPairs = Map.copyOf(keyPairs);
    }

    /**
     * Resolves every named key pair and loads every private key, so a bad signing setup fails
     * before the binary is touched.
     */
    public void validate(List<SignatureConfig> configs) {
        for (SignatureConfig config : configs) {
            if (config instanceof SignatureConfig.PrivateKey p) {
                signer.checkKey(p.privateKeyPath());
            } else if (config instanceof SignatureConfig.KeyPair k) {
                signer.checkKey(keyPair(k.keyPairName()).privateKeyPath());
            }
        }
    }

    public Binary sign(Binary binary, List<SignatureConfig> configs) {
        if (configs == null || configs.isEmpty()) {
            throw new ValidationException("No signatures configured for " + binary.describe());
        }
        List<String> failed = new ArrayList<>();
        List<Exception> causes = new ArrayList<>();
        int created = 0;

        for (SignatureConfig config : configs) {
            String keyIdentifier = keyIdentifier(config);
            try {
                if (binary.hasSignatureFor(keyIdentifier)) {
                    log.debugf("Binary %s already signed by %s", binary.prn(), keyIdentifier);
                    continue;
                }
                registry.createBinarySignature(request(binary, config));
                created++;
            } catch (RuntimeException e) {
                log.errorf("Signature with key %s for binary %s failed: %s", keyIdentifier, binary.prn(), e.getMessage());
                failed.add(keyIdentifier);
                causes.add(e);
            }
        }
        if (!failed.isEmpty()) {
            throw new SignatureAggregateException(binary.prn(), failed, causes);
        }

        binary.state().requireTransition(BinaryState.SIGNED);
        Binary signed = registry.updateBinary(binary.prn(), UpdateBinaryRequest.state(BinaryState.SIGNED));
        log.infof("Signed binary %s (%d new signatures, %d configured)", binary.prn(), created, configs.size());
        return signed;
    }

    private String keyIdentifier(SignatureConfig config) {
        if (config instanceof SignatureConfig.PreComputed p) {
            return p.keyId();
        }
        if (config instanceof SignatureConfig.PrivateKey p) {
            return p.signingKeyPrn();
        }
        SignatureConfig.KeyPair k = (SignatureConfig.KeyPair) config;
        SigningKeyPair pair = keyPairs.get(k.keyPairName());
        return pair != null ? pair.signingKeyPrn() : k.keyPairName();
    }

    private CreateSignatureRequest request(Binary binary, SignatureConfig config) {
        if (config instanceof SignatureConfig.PreComputed p) {
            return CreateSignatureRequest.withKeyId(binary.prn(), p.keyId(), p.signature());
        }
        String signingKeyPrn;
        Path privateKey;
        if (config instanceof SignatureConfig.PrivateKey p) {
            signingKeyPrn = p.signingKeyPrn();
            privateKey = p.privateKeyPath();
        } else {
            SigningKeyPair pair = keyPair(((SignatureConfig.KeyPair) config).keyPairName());
            signingKeyPrn = pair.signingKeyPrn();
            privateKey = pair.privateKeyPath();
        }
        if (binary.hash() == null) {
            throw new ValidationException("Cannot sign " + binary.describe() + " before its hash is known");
        }
        byte[] message = binary.hash().toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
        String signature = Hex.encodeHexString(signer.sign(privateKey, message), false);
        return CreateSignatureRequest.withSigningKey(binary.prn(), signingKeyPrn, signature);
    }

    private SigningKeyPair keyPair(String name) {
        SigningKeyPair pair = keyPairs.get(name);
        if (pair == null) {
            throw new ValidationException("Signing key pair '" + name + "' is not configured");
        }
        return pair;
    }
}
