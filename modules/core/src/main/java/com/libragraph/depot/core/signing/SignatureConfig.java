package com.libragraph.depot.core.signing;

import java.nio.file.Path;

/**
 * One signature a binary must carry before it is marked signed.
 */
public sealed interface SignatureConfig {

    /**
     * A signature computed elsewhere, e.g. taken from a bundle manifest.
     */
    record PreComputed(String keyId, String signature) implements SignatureConfig {
    }

    /**
     * Sign with a key pair named in the configuration.
     */
    record KeyPair(String keyPairName) implements SignatureConfig {
    }

    /**
     * Sign with an explicit private key file registered under {@code signingKeyPrn}.
     */
    record PrivateKey(String signingKeyPrn, Path privateKeyPath) implements SignatureConfig {
    }
}
