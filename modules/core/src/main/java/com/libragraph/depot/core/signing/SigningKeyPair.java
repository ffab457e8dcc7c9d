package com.libragraph.depot.core.signing;

import java.nio.file.Path;

/**
 * A configured signing key: the registry's name for it and the local PKCS#8 PEM private key.
 */
public record SigningKeyPair(String signingKeyPrn, Path privateKeyPath) {
}
