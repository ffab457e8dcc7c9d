package com.libragraph.depot.core.signing;

import com.libragraph.depot.core.ValidationException;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.crypto.params.AsymmetricKeyParameter;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.crypto.util.PrivateKeyFactory;
import org.bouncycastle.openssl.PEMParser;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Ed25519 signatures with PKCS#8 PEM private keys, via the BouncyCastle lightweight API.
 */
public class Ed25519BinarySigner implements BinarySigner {

    @Override
    public byte[] sign(Path privateKeyPath, byte[] message) {
        Ed25519PrivateKeyParameters key = loadKey(privateKeyPath);
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, key);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    @Override
    public void checkKey(Path privateKeyPath) {
        loadKey(privateKeyPath);
    }

    static Ed25519PrivateKeyParameters loadKey(Path path) {
        Object parsed;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.US_ASCII);
             PEMParser parser = new PEMParser(reader)) {
            parsed = parser.readObject();
        } catch (IOException e) {
            throw new ValidationException("Failed to read private key " + path + ": " + e.getMessage(), e);
        }
        if (!(parsed instanceof PrivateKeyInfo info)) {
            throw new ValidationException("Private key " + path + " is not a PKCS#8 PEM private key");
        }
        AsymmetricKeyParameter key;
        try {
            key = PrivateKeyFactory.createKey(info);
        } catch (IOException e) {
            throw new ValidationException("Failed to decode private key " + path + ": " + e.getMessage(), e);
        }
        if (!(key instanceof Ed25519PrivateKeyParameters ed25519)) {
            throw new ValidationException("Private key " + path + " is not an Ed25519 key");
        }
        return ed25519;
    }
}
