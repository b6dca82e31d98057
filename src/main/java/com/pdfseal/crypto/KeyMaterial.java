package com.pdfseal.crypto;

import org.bouncycastle.util.encoders.Hex;

import java.security.KeyPair;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Objects;

/**
 * Immutable snapshot of the resident keypair.
 * <p>
 * A sign or verify call takes one snapshot up front and uses it throughout, so a concurrent
 * {@code generate()} or {@code import} cannot hand it a private key from one pair and a
 * public key from another.
 */
public final class KeyMaterial {

    private final KeyPair keyPair;
    private final String publicKeyPem;
    private final String keyId;

    KeyMaterial(KeyPair keyPair) {
        this.keyPair = Objects.requireNonNull(keyPair, "keyPair");
        this.publicKeyPem = PemCodec.encodePublicKey(keyPair.getPublic());
        this.keyId = keyIdOf(keyPair.getPublic());
    }

    public PrivateKey privateKey() {
        return keyPair.getPrivate();
    }

    public PublicKey publicKey() {
        return keyPair.getPublic();
    }

    public String publicKeyPem() {
        return publicKeyPem;
    }

    /** Lower-case hex SHA-256 of the DER SubjectPublicKeyInfo. */
    public String keyId() {
        return keyId;
    }

    public int keySize() {
        return ((RSAPublicKey) keyPair.getPublic()).getModulus().bitLength();
    }

    public static String keyIdOf(PublicKey publicKey) {
        try {
            return Hex.toHexString(MessageDigest.getInstance("SHA-256").digest(publicKey.getEncoded()));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    @Override
    public String toString() {
        return "KeyMaterial[keyId=" + keyId + ", bits=" + keySize() + "]";
    }
}
