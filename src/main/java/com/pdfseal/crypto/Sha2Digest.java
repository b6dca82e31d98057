package com.pdfseal.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-2 family digest (SHA-256, SHA-384 or SHA-512).
 */
public final class Sha2Digest implements DigestAlgorithm {

    private final String algorithm;

    public Sha2Digest(String algorithm) {
        if (!"SHA-256".equals(algorithm) && !"SHA-384".equals(algorithm) && !"SHA-512".equals(algorithm)) {
            throw new IllegalArgumentException("Unsupported SHA-2 variant: " + algorithm);
        }
        this.algorithm = algorithm;
    }

    @Override
    public String id() {
        return algorithm;
    }

    @Override
    public MessageDigest newMessageDigest() throws NoSuchAlgorithmException {
        return MessageDigest.getInstance(algorithm);
    }

    @Override
    public String toString() {
        return algorithm;
    }
}
