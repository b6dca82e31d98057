package com.pdfseal.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Hash function used over the canonical byte range of a document.
 * The {@link #id()} is what a seal record stores, so it must never change for a given algorithm.
 */
public interface DigestAlgorithm {

    String id();

    /** A fresh digest instance; callers feed it span by span. */
    MessageDigest newMessageDigest() throws NoSuchAlgorithmException;

    default byte[] digest(byte[] data) throws NoSuchAlgorithmException {
        return newMessageDigest().digest(data);
    }
}
