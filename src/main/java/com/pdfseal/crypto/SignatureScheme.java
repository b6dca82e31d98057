package com.pdfseal.crypto;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Asymmetric signature capability. Implementations hash the message themselves.
 */
public interface SignatureScheme {

    /** Identifier persisted in seal records. */
    String id();

    byte[] sign(byte[] message, PrivateKey privateKey) throws GeneralSecurityException;

    /**
     * Returns {@code false} for a signature that does not match, including one that is not
     * even well formed for this scheme. Key problems are still thrown.
     */
    boolean verify(byte[] message, byte[] signature, PublicKey publicKey) throws GeneralSecurityException;
}
