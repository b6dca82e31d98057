package com.pdfseal.error;

/**
 * The platform could not produce a fresh RSA keypair (no RSA provider or secure random source).
 */
public class KeyGenerationException extends PdfSealException {

    public KeyGenerationException(String message) {
        super(message);
    }

    public KeyGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
