package com.pdfseal.error;

/**
 * The imported private key does not belong to the imported public key.
 */
public class KeyMismatchException extends PdfSealException {

    public KeyMismatchException(String message) {
        super(message);
    }

    public KeyMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
