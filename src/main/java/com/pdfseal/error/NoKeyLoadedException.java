package com.pdfseal.error;

/**
 * An operation needed the resident keypair but none has been generated or imported.
 */
public class NoKeyLoadedException extends PdfSealException {

    public NoKeyLoadedException(String message) {
        super(message);
    }

    public NoKeyLoadedException(String message, Throwable cause) {
        super(message, cause);
    }
}
