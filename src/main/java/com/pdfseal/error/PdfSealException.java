package com.pdfseal.error;

/**
 * Base type for every failure the sealing engine reports to its caller.
 * <p>
 * Messages are user facing. They never contain key material.
 */
public class PdfSealException extends Exception {

    public PdfSealException(String message) {
        super(message);
    }

    public PdfSealException(String message, Throwable cause) {
        super(message, cause);
    }
}
