package com.pdfseal.error;

/**
 * A PEM block could not be parsed into a usable RSA key, or the key is too weak.
 */
public class MalformedKeyException extends PdfSealException {

    public MalformedKeyException(String message) {
        super(message);
    }

    public MalformedKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
