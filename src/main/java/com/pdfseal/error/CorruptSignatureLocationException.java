package com.pdfseal.error;

/**
 * A seal record was found but its declared byte range does not fit inside the document.
 */
public class CorruptSignatureLocationException extends PdfSealException {

    public CorruptSignatureLocationException(String message) {
        super(message);
    }

    public CorruptSignatureLocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
