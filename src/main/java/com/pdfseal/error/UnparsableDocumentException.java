package com.pdfseal.error;

/**
 * The bytes do not form a PDF with a recognisable trailer.
 */
public class UnparsableDocumentException extends PdfSealException {

    public UnparsableDocumentException(String message) {
        super(message);
    }

    public UnparsableDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
