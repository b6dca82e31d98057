package com.pdfseal.error;

/**
 * Caller supplied input the engine cannot work with, such as a blank signer name.
 */
public class InvalidInputException extends PdfSealException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
