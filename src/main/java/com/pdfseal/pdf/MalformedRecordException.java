package com.pdfseal.pdf;

/**
 * A seal record dictionary is present but one of its entries cannot be used.
 */
final class MalformedRecordException extends Exception {

    MalformedRecordException(String message) {
        super(message);
    }

    MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
