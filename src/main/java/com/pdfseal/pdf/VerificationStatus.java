package com.pdfseal.pdf;

public enum VerificationStatus {
    VALID("valid"),
    NOT_SIGNED("not signed"),
    RECORD_CORRUPT("signature record corrupt"),
    SIGNATURE_MISMATCH("signature does not match content"),
    KEY_MISMATCH("signed with a different key"),
    MODIFIED_AFTER_SIGNING("document modified after signing");

    private final String message;

    VerificationStatus(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
