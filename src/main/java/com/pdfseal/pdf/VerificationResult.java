package com.pdfseal.pdf;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link PdfVerifier#verify(byte[])}. A failed check is a result, not an exception; the record
 * is kept whenever one could be decoded so a tampered document still shows who sealed it.
 */
public final class VerificationResult {

    private final VerificationStatus status;
    private final SignatureRecord record;
    private final String detail;

    private VerificationResult(VerificationStatus status, SignatureRecord record, String detail) {
        this.status = Objects.requireNonNull(status, "status");
        this.record = record;
        this.detail = detail;
    }

    static VerificationResult notSigned() {
        return new VerificationResult(VerificationStatus.NOT_SIGNED, null, null);
    }

    static VerificationResult corrupt(String detail) {
        return new VerificationResult(VerificationStatus.RECORD_CORRUPT, null, detail);
    }

    static VerificationResult of(VerificationStatus status, SignatureRecord record) {
        return new VerificationResult(status, Objects.requireNonNull(record, "record"), null);
    }

    public boolean isSigned() {
        return status == VerificationStatus.VALID;
    }

    public VerificationStatus getStatus() {
        return status;
    }

    public Optional<SignatureRecord> getRecord() {
        return Optional.ofNullable(record);
    }

    public String getMessage() {
        return status.getMessage();
    }

    /** Why a record was judged corrupt, for logs and diagnostics. */
    public Optional<String> getDetail() {
        return Optional.ofNullable(detail);
    }

    @Override
    public String toString() {
        return "VerificationResult[" + status + (record == null ? "" : ", " + record) + "]";
    }
}
