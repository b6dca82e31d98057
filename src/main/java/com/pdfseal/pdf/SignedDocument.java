package com.pdfseal.pdf;

import java.util.Objects;

/**
 * Output of {@link PdfSigner}: the sealed file and the record embedded in it.
 */
public final class SignedDocument {

    private final byte[] bytes;
    private final SignatureRecord record;

    SignedDocument(byte[] bytes, SignatureRecord record) {
        this.bytes = Objects.requireNonNull(bytes, "bytes");
        this.record = Objects.requireNonNull(record, "record");
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    public SignatureRecord getRecord() {
        return record;
    }
}
