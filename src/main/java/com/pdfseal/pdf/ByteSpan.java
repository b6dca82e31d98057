package com.pdfseal.pdf;

/**
 * A half-open slice {@code [offset, offset + length)} of a document's bytes.
 */
public record ByteSpan(int offset, int length) {

    public ByteSpan {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Negative span: offset=" + offset + " length=" + length);
        }
    }

    public int end() {
        return offset + length;
    }
}
