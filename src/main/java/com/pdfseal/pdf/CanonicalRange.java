package com.pdfseal.pdf;

import com.pdfseal.crypto.DigestAlgorithm;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The bytes of a document that a seal signs: everything before the seal's own incremental update.
 * <p>
 * Derived from the document alone, never stored. Spans are ordered and do not overlap.
 */
public final class CanonicalRange {

    private final List<ByteSpan> spans;
    private final int documentLength;

    private CanonicalRange(List<ByteSpan> spans, int documentLength) {
        this.spans = List.copyOf(spans);
        this.documentLength = documentLength;
        int cursor = 0;
        for (ByteSpan span : this.spans) {
            if (span.offset() < cursor || span.end() > documentLength) {
                throw new IllegalArgumentException("Span " + span + " out of order or outside document of "
                        + documentLength + " bytes");
            }
            cursor = span.end();
        }
    }

    public static CanonicalRange whole(int documentLength) {
        return new CanonicalRange(Collections.singletonList(new ByteSpan(0, documentLength)), documentLength);
    }

    public static CanonicalRange prefix(int length, int documentLength) {
        return new CanonicalRange(Collections.singletonList(new ByteSpan(0, length)), documentLength);
    }

    public List<ByteSpan> spans() {
        return spans;
    }

    public int documentLength() {
        return documentLength;
    }

    /** Number of bytes covered. */
    public int length() {
        int total = 0;
        for (ByteSpan span : spans) {
            total += span.length();
        }
        return total;
    }

    public boolean isWholeDocument() {
        return length() == documentLength;
    }

    /** True when the range is one span starting at byte 0, i.e. an earlier revision of the file. */
    public boolean isPrefix() {
        return spans.size() == 1 && spans.get(0).offset() == 0;
    }

    public byte[] digest(byte[] document, DigestAlgorithm algorithm) throws NoSuchAlgorithmException {
        Objects.requireNonNull(document, "document");
        if (document.length != documentLength) {
            throw new IllegalArgumentException("Range computed for " + documentLength
                    + " bytes applied to a document of " + document.length);
        }
        MessageDigest digest = algorithm.newMessageDigest();
        for (ByteSpan span : spans) {
            digest.update(document, span.offset(), span.length());
        }
        return digest.digest();
    }

    @Override
    public String toString() {
        return "CanonicalRange" + spans + " of " + documentLength;
    }
}
