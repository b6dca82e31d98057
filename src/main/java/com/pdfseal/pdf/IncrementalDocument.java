package com.pdfseal.pdf;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only view of a document under construction: slices of the caller's original bytes followed
 * by new update sections. Nothing is copied until {@link #toByteArray()}.
 */
public final class IncrementalDocument {

    private final List<Segment> segments = new ArrayList<>();
    private int length;

    private IncrementalDocument() {
    }

    /**
     * Starts from the canonical range of {@code base}; bytes outside the range (a previous seal update) are dropped.
     */
    public static IncrementalDocument over(byte[] base, CanonicalRange range) {
        Objects.requireNonNull(base, "base");
        IncrementalDocument document = new IncrementalDocument();
        for (ByteSpan span : range.spans()) {
            document.add(new Segment(base, span));
        }
        return document;
    }

    public IncrementalDocument append(byte[] update) {
        Objects.requireNonNull(update, "update");
        add(new Segment(update, new ByteSpan(0, update.length)));
        return this;
    }

    public int length() {
        return length;
    }

    public byte[] toByteArray() {
        byte[] out = new byte[length];
        int cursor = 0;
        for (Segment segment : segments) {
            System.arraycopy(segment.source, segment.span.offset(), out, cursor, segment.span.length());
            cursor += segment.span.length();
        }
        return out;
    }

    private void add(Segment segment) {
        if ((long) length + segment.span.length() > Integer.MAX_VALUE) {
            throw new IllegalStateException("Document exceeds 2 GiB");
        }
        segments.add(segment);
        length += segment.span.length();
    }

    private static final class Segment {
        private final byte[] source;
        private final ByteSpan span;

        private Segment(byte[] source, ByteSpan span) {
            if (span.end() > source.length) {
                throw new IllegalArgumentException("Span " + span + " exceeds source of " + source.length + " bytes");
            }
            this.source = source;
            this.span = span;
        }
    }
}
