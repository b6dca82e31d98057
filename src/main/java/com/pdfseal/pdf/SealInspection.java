package com.pdfseal.pdf;

import java.util.Objects;
import java.util.Optional;

/**
 * What the {@link Canonicalizer} found in a document: the canonical range and, when a seal
 * record is present, either the decoded record or why it could not be decoded.
 */
public final class SealInspection {

    private final CanonicalRange range;
    private final boolean recordPresent;
    private final SignatureRecord record;
    private final String corruption;
    private final int revisionsAfterSeal;
    private final int bytesAfterFinalEof;

    private SealInspection(CanonicalRange range, boolean recordPresent, SignatureRecord record,
                           String corruption, int revisionsAfterSeal, int bytesAfterFinalEof) {
        this.range = Objects.requireNonNull(range, "range");
        this.recordPresent = recordPresent;
        this.record = record;
        this.corruption = corruption;
        this.revisionsAfterSeal = revisionsAfterSeal;
        this.bytesAfterFinalEof = bytesAfterFinalEof;
    }

    static SealInspection unsealed(CanonicalRange range) {
        return new SealInspection(range, false, null, null, 0, 0);
    }

    static SealInspection sealed(CanonicalRange range, SignatureRecord record, int revisionsAfterSeal,
                                 int bytesAfterFinalEof) {
        return new SealInspection(range, true, Objects.requireNonNull(record, "record"), null, revisionsAfterSeal,
                bytesAfterFinalEof);
    }

    static SealInspection corrupt(CanonicalRange range, String corruption, int revisionsAfterSeal,
                                  int bytesAfterFinalEof) {
        return new SealInspection(range, true, null, Objects.requireNonNull(corruption, "corruption"),
                revisionsAfterSeal, bytesAfterFinalEof);
    }

    public CanonicalRange range() {
        return range;
    }

    public boolean hasRecord() {
        return recordPresent;
    }

    public Optional<SignatureRecord> record() {
        return Optional.ofNullable(record);
    }

    public boolean isCorrupt() {
        return corruption != null;
    }

    public Optional<String> corruption() {
        return Optional.ofNullable(corruption);
    }

    /**
     * Revisions ({@code %%EOF} markers) after the sealed range. A freshly sealed document has exactly one:
     * the seal update itself.
     */
    public int revisionsAfterSeal() {
        return revisionsAfterSeal;
    }

    /** Bytes other than line ends after the last {@code %%EOF}. */
    public int bytesAfterFinalEof() {
        return bytesAfterFinalEof;
    }

    /**
     * True when another revision follows the seal update or anything but line ends follows its {@code %%EOF}.
     */
    public boolean isModifiedAfterSealing() {
        return revisionsAfterSeal > 1 || bytesAfterFinalEof > 0;
    }
}
