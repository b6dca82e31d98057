package com.pdfseal.pdf;

import com.itextpdf.commons.exceptions.ITextException;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.pdfseal.error.CorruptSignatureLocationException;
import com.pdfseal.error.UnparsableDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Decides which bytes of a document a seal covers.
 * <p>
 * An unsealed document is covered whole. A sealed one is covered up to the offset its record
 * declares in {@code /ByteRange [0 L]}, which is where the seal's incremental update begins.
 * Verifying an untouched sealed file therefore hashes exactly what was hashed at signing, and
 * re-sealing drops the previous seal instead of folding it into the new digest.
 */
public final class Canonicalizer {

    private static final Logger log = LoggerFactory.getLogger(Canonicalizer.class);

    public CanonicalRange computeRange(byte[] pdf) throws UnparsableDocumentException, CorruptSignatureLocationException {
        return inspect(pdf).range();
    }

    /**
     * Finds the seal record and the range it covers. When the document as a whole no longer parses but its
     * final revision still holds a record, that record is returned over its declared range, so damage inside
     * the signed bytes reads as a digest mismatch rather than an unreadable file.
     */
    public SealInspection inspect(byte[] pdf) throws UnparsableDocumentException, CorruptSignatureLocationException {
        try {
            return inspectDocument(pdf);
        } catch (UnparsableDocumentException e) {
            SealInspection recovered = inspectFinalRevision(pdf);
            if (recovered == null) {
                throw e;
            }
            log.warn("[canonical] document does not parse ({}), using the seal record of its final revision",
                    e.getMessage());
            return recovered;
        }
    }

    private SealInspection inspectDocument(byte[] pdf)
            throws UnparsableDocumentException, CorruptSignatureLocationException {
        PdfTailLocator.TailInfo tail = PdfTailLocator.locate(pdf);
        log.debug("[canonical] {} bytes, {} at {}, eof at {}", pdf.length, tail.getType(), tail.getActualOffset(),
                tail.getEofOffset());

        try (PdfDocument document = new PdfDocument(new PdfReader(new ByteArrayInputStream(pdf)))) {
            PdfDictionary recordDict = document.getCatalog().getPdfObject().getAsDictionary(SealRecordCodec.CATALOG_KEY);
            if (recordDict == null) {
                return SealInspection.unsealed(CanonicalRange.whole(pdf.length));
            }
            return inspectRecord(pdf, recordDict);
        } catch (IOException | ITextException e) {
            throw new UnparsableDocumentException("Failed to load PDF: " + e.getMessage(), e);
        }
    }

    private SealInspection inspectFinalRevision(byte[] pdf) throws CorruptSignatureLocationException {
        if (pdf == null) {
            return null;
        }
        int dictStart = PdfTailLocator.findTypedDictionaryInFinalRevision(pdf, SealRecordCodec.RECORD_TYPE.getValue());
        if (dictStart < 0) {
            return null;
        }
        PdfDictionary recordDict;
        try {
            recordDict = SealRecordCodec.parseDictionary(pdf, dictStart);
        } catch (IOException | ITextException e) {
            log.debug("[canonical] final revision record at {} unreadable: {}", dictStart, e.getMessage());
            return null;
        }
        return inspectRecord(pdf, recordDict);
    }

    private SealInspection inspectRecord(byte[] pdf, PdfDictionary recordDict) throws CorruptSignatureLocationException {
        long[] byteRange;
        try {
            byteRange = SealRecordCodec.readByteRange(recordDict);
        } catch (MalformedRecordException e) {
            log.warn("[canonical] seal record without usable byte range: {}", e.getMessage());
            return SealInspection.corrupt(CanonicalRange.whole(pdf.length), e.getMessage(), 0, 0);
        }
        int sealedLength = requireInBounds(byteRange, pdf.length);
        CanonicalRange range = CanonicalRange.prefix(sealedLength, pdf.length);
        int revisionsAfterSeal = PdfTailLocator.countEofMarkers(pdf, sealedLength);
        int trailingBytes = PdfTailLocator.countBytesAfterFinalEof(pdf);

        try {
            SignatureRecord record = SealRecordCodec.decode(recordDict, sealedLength);
            log.debug("[canonical] sealed range {} of {} bytes, {} revision(s) and {} stray byte(s) after it",
                    sealedLength, pdf.length, revisionsAfterSeal, trailingBytes);
            return SealInspection.sealed(range, record, revisionsAfterSeal, trailingBytes);
        } catch (MalformedRecordException e) {
            log.warn("[canonical] seal record corrupt: {}", e.getMessage());
            return SealInspection.corrupt(range, e.getMessage(), revisionsAfterSeal, trailingBytes);
        }
    }

    private static int requireInBounds(long[] byteRange, int documentLength) throws CorruptSignatureLocationException {
        long start = byteRange[0];
        long length = byteRange[1];
        if (start != 0) {
            throw new CorruptSignatureLocationException("Seal byte range must start at 0, found " + start);
        }
        // the seal's own update has to follow the range, so L == documentLength is as wrong as L > documentLength
        if (length <= 0 || length >= documentLength) {
            throw new CorruptSignatureLocationException("Seal byte range [0 " + length
                    + "] lies outside the document of " + documentLength + " bytes");
        }
        return (int) length;
    }
}
