package com.pdfseal.pdf;

import com.itextpdf.commons.exceptions.ITextException;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.StampingProperties;
import com.pdfseal.crypto.DigestAlgorithm;
import com.pdfseal.crypto.KeyMaterial;
import com.pdfseal.crypto.SignatureScheme;
import com.pdfseal.crypto.SigningKeyStore;
import com.pdfseal.error.InvalidInputException;
import com.pdfseal.error.PdfSealException;
import com.pdfseal.error.UnparsableDocumentException;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Objects;

/**
 * Seals a PDF: hashes its canonical range, signs the result with the resident key and appends one
 * incremental update that carries the seal record and the watermark.
 * <p>
 * The caller's array is only ever read. Any failure leaves no output behind.
 */
public final class PdfSigner {

    private static final Logger log = LoggerFactory.getLogger(PdfSigner.class);

    private final SigningKeyStore keyStore;
    private final Canonicalizer canonicalizer;
    private final WatermarkRenderer watermarkRenderer;
    private final DigestAlgorithm digestAlgorithm;
    private final SignatureScheme signatureScheme;
    private final Clock clock;

    public PdfSigner(SigningKeyStore keyStore, Canonicalizer canonicalizer, WatermarkRenderer watermarkRenderer,
                     DigestAlgorithm digestAlgorithm, SignatureScheme signatureScheme, Clock clock) {
        this.keyStore = Objects.requireNonNull(keyStore, "keyStore");
        this.canonicalizer = Objects.requireNonNull(canonicalizer, "canonicalizer");
        this.watermarkRenderer = Objects.requireNonNull(watermarkRenderer, "watermarkRenderer");
        this.digestAlgorithm = Objects.requireNonNull(digestAlgorithm, "digestAlgorithm");
        this.signatureScheme = Objects.requireNonNull(signatureScheme, "signatureScheme");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SignedDocument sign(byte[] pdfBytes, String signerName, String extra) throws PdfSealException {
        KeyMaterial key = keyStore.snapshot();
        if (signerName == null || signerName.isBlank()) {
            throw new InvalidInputException("Signer name must not be empty");
        }
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new InvalidInputException("PDF data must not be empty");
        }

        SealInspection inspection = canonicalizer.inspect(pdfBytes);
        CanonicalRange range = inspection.range();
        if (!range.isPrefix()) {
            throw new IllegalStateException("Only prefix ranges can carry an incremental update: " + range);
        }
        if (inspection.isModifiedAfterSealing()) {
            log.warn("[sign] replacing existing seal discards {} revision(s) made after it ({} byte(s) after offset {})",
                    Math.max(0, inspection.revisionsAfterSeal() - 1), pdfBytes.length - range.length(), range.length());
        } else if (inspection.hasRecord()) {
            log.info("[sign] replacing existing seal, dropping {} byte(s) after offset {}",
                    pdfBytes.length - range.length(), range.length());
        }

        String timestamp = clock.instant().truncatedTo(ChronoUnit.MILLIS).toString();
        SignatureRecord record;
        try {
            byte[] contentDigest = range.digest(pdfBytes, digestAlgorithm);
            SealedAttributes attributes = new SealedAttributes(SealedAttributes.CURRENT_VERSION,
                    digestAlgorithm.id(), signatureScheme.id(), contentDigest, range.length(), key.keyId(),
                    signerName.trim(), timestamp, extra);
            record = new SignatureRecord(attributes, signatureScheme.sign(attributes.encode(), key.privateKey()));
            log.info("[sign] signer='{}' time={} range=[0 {}] {}={} keyId={}", record.getSignerName(), timestamp,
                    range.length(), digestAlgorithm.id(), Hex.toHexString(contentDigest), key.keyId());
        } catch (GeneralSecurityException e) {
            throw new PdfSealException("Failed to sign document: " + e.getMessage(), e);
        }

        byte[] update = writeSealUpdate(pdfBytes, range.length(), record);
        IncrementalDocument document = IncrementalDocument.over(pdfBytes, range).append(update);
        log.info("[sign] sealed document {}B = {}B content + {}B update", document.length(), range.length(),
                update.length);
        return new SignedDocument(document.toByteArray(), record);
    }

    /**
     * Lets iText append the update to the canonical prefix, then returns only the appended bytes.
     */
    private byte[] writeSealUpdate(byte[] pdfBytes, int prefixLength, SignatureRecord record) throws PdfSealException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(prefixLength + 16 * 1024);
        try (PdfDocument pdf = new PdfDocument(
                new PdfReader(new ByteArrayInputStream(pdfBytes, 0, prefixLength)),
                new PdfWriter(out),
                new StampingProperties().useAppendMode())) {
            if (pdf.getNumberOfPages() == 0) {
                throw new InvalidInputException("PDF has no pages");
            }
            watermarkRenderer.render(pdf, watermarkRenderer.composeLines(record));
            PdfDictionary recordDict = SealRecordCodec.encode(record, pdf);
            pdf.getCatalog().put(SealRecordCodec.CATALOG_KEY, recordDict);
            pdf.getCatalog().setModified();
            // a plain indirect object, never packed into an object stream
            recordDict.flush(false);
        } catch (IOException | ITextException e) {
            throw new UnparsableDocumentException("Failed to write seal into PDF: " + e.getMessage(), e);
        }

        byte[] written = out.toByteArray();
        requirePrefixUnchanged(pdfBytes, prefixLength, written);
        return Arrays.copyOfRange(written, prefixLength, written.length);
    }

    private static void requirePrefixUnchanged(byte[] original, int prefixLength, byte[] written) {
        if (written.length <= prefixLength
                || !Arrays.equals(original, 0, prefixLength, written, 0, prefixLength)) {
            throw new IllegalStateException("Incremental write altered the first " + prefixLength + " bytes");
        }
    }
}
