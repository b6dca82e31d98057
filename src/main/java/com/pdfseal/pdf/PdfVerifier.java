package com.pdfseal.pdf;

import com.pdfseal.crypto.Algorithms;
import com.pdfseal.crypto.DigestAlgorithm;
import com.pdfseal.crypto.KeyMaterial;
import com.pdfseal.crypto.SignatureScheme;
import com.pdfseal.crypto.SigningKeyStore;
import com.pdfseal.error.PdfSealException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * Checks a document's seal against the resident public key. Never writes, never retries:
 * the result depends only on the bytes and the key.
 */
public final class PdfVerifier {

    private static final Logger log = LoggerFactory.getLogger(PdfVerifier.class);

    private final SigningKeyStore keyStore;
    private final Canonicalizer canonicalizer;

    public PdfVerifier(SigningKeyStore keyStore, Canonicalizer canonicalizer) {
        this.keyStore = Objects.requireNonNull(keyStore, "keyStore");
        this.canonicalizer = Objects.requireNonNull(canonicalizer, "canonicalizer");
    }

    public VerificationResult verify(byte[] pdfBytes) throws PdfSealException {
        log.info("[verify] {} bytes", pdfBytes == null ? 0 : pdfBytes.length);
        SealInspection inspection = canonicalizer.inspect(pdfBytes);
        if (!inspection.hasRecord()) {
            log.info("[verify] no seal record");
            return VerificationResult.notSigned();
        }
        if (inspection.isCorrupt()) {
            String detail = inspection.corruption().orElse("unknown");
            log.warn("[verify] seal record corrupt: {}", detail);
            return VerificationResult.corrupt(detail);
        }
        SignatureRecord record = inspection.record().orElseThrow();
        if (inspection.isModifiedAfterSealing()) {
            log.warn("[verify] {} revision(s) and {} stray byte(s) follow the sealed range, document changed after signing",
                    inspection.revisionsAfterSeal(), inspection.bytesAfterFinalEof());
            return VerificationResult.of(VerificationStatus.MODIFIED_AFTER_SIGNING, record);
        }

        KeyMaterial key = keyStore.snapshot();
        if (!key.keyId().equals(record.getKeyId())) {
            log.warn("[verify] record keyId={} but resident keyId={}", record.getKeyId(), key.keyId());
            return VerificationResult.of(VerificationStatus.KEY_MISMATCH, record);
        }

        DigestAlgorithm digestAlgorithm = Algorithms.requireDigest(record.getDigestAlgorithm());
        SignatureScheme scheme = Algorithms.requireSignatureScheme(record.getSignatureAlgorithm());
        boolean valid;
        try {
            byte[] actualDigest = inspection.range().digest(pdfBytes, digestAlgorithm);
            byte[] signedAttributes = record.getAttributes().withContentDigest(actualDigest).encode();
            valid = scheme.verify(signedAttributes, record.getSignature(), key.publicKey());
        } catch (GeneralSecurityException e) {
            throw new PdfSealException("Failed to verify signature: " + e.getMessage(), e);
        }

        VerificationStatus status = valid ? VerificationStatus.VALID : VerificationStatus.SIGNATURE_MISMATCH;
        log.info("[verify] signer='{}' time={} {} -> {}", record.getSignerName(), record.getTimestamp(),
                record.getSignatureAlgorithm(), status);
        return VerificationResult.of(status, record);
    }
}
