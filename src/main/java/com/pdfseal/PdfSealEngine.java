package com.pdfseal;

import com.pdfseal.crypto.Algorithms;
import com.pdfseal.crypto.KeyMaterial;
import com.pdfseal.crypto.KeyPersistence;
import com.pdfseal.crypto.SigningKeyStore;
import com.pdfseal.error.InvalidInputException;
import com.pdfseal.error.PdfSealException;
import com.pdfseal.pdf.Canonicalizer;
import com.pdfseal.pdf.PdfSigner;
import com.pdfseal.pdf.PdfVerifier;
import com.pdfseal.pdf.SignedDocument;
import com.pdfseal.pdf.VerificationResult;
import com.pdfseal.pdf.WatermarkRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for front ends: key lifecycle, sealing and verification over raw bytes and PEM text.
 * <p>
 * Each instance owns its own {@link SigningKeyStore}; nothing is shared between engines.
 */
public final class PdfSealEngine {

    private static final Logger log = LoggerFactory.getLogger(PdfSealEngine.class);

    private final SigningKeyStore keyStore;
    private final KeyPersistence persistence;
    private final PdfSigner signer;
    private final PdfVerifier verifier;

    private PdfSealEngine(SealOptions options, KeyPersistence persistence, Clock clock) {
        Objects.requireNonNull(options, "options");
        this.keyStore = new SigningKeyStore(options.getKeySize());
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        Canonicalizer canonicalizer = new Canonicalizer();
        WatermarkRenderer watermark = new WatermarkRenderer(options.getWatermarkFontSize(),
                options.getWatermarkFontPath(), options.isWatermarkAllPages());
        this.signer = new PdfSigner(keyStore, canonicalizer, watermark,
                Algorithms.requireDigest(options.getDigestAlgorithm()),
                Algorithms.requireSignatureScheme(options.getSignatureAlgorithm()), clock);
        this.verifier = new PdfVerifier(keyStore, canonicalizer);
    }

    /**
     * Creates an engine and loads the persisted keypair, if any. A persisted pair is checked exactly like an import.
     * A pair that fails those checks is logged and left on disk. The engine then starts without a key, so
     * {@link #generateKeypair()} or {@link #importKey(String, String)} can replace it.
     */
    public static PdfSealEngine open(SealOptions options, KeyPersistence persistence) throws PdfSealException {
        return open(options, persistence, Clock.systemUTC());
    }

    public static PdfSealEngine open(SealOptions options, KeyPersistence persistence, Clock clock)
            throws PdfSealException {
        PdfSealEngine engine = new PdfSealEngine(options, persistence, clock);
        Optional<KeyPersistence.StoredKeyPair> stored;
        try {
            stored = persistence.load();
        } catch (IOException e) {
            throw new PdfSealException("Failed to read stored keypair: " + e.getMessage(), e);
        }
        if (stored.isPresent()) {
            try {
                KeyMaterial material = engine.keyStore.readPem(stored.get().privateKeyPem(),
                        stored.get().publicKeyPem());
                engine.keyStore.install(material);
                log.info("[engine] loaded stored keypair keyId={}", material.keyId());
            } catch (PdfSealException e) {
                log.warn("[engine] stored keypair rejected, starting without a key: {}", e.getMessage());
            }
        }
        return engine;
    }

    public String generateKeypair() throws PdfSealException {
        KeyMaterial material = keyStore.newKeyPair();
        persist(material);
        keyStore.install(material);
        return material.publicKeyPem();
    }

    public String importKey(String privateKeyPem, String publicKeyPem) throws PdfSealException {
        KeyMaterial material = keyStore.readPem(privateKeyPem, publicKeyPem);
        persist(material);
        keyStore.install(material);
        return material.publicKeyPem();
    }

    public String exportKey() throws PdfSealException {
        return keyStore.exportPrivateKey();
    }

    public boolean hasKey() {
        return keyStore.hasKey();
    }

    public String getPublicKey() throws PdfSealException {
        return keyStore.publicKeyPem();
    }

    public SignResponse signPdf(SignRequest request) throws PdfSealException {
        if (request == null) {
            throw new InvalidInputException("Sign request must not be null");
        }
        SignedDocument signed = signer.sign(request.pdfBytes(), request.name(), request.extra());
        return new SignResponse(signed.getBytes(), SignatureInfo.from(signed.getRecord()));
    }

    public VerifyResponse verifyPdf(byte[] pdfBytes) throws PdfSealException {
        VerificationResult result = verifier.verify(pdfBytes);
        SignatureInfo info = result.getRecord().map(SignatureInfo::from).orElse(null);
        return new VerifyResponse(result.isSigned(), info, result.getMessage());
    }

    /** Full verification result, including the status enum. */
    public VerificationResult verify(byte[] pdfBytes) throws PdfSealException {
        return verifier.verify(pdfBytes);
    }

    private void persist(KeyMaterial material) throws PdfSealException {
        try {
            persistence.store(keyStore.encodePrivateKey(material), material.publicKeyPem());
        } catch (IOException e) {
            throw new PdfSealException("Failed to save keypair: " + e.getMessage(), e);
        }
    }
}
