package com.pdfseal;

import com.pdfseal.crypto.Algorithms;
import com.pdfseal.crypto.SigningKeyStore;
import com.pdfseal.pdf.WatermarkRenderer;

import java.nio.file.Path;

/**
 * Engine settings. Defaults match what a seal written without any options uses.
 */
public class SealOptions {

    private int keySize = SigningKeyStore.DEFAULT_KEY_SIZE;
    private String digestAlgorithm = Algorithms.DEFAULT_DIGEST;
    private String signatureAlgorithm = Algorithms.DEFAULT_SIGNATURE;
    private float watermarkFontSize = WatermarkRenderer.DEFAULT_FONT_SIZE;
    private Path watermarkFontPath;
    private boolean watermarkAllPages;

    public int getKeySize() {
        return keySize;
    }

    public void setKeySize(int keySize) {
        this.keySize = keySize;
    }

    public String getDigestAlgorithm() {
        return digestAlgorithm;
    }

    public void setDigestAlgorithm(String digestAlgorithm) {
        this.digestAlgorithm = digestAlgorithm;
    }

    public String getSignatureAlgorithm() {
        return signatureAlgorithm;
    }

    public void setSignatureAlgorithm(String signatureAlgorithm) {
        this.signatureAlgorithm = signatureAlgorithm;
    }

    public float getWatermarkFontSize() {
        return watermarkFontSize;
    }

    public void setWatermarkFontSize(float watermarkFontSize) {
        this.watermarkFontSize = watermarkFontSize;
    }

    public Path getWatermarkFontPath() {
        return watermarkFontPath;
    }

    public void setWatermarkFontPath(Path watermarkFontPath) {
        this.watermarkFontPath = watermarkFontPath;
    }

    public boolean isWatermarkAllPages() {
        return watermarkAllPages;
    }

    public void setWatermarkAllPages(boolean watermarkAllPages) {
        this.watermarkAllPages = watermarkAllPages;
    }
}
