package com.pdfseal;

/**
 * @param pdfBytes document to seal
 * @param name     signer name shown in the watermark, must not be blank
 * @param extra    optional free text, may be {@code null}
 */
public record SignRequest(byte[] pdfBytes, String name, String extra) {
}
