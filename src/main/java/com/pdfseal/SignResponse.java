package com.pdfseal;

public record SignResponse(byte[] signedPdf, SignatureInfo signatureInfo) {
}
