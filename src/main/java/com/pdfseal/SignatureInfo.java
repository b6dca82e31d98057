package com.pdfseal;

import com.pdfseal.pdf.SignatureRecord;

/**
 * Display form of a seal record. {@code signature} is lower-case hex.
 */
public record SignatureInfo(String signerName, String timestamp, String extra, String signature) {

    static SignatureInfo from(SignatureRecord record) {
        return new SignatureInfo(record.getSignerName(), record.getTimestamp(), record.getExtra().orElse(""),
                record.getSignatureHex());
    }
}
