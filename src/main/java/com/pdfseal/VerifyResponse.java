package com.pdfseal;

import java.util.Optional;

/**
 * @param signatureInfo the decoded record, or {@code null} when there is none to show
 */
public record VerifyResponse(boolean isSigned, SignatureInfo signatureInfo, String message) {

    public Optional<SignatureInfo> info() {
        return Optional.ofNullable(signatureInfo);
    }
}
