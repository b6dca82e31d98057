package com.pdfseal.pdf;

import org.bouncycastle.util.encoders.Hex;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A seal: the signed attributes plus the signature over their DER encoding.
 * Immutable; one per sealed document.
 */
public final class SignatureRecord {

    private final SealedAttributes attributes;
    private final byte[] signature;

    public SignatureRecord(SealedAttributes attributes, byte[] signature) {
        this.attributes = Objects.requireNonNull(attributes, "attributes");
        this.signature = Objects.requireNonNull(signature, "signature").clone();
    }

    public SealedAttributes getAttributes() {
        return attributes;
    }

    public String getSignerName() {
        return attributes.getSignerName();
    }

    /** ISO-8601 instant exactly as written at signing time. */
    public String getTimestamp() {
        return attributes.getTimestamp();
    }

    public Instant getInstant() {
        return Instant.parse(attributes.getTimestamp());
    }

    public Optional<String> getExtra() {
        return Optional.ofNullable(attributes.getExtra());
    }

    public byte[] getSignature() {
        return signature.clone();
    }

    public String getSignatureHex() {
        return Hex.toHexString(signature);
    }

    public String getDigestAlgorithm() {
        return attributes.getDigestAlgorithm();
    }

    public String getSignatureAlgorithm() {
        return attributes.getSignatureAlgorithm();
    }

    public String getKeyId() {
        return attributes.getKeyId();
    }

    public int getSealedLength() {
        return attributes.getSealedLength();
    }

    @Override
    public String toString() {
        return "SignatureRecord[signer=" + getSignerName() + ", timestamp=" + getTimestamp()
                + ", digest=" + getDigestAlgorithm() + ", signature=" + getSignatureAlgorithm()
                + ", keyId=" + getKeyId() + ", sealedLength=" + getSealedLength() + "]";
    }
}
