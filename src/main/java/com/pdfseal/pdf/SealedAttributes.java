package com.pdfseal.pdf;

import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.DEROctetString;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.asn1.DERUTF8String;

import java.io.IOException;
import java.util.Objects;

/**
 * The fields a seal signature covers, encoded as one DER sequence:
 * <pre>
 * SealedAttributes ::= SEQUENCE {
 *     version            INTEGER,
 *     digestAlgorithm    UTF8String,
 *     signatureAlgorithm UTF8String,
 *     contentDigest      OCTET STRING,
 *     sealedLength       INTEGER,
 *     keyId              UTF8String,
 *     signerName         UTF8String,
 *     timestamp          UTF8String,
 *     extra              UTF8String }
 * </pre>
 * The algorithm identifiers and the range length are signed along with the digest.
 */
public final class SealedAttributes {

    public static final int CURRENT_VERSION = 1;

    private final int version;
    private final String digestAlgorithm;
    private final String signatureAlgorithm;
    private final byte[] contentDigest;
    private final int sealedLength;
    private final String keyId;
    private final String signerName;
    private final String timestamp;
    private final String extra;

    public SealedAttributes(int version, String digestAlgorithm, String signatureAlgorithm, byte[] contentDigest,
                            int sealedLength, String keyId, String signerName, String timestamp, String extra) {
        this.version = version;
        this.digestAlgorithm = Objects.requireNonNull(digestAlgorithm, "digestAlgorithm");
        this.signatureAlgorithm = Objects.requireNonNull(signatureAlgorithm, "signatureAlgorithm");
        this.contentDigest = Objects.requireNonNull(contentDigest, "contentDigest").clone();
        this.sealedLength = sealedLength;
        this.keyId = Objects.requireNonNull(keyId, "keyId");
        this.signerName = Objects.requireNonNull(signerName, "signerName");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.extra = extra == null || extra.isEmpty() ? null : extra;
    }

    public SealedAttributes withContentDigest(byte[] digest) {
        return new SealedAttributes(version, digestAlgorithm, signatureAlgorithm, digest, sealedLength, keyId,
                signerName, timestamp, extra);
    }

    public byte[] encode() {
        ASN1EncodableVector fields = new ASN1EncodableVector();
        fields.add(new ASN1Integer(version));
        fields.add(new DERUTF8String(digestAlgorithm));
        fields.add(new DERUTF8String(signatureAlgorithm));
        fields.add(new DEROctetString(contentDigest));
        fields.add(new ASN1Integer(sealedLength));
        fields.add(new DERUTF8String(keyId));
        fields.add(new DERUTF8String(signerName));
        fields.add(new DERUTF8String(timestamp));
        fields.add(new DERUTF8String(extra == null ? "" : extra));
        try {
            return new DERSequence(fields).getEncoded(ASN1Encoding.DER);
        } catch (IOException e) {
            throw new IllegalStateException("DER encoding of seal attributes failed", e);
        }
    }

    public int getVersion() {
        return version;
    }

    public String getDigestAlgorithm() {
        return digestAlgorithm;
    }

    public String getSignatureAlgorithm() {
        return signatureAlgorithm;
    }

    public byte[] getContentDigest() {
        return contentDigest.clone();
    }

    public int getSealedLength() {
        return sealedLength;
    }

    public String getKeyId() {
        return keyId;
    }

    public String getSignerName() {
        return signerName;
    }

    public String getTimestamp() {
        return timestamp;
    }

    /** Extra text, or {@code null} when none was given. */
    public String getExtra() {
        return extra;
    }
}
