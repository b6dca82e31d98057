package com.pdfseal.crypto;

/**
 * RSA PKCS#1 v1.5 with SHA-256.
 */
public final class RsaPkcs1SignatureScheme extends JcaSignatureScheme {

    public static final String ID = "RSA-PKCS1-SHA256";

    public RsaPkcs1SignatureScheme() {
        super(ID, "SHA256withRSA");
    }
}
