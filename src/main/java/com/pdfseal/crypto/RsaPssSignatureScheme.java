package com.pdfseal.crypto;

/**
 * RSASSA-PSS with SHA-256, MGF1(SHA-256) and a 32 byte salt. Default for new seals.
 */
public final class RsaPssSignatureScheme extends JcaSignatureScheme {

    public static final String ID = "RSASSA-PSS-SHA256";

    public RsaPssSignatureScheme() {
        super(ID, "SHA256withRSAandMGF1");
    }
}
