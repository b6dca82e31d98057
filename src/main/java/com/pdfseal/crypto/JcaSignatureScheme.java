package com.pdfseal.crypto;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;

/**
 * Signature scheme backed by a JCA algorithm name on the BouncyCastle provider.
 */
abstract class JcaSignatureScheme implements SignatureScheme {

    private final String id;
    private final String jcaAlgorithm;

    JcaSignatureScheme(String id, String jcaAlgorithm) {
        this.id = id;
        this.jcaAlgorithm = jcaAlgorithm;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public byte[] sign(byte[] message, PrivateKey privateKey) throws GeneralSecurityException {
        Signature signature = newSignature();
        signature.initSign(privateKey);
        signature.update(message);
        return signature.sign();
    }

    @Override
    public boolean verify(byte[] message, byte[] signatureBytes, PublicKey publicKey) throws GeneralSecurityException {
        Signature signature = newSignature();
        signature.initVerify(publicKey);
        signature.update(message);
        try {
            return signature.verify(signatureBytes);
        } catch (SignatureException malformed) {
            return false;
        }
    }

    private Signature newSignature() throws GeneralSecurityException {
        CryptoProviders.ensureProvider();
        return Signature.getInstance(jcaAlgorithm, BouncyCastleProvider.PROVIDER_NAME);
    }

    @Override
    public String toString() {
        return id;
    }
}
