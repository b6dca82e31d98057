package com.pdfseal.crypto;

import com.pdfseal.error.MalformedKeyException;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMException;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Reads and writes RSA keys as PEM text.
 * <p>
 * Private keys are written as unencrypted PKCS#8 ({@code PRIVATE KEY}); on read the
 * traditional {@code RSA PRIVATE KEY} form is accepted too. Public keys use the X.509
 * {@code PUBLIC KEY} form.
 */
public final class PemCodec {

    private PemCodec() {
    }

    public static PrivateKey parsePrivateKey(String pem) throws MalformedKeyException {
        Object parsed = readSingleObject(pem, "private key");
        JcaPEMKeyConverter converter = converter();
        try {
            if (parsed instanceof PrivateKeyInfo) {
                return converter.getPrivateKey((PrivateKeyInfo) parsed);
            }
            if (parsed instanceof PEMKeyPair) {
                return converter.getKeyPair((PEMKeyPair) parsed).getPrivate();
            }
        } catch (PEMException e) {
            throw new MalformedKeyException("Invalid private key: " + e.getMessage(), e);
        }
        if (parsed instanceof PEMEncryptedKeyPair || parsed instanceof PKCS8EncryptedPrivateKeyInfo) {
            throw new MalformedKeyException("Invalid private key: encrypted PEM keys are not supported");
        }
        throw new MalformedKeyException("Invalid private key: PEM block does not hold a private key");
    }

    public static PublicKey parsePublicKey(String pem) throws MalformedKeyException {
        Object parsed = readSingleObject(pem, "public key");
        if (!(parsed instanceof SubjectPublicKeyInfo)) {
            throw new MalformedKeyException("Invalid public key: PEM block does not hold a public key");
        }
        try {
            return converter().getPublicKey((SubjectPublicKeyInfo) parsed);
        } catch (PEMException e) {
            throw new MalformedKeyException("Invalid public key: " + e.getMessage(), e);
        }
    }

    public static String encodePrivateKey(PrivateKey privateKey) {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(new JcaPKCS8Generator(privateKey, null));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to encode private key", e);
        }
        return out.toString();
    }

    public static String encodePublicKey(PublicKey publicKey) {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(publicKey);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to encode public key", e);
        }
        return out.toString();
    }

    private static Object readSingleObject(String pem, String what) throws MalformedKeyException {
        if (pem == null || pem.isBlank()) {
            throw new MalformedKeyException("Invalid " + what + ": PEM text is empty");
        }
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            Object parsed = parser.readObject();
            if (parsed == null) {
                throw new MalformedKeyException("Invalid " + what + ": no PEM block found");
            }
            return parsed;
        } catch (IOException | IllegalArgumentException e) {
            throw new MalformedKeyException("Invalid " + what + ": " + e.getMessage(), e);
        }
    }

    private static JcaPEMKeyConverter converter() {
        CryptoProviders.ensureProvider();
        return new JcaPEMKeyConverter().setProvider(BouncyCastleProvider.PROVIDER_NAME);
    }
}
