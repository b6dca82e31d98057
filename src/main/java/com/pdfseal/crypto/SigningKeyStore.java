package com.pdfseal.crypto;

import com.pdfseal.error.KeyGenerationException;
import com.pdfseal.error.KeyMismatchException;
import com.pdfseal.error.MalformedKeyException;
import com.pdfseal.error.NoKeyLoadedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAKeyGenParameterSpec;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the single RSA keypair an engine instance signs with.
 * <p>
 * {@link #install(KeyMaterial)} replaces the resident pair as a whole; readers take a {@link KeyMaterial}
 * snapshot. {@link #newKeyPair()} and {@link #readPem(String, String)} build material without installing it,
 * so a caller can persist a pair before it becomes resident. The private key only leaves as PEM, through
 * {@link #exportPrivateKey()} or {@link #encodePrivateKey(KeyMaterial)}.
 */
public final class SigningKeyStore {

    private static final Logger log = LoggerFactory.getLogger(SigningKeyStore.class);

    public static final int MIN_KEY_SIZE = 2048;
    public static final int DEFAULT_KEY_SIZE = 2048;

    private static final byte[] PAIRING_CHALLENGE = "pdf-seal key pairing check".getBytes(StandardCharsets.US_ASCII);

    private final int keySize;
    private final RandomSource randomSource;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private KeyMaterial resident;

    /**
     * Supplies the secure random source used for key generation.
     */
    @FunctionalInterface
    public interface RandomSource {
        SecureRandom get() throws GeneralSecurityException;
    }

    public SigningKeyStore() {
        this(DEFAULT_KEY_SIZE, SecureRandom::new);
    }

    public SigningKeyStore(int keySize) {
        this(keySize, SecureRandom::new);
    }

    public SigningKeyStore(int keySize, RandomSource randomSource) {
        if (keySize != 2048 && keySize != 3072 && keySize != 4096) {
            throw new IllegalArgumentException("Supported key sizes: 2048, 3072, 4096");
        }
        this.keySize = keySize;
        this.randomSource = randomSource;
    }

    /** Generates a keypair and makes it resident. */
    public KeyMaterial generate() throws KeyGenerationException {
        KeyMaterial material = newKeyPair();
        install(material);
        return material;
    }

    /** Validates a PEM pair and makes it resident. */
    public KeyMaterial importPem(String privatePem, String publicPem)
            throws MalformedKeyException, KeyMismatchException {
        KeyMaterial material = readPem(privatePem, publicPem);
        install(material);
        return material;
    }

    /**
     * Generates a fresh keypair without touching the resident one.
     */
    public KeyMaterial newKeyPair() throws KeyGenerationException {
        KeyPair pair;
        try {
            SecureRandom random = randomSource.get();
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(new RSAKeyGenParameterSpec(keySize, RSAKeyGenParameterSpec.F4), random);
            pair = generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new KeyGenerationException("Failed to generate key: " + e.getMessage(), e);
        }
        KeyMaterial material = new KeyMaterial(pair);
        log.info("[keystore] generated RSA-{} keypair keyId={}", keySize, material.keyId());
        return material;
    }

    /**
     * Parses and checks a PEM pair without touching the resident one.
     */
    public KeyMaterial readPem(String privatePem, String publicPem)
            throws MalformedKeyException, KeyMismatchException {
        PrivateKey privateKey = PemCodec.parsePrivateKey(privatePem);
        PublicKey publicKey = PemCodec.parsePublicKey(publicPem);
        if (!(privateKey instanceof RSAPrivateKey) || !(publicKey instanceof RSAPublicKey)) {
            throw new MalformedKeyException("Only RSA keys are supported, got "
                    + privateKey.getAlgorithm() + "/" + publicKey.getAlgorithm());
        }
        RSAPublicKey rsaPublic = (RSAPublicKey) publicKey;
        if (rsaPublic.getModulus().bitLength() < MIN_KEY_SIZE) {
            throw new MalformedKeyException("RSA key of " + rsaPublic.getModulus().bitLength()
                    + " bits is too weak, at least " + MIN_KEY_SIZE + " bits are required");
        }
        requirePairing((RSAPrivateKey) privateKey, rsaPublic);
        return new KeyMaterial(new KeyPair(publicKey, privateKey));
    }

    public void install(KeyMaterial material) {
        lock.writeLock().lock();
        try {
            resident = Objects.requireNonNull(material, "material");
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[keystore] resident keypair is now RSA-{} keyId={}", material.keySize(), material.keyId());
    }

    /** PKCS#8 PEM of the given material's private key. */
    public String encodePrivateKey(KeyMaterial material) {
        return PemCodec.encodePrivateKey(material.privateKey());
    }

    public String exportPrivateKey() throws NoKeyLoadedException {
        KeyMaterial material = snapshot();
        log.info("[keystore] exporting private key keyId={}", material.keyId());
        return PemCodec.encodePrivateKey(material.privateKey());
    }

    public boolean hasKey() {
        return current().isPresent();
    }

    public String publicKeyPem() throws NoKeyLoadedException {
        return snapshot().publicKeyPem();
    }

    public KeyMaterial snapshot() throws NoKeyLoadedException {
        return current().orElseThrow(() -> new NoKeyLoadedException("No signing key loaded; generate or import one first"));
    }

    public Optional<KeyMaterial> current() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(resident);
        } finally {
            lock.readLock().unlock();
        }
    }

    private static void requirePairing(RSAPrivateKey privateKey, RSAPublicKey publicKey) throws KeyMismatchException {
        if (!privateKey.getModulus().equals(publicKey.getModulus())) {
            throw new KeyMismatchException("Private key does not match the supplied public key");
        }
        if (privateKey instanceof RSAPrivateCrtKey) {
            BigInteger exponent = ((RSAPrivateCrtKey) privateKey).getPublicExponent();
            if (!exponent.equals(publicKey.getPublicExponent())) {
                throw new KeyMismatchException("Private key does not match the supplied public key");
            }
            return;
        }
        // no public exponent on a non-CRT key, so prove the pairing with a signature
        SignatureScheme scheme = Algorithms.requireSignatureScheme(Algorithms.DEFAULT_SIGNATURE);
        try {
            byte[] signature = scheme.sign(PAIRING_CHALLENGE, privateKey);
            if (!scheme.verify(PAIRING_CHALLENGE, signature, publicKey)) {
                throw new KeyMismatchException("Private key does not match the supplied public key");
            }
        } catch (GeneralSecurityException e) {
            throw new KeyMismatchException("Unable to check key pairing: " + e.getMessage(), e);
        }
    }
}
