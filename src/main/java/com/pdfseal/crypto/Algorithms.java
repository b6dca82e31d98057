package com.pdfseal.crypto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of the digest and signature algorithms a seal record may name.
 * <p>
 * Records are dispatched by identifier, so new algorithms are added here without touching
 * the verification of records written with older ones.
 */
public final class Algorithms {

    public static final String DEFAULT_DIGEST = "SHA-256";
    public static final String DEFAULT_SIGNATURE = RsaPssSignatureScheme.ID;

    private static final Map<String, DigestAlgorithm> DIGESTS = new LinkedHashMap<>();
    private static final Map<String, SignatureScheme> SIGNATURES = new LinkedHashMap<>();

    static {
        registerDigest(new Sha2Digest("SHA-256"));
        registerDigest(new Sha2Digest("SHA-384"));
        registerDigest(new Sha2Digest("SHA-512"));
        registerSignature(new RsaPssSignatureScheme());
        registerSignature(new RsaPkcs1SignatureScheme());
    }

    private Algorithms() {
    }

    private static void registerDigest(DigestAlgorithm algorithm) {
        DIGESTS.put(algorithm.id(), algorithm);
    }

    private static void registerSignature(SignatureScheme scheme) {
        SIGNATURES.put(scheme.id(), scheme);
    }

    public static Optional<DigestAlgorithm> digest(String id) {
        return Optional.ofNullable(id == null ? null : DIGESTS.get(id));
    }

    public static Optional<SignatureScheme> signatureScheme(String id) {
        return Optional.ofNullable(id == null ? null : SIGNATURES.get(id));
    }

    public static DigestAlgorithm requireDigest(String id) {
        return digest(id).orElseThrow(() -> new IllegalArgumentException(
                "Unknown digest algorithm '" + id + "', expected one of " + DIGESTS.keySet()));
    }

    public static SignatureScheme requireSignatureScheme(String id) {
        return signatureScheme(id).orElseThrow(() -> new IllegalArgumentException(
                "Unknown signature algorithm '" + id + "', expected one of " + SIGNATURES.keySet()));
    }

    public static Set<String> digestIds() {
        return Collections.unmodifiableSet(DIGESTS.keySet());
    }

    public static Set<String> signatureIds() {
        return Collections.unmodifiableSet(SIGNATURES.keySet());
    }
}
