package com.pdfseal.crypto;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable home of the resident keypair, in PEM form.
 */
public interface KeyPersistence {

    /** Keeps nothing; the keypair lives only as long as the engine. */
    KeyPersistence NONE = new KeyPersistence() {
        @Override
        public Optional<StoredKeyPair> load() {
            return Optional.empty();
        }

        @Override
        public void store(String privateKeyPem, String publicKeyPem) {
        }
    };

    Optional<StoredKeyPair> load() throws IOException;

    void store(String privateKeyPem, String publicKeyPem) throws IOException;

    record StoredKeyPair(String privateKeyPem, String publicKeyPem) {

        @Override
        public String toString() {
            return "StoredKeyPair[privateKeyPem=<redacted>]";
        }
    }
}
