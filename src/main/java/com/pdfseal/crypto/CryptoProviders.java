package com.pdfseal.crypto;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.Security;

public final class CryptoProviders {

    private CryptoProviders() {
    }

    public static void ensureProvider() {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }
}
