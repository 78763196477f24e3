package io.tokenrelay.server.core.transform;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Lookup of encryption strategies by configured name.
 */
public final class Encryptions {
    private Encryptions() {
    }

    public static EncryptionStrategy forName(String name, Duration rotationInterval, Duration retention, Clock clock) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case AesGcmEncryption.ALGORITHM:
                return new AesGcmEncryption(rotationInterval, retention, clock);
            case ChaCha20Poly1305Encryption.ALGORITHM:
                return new ChaCha20Poly1305Encryption(rotationInterval, retention, clock);
            default:
                throw new IllegalArgumentException("Unknown encryption algorithm: " + name);
        }
    }
}
