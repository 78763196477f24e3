package io.tokenrelay.server.core.transform;

import javax.crypto.spec.IvParameterSpec;
import java.security.spec.AlgorithmParameterSpec;
import java.time.Clock;
import java.time.Duration;

/**
 * ChaCha20-Poly1305 (RFC 8439).
 */
public final class ChaCha20Poly1305Encryption extends AeadEncryption {
    public static final String ALGORITHM = "chacha20-poly1305";

    public ChaCha20Poly1305Encryption(KeyRing keyRing) {
        super(keyRing);
    }

    public ChaCha20Poly1305Encryption(Duration rotationInterval, Duration retention, Clock clock) {
        this(new KeyRing("ChaCha20", 256, rotationInterval, retention, clock));
    }

    @Override
    public String algorithm() {
        return ALGORITHM;
    }

    @Override
    protected String transformation() {
        return "ChaCha20-Poly1305";
    }

    @Override
    protected AlgorithmParameterSpec parameters(byte[] nonce) {
        return new IvParameterSpec(nonce);
    }
}
