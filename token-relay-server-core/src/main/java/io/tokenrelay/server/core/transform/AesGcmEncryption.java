package io.tokenrelay.server.core.transform;

import javax.crypto.spec.GCMParameterSpec;
import java.security.spec.AlgorithmParameterSpec;
import java.time.Clock;
import java.time.Duration;

/**
 * AES-256 in GCM mode.
 */
public final class AesGcmEncryption extends AeadEncryption {
    public static final String ALGORITHM = "aes-256-gcm";

    public AesGcmEncryption(KeyRing keyRing) {
        super(keyRing);
    }

    public AesGcmEncryption(Duration rotationInterval, Duration retention, Clock clock) {
        this(new KeyRing("AES", 256, rotationInterval, retention, clock));
    }

    @Override
    public String algorithm() {
        return ALGORITHM;
    }

    @Override
    protected String transformation() {
        return "AES/GCM/NoPadding";
    }

    @Override
    protected AlgorithmParameterSpec parameters(byte[] nonce) {
        return new GCMParameterSpec(TAG_LENGTH * 8, nonce);
    }
}
