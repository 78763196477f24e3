package io.tokenrelay.server.core.transform;

import io.tokenrelay.core.RelayException;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.spec.AlgorithmParameterSpec;
import java.util.Objects;

/**
 * Base for AEAD ciphers with a 12-byte nonce and a 16-byte tag.
 *
 * <p>Output layout is {@code nonce(12) | tag(16) | ciphertext}. JCE ciphers emit
 * {@code ciphertext | tag}, so the tag is moved in front on encryption and back on decryption.
 */
public abstract class AeadEncryption implements EncryptionStrategy {

    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final KeyRing keyRing;

    protected AeadEncryption(KeyRing keyRing) {
        this.keyRing = Objects.requireNonNull(keyRing, "keyRing");
    }

    /** JCE transformation, e.g. {@code AES/GCM/NoPadding}. */
    protected abstract String transformation();

    protected abstract AlgorithmParameterSpec parameters(byte[] nonce);

    public KeyRing keyRing() {
        return keyRing;
    }

    @Override
    public int currentEpoch() {
        return keyRing.currentEpoch();
    }

    @Override
    public boolean shouldRotate() {
        return keyRing.shouldRotate();
    }

    @Override
    public int rotateKey() {
        return keyRing.rotate();
    }

    @Override
    public Encrypted encrypt(byte[] plaintext) {
        KeyRing.EpochKey current = keyRing.current();
        return new Encrypted(current.epoch(), seal(current.key(), plaintext));
    }

    @Override
    public byte[] encrypt(byte[] plaintext, int epoch) {
        SecretKey key = keyRing.key(epoch)
                .orElseThrow(() -> new IllegalStateException("Key epoch " + epoch + " is not available"));
        return seal(key, plaintext);
    }

    private byte[] seal(SecretKey key, byte[] plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        byte[] nonce = new byte[NONCE_LENGTH];
        RANDOM.nextBytes(nonce);
        byte[] sealed;
        try {
            Cipher cipher = Cipher.getInstance(transformation());
            cipher.init(Cipher.ENCRYPT_MODE, key, parameters(nonce));
            sealed = cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(algorithm() + " encryption failed", e);
        }
        int ctLength = sealed.length - TAG_LENGTH;
        byte[] out = new byte[NONCE_LENGTH + sealed.length];
        System.arraycopy(nonce, 0, out, 0, NONCE_LENGTH);
        System.arraycopy(sealed, ctLength, out, NONCE_LENGTH, TAG_LENGTH);
        System.arraycopy(sealed, 0, out, NONCE_LENGTH + TAG_LENGTH, ctLength);
        return out;
    }

    @Override
    public byte[] decrypt(byte[] data, int epoch) {
        Objects.requireNonNull(data, "data");
        if (data.length < NONCE_LENGTH + TAG_LENGTH) {
            throw new RelayException.DecryptionError("Ciphertext too short (" + data.length + " bytes)");
        }
        SecretKey key = keyRing.key(epoch)
                .orElseThrow(() -> new RelayException.DecryptionError("Key epoch " + epoch + " is not available"));
        byte[] nonce = new byte[NONCE_LENGTH];
        System.arraycopy(data, 0, nonce, 0, NONCE_LENGTH);
        int ctLength = data.length - NONCE_LENGTH - TAG_LENGTH;
        byte[] sealed = new byte[ctLength + TAG_LENGTH];
        System.arraycopy(data, NONCE_LENGTH + TAG_LENGTH, sealed, 0, ctLength);
        System.arraycopy(data, NONCE_LENGTH, sealed, ctLength, TAG_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance(transformation());
            cipher.init(Cipher.DECRYPT_MODE, key, parameters(nonce));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new RelayException.DecryptionError("Authentication failed for " + algorithm() + " payload", e);
        } catch (GeneralSecurityException e) {
            throw new RelayException.DecryptionError(algorithm() + " decryption failed", e);
        }
    }
}
