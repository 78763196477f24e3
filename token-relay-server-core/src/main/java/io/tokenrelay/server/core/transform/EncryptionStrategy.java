package io.tokenrelay.server.core.transform;

import io.tokenrelay.core.RelayException;

/**
 * Authenticated encryption of stored payloads.
 *
 * <p>Ciphertexts carry everything needed for decryption except the key, which is selected by
 * the epoch recorded alongside them.
 */
public interface EncryptionStrategy {

    /** Algorithm name recorded with each stored batch. */
    String algorithm();

    int currentEpoch();

    /**
     * Encrypts with the current key.
     */
    Encrypted encrypt(byte[] plaintext);

    /**
     * Encrypts with the key of a specific epoch, so that every chunk of a batch shares one
     * epoch even when a rotation happens concurrently.
     */
    byte[] encrypt(byte[] plaintext, int epoch);

    /**
     * @throws RelayException.DecryptionError when the data was tampered with, is truncated, or
     *         the key for {@code epoch} is no longer available
     */
    byte[] decrypt(byte[] data, int epoch);

    boolean shouldRotate();

    /** @return the new key epoch */
    int rotateKey();

    /**
     * Ciphertext together with the epoch of the key that produced it.
     */
    record Encrypted(int epoch, byte[] data) {
    }
}
