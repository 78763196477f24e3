package io.tokenrelay.server.core.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Numbered encryption keys.
 *
 * <p>The key with the highest epoch encrypts. Rotation retires the current key; retired keys
 * remain available for decryption until the retention window passes.
 */
public final class KeyRing {
    private static final Logger log = LoggerFactory.getLogger(KeyRing.class);

    private static final SecureRandom RANDOM = new SecureRandom();

    private record Entry(SecretKey key, Instant createdAt, Instant retiredAt) {
        Entry retire(Instant at) {
            return new Entry(key, createdAt, at);
        }
    }

    private final String keyAlgorithm;
    private final int keyBits;
    private final Duration rotationInterval;
    private final Duration retention;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final TreeMap<Integer, Entry> keys = new TreeMap<>();
    private Instant lastRotation;

    public KeyRing(String keyAlgorithm, int keyBits, Duration rotationInterval, Duration retention, Clock clock) {
        this.keyAlgorithm = Objects.requireNonNull(keyAlgorithm, "keyAlgorithm");
        this.keyBits = keyBits;
        this.rotationInterval = Objects.requireNonNull(rotationInterval, "rotationInterval");
        this.retention = Objects.requireNonNull(retention, "retention");
        this.clock = Objects.requireNonNull(clock, "clock");
        Instant now = clock.instant();
        keys.put(1, new Entry(generate(), now, null));
        lastRotation = now;
    }

    public int currentEpoch() {
        lock.lock();
        try {
            return keys.lastKey();
        } finally {
            lock.unlock();
        }
    }

    /**
     * The encrypting key together with its epoch.
     */
    public record EpochKey(int epoch, SecretKey key) {
    }

    public EpochKey current() {
        lock.lock();
        try {
            Map.Entry<Integer, Entry> last = keys.lastEntry();
            return new EpochKey(last.getKey(), last.getValue().key());
        } finally {
            lock.unlock();
        }
    }

    /** Key for {@code epoch}, if it was never issued or has been pruned the result is empty. */
    public Optional<SecretKey> key(int epoch) {
        lock.lock();
        try {
            Entry entry = keys.get(epoch);
            return entry == null ? Optional.empty() : Optional.of(entry.key());
        } finally {
            lock.unlock();
        }
    }

    public Instant lastRotation() {
        lock.lock();
        try {
            return lastRotation;
        } finally {
            lock.unlock();
        }
    }

    /** {@code now - lastRotation > rotationInterval}. */
    public boolean shouldRotate() {
        lock.lock();
        try {
            return Duration.between(lastRotation, clock.instant()).compareTo(rotationInterval) > 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Issues a new key, retires the current one and prunes keys retired longer than the
     * retention window.
     *
     * @return the new epoch
     */
    public int rotate() {
        lock.lock();
        try {
            Instant now = clock.instant();
            Map.Entry<Integer, Entry> current = keys.lastEntry();
            keys.put(current.getKey(), current.getValue().retire(now));
            int next = current.getKey() + 1;
            keys.put(next, new Entry(generate(), now, null));
            lastRotation = now;
            prune(now);
            log.info("Rotated {} key to epoch {}", keyAlgorithm, next);
            return next;
        } finally {
            lock.unlock();
        }
    }

    /** Number of keys still held, current one included. */
    public int size() {
        lock.lock();
        try {
            return keys.size();
        } finally {
            lock.unlock();
        }
    }

    private void prune(Instant now) {
        keys.entrySet().removeIf(e -> {
            Instant retiredAt = e.getValue().retiredAt();
            return retiredAt != null && Duration.between(retiredAt, now).compareTo(retention) > 0;
        });
    }

    private SecretKey generate() {
        try {
            KeyGenerator generator = KeyGenerator.getInstance(keyAlgorithm);
            generator.init(keyBits, RANDOM);
            return generator.generateKey();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(keyAlgorithm + " key generation not available", e);
        }
    }
}
