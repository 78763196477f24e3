package io.tokenrelay.server.core.transform;

import io.tokenrelay.core.RelayException;
import io.tokenrelay.server.spi.Chunk;
import io.tokenrelay.server.spi.ChunkBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Applies compression then encryption to flushed chunks, and the inverse to stored batches.
 *
 * <p>Encoding runs on a bounded worker pool so that CPU-heavy transforms never run on the
 * stream threads. All chunks of one batch share one compression algorithm and one key epoch.
 */
public final class TransformPipeline {
    private static final Logger log = LoggerFactory.getLogger(TransformPipeline.class);

    /**
     * Result of encoding one batch.
     *
     * @param chunks transformed chunks, in input order
     * @param compression algorithm used, {@code identity} when not compressed
     * @param encryption algorithm used, {@code none} when not encrypted
     * @param keyEpoch key epoch, null when not encrypted
     */
    public record Encoded(List<Chunk> chunks, String compression, String encryption, Integer keyEpoch) {
    }

    private final CompressionStrategy compression;
    private final EncryptionStrategy encryption;
    private final ExecutorService workers;

    /**
     * @param compression strategy used when a connection enables compression
     * @param encryption strategy used when a connection enables encryption; may be null when
     *        no connection ever encrypts
     * @param workers transform worker pool, owned by the caller
     */
    public TransformPipeline(CompressionStrategy compression, EncryptionStrategy encryption, ExecutorService workers) {
        this.compression = Objects.requireNonNull(compression, "compression");
        this.encryption = encryption;
        this.workers = Objects.requireNonNull(workers, "workers");
    }

    public CompressionStrategy compression() {
        return compression;
    }

    public EncryptionStrategy encryption() {
        return encryption;
    }

    /**
     * Encodes a batch on the worker pool and waits for the result.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public Encoded encode(List<Chunk> chunks, boolean compress, boolean encrypt) throws InterruptedException {
        List<Chunk> input = List.copyOf(chunks);
        Future<Encoded> future = workers.submit(() -> encodeNow(input, compress, encrypt));
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Transform failed", cause);
        }
    }

    Encoded encodeNow(List<Chunk> chunks, boolean compress, boolean encrypt) {
        String algorithm = IdentityCompression.NAME;
        List<byte[]> payloads = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            payloads.add(chunk.payload());
        }

        if (compress && !chunks.isEmpty()) {
            try {
                CompressionStrategy chosen = compression.resolve(largest(payloads));
                List<byte[]> compressed = new ArrayList<>(payloads.size());
                for (byte[] payload : payloads) {
                    compressed.add(chosen.compress(payload));
                }
                payloads = compressed;
                algorithm = chosen.name();
            } catch (RelayException.CompressionFailure e) {
                log.warn("Compression failed for connection {}, storing batch uncompressed", chunks.get(0).connectionId(), e);
            }
        }

        String encryptionName = ChunkBatch.NO_ENCRYPTION;
        Integer epoch = null;
        if (encrypt) {
            if (encryption == null) {
                throw new IllegalStateException("Encryption requested but no encryption strategy is configured");
            }
            if (encryption.shouldRotate()) {
                encryption.rotateKey();
            }
            int current = encryption.currentEpoch();
            List<byte[]> sealed = new ArrayList<>(payloads.size());
            for (byte[] payload : payloads) {
                sealed.add(encryption.encrypt(payload, current));
            }
            payloads = sealed;
            encryptionName = encryption.algorithm();
            epoch = current;
        }

        List<Chunk> out = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            out.add(chunks.get(i).withPayload(payloads.get(i)));
        }
        return new Encoded(out, algorithm, encryptionName, epoch);
    }

    /**
     * Decrypts and decompresses a stored batch on the calling thread.
     *
     * @throws RelayException.DecryptionError on authentication failure or missing key
     */
    public List<Chunk> decode(ChunkBatch batch) {
        List<Chunk> out = new ArrayList<>(batch.chunks().size());
        for (Chunk chunk : batch.chunks()) {
            byte[] data = chunk.payload();
            if (batch.isEncrypted()) {
                if (encryption == null || !encryption.algorithm().equals(batch.encryption())) {
                    throw new RelayException.DecryptionError("No " + batch.encryption() + " key material for batch " + batch.batchId());
                }
                if (batch.keyEpoch() == null) {
                    throw new RelayException.DecryptionError("Encrypted batch " + batch.batchId() + " has no key epoch");
                }
                data = encryption.decrypt(data, batch.keyEpoch());
            }
            data = Compressions.forRecordedName(batch.compression(), data).decompress(data);
            out.add(chunk.withPayload(data));
        }
        return out;
    }

    /** Chunks are compressed one at a time, so the largest one is the sample. */
    private static byte[] largest(List<byte[]> payloads) {
        byte[] largest = payloads.get(0);
        for (byte[] payload : payloads) {
            if (payload.length > largest.length) largest = payload;
        }
        return largest;
    }
}
