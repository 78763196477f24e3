package io.tokenrelay.server.spi;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Chunks written to durable storage by one flush.
 *
 * @param batchId random batch id
 * @param connectionId owning connection
 * @param chunks transformed chunks in arrival order
 * @param compression compression algorithm name, {@code identity} when not compressed
 * @param encryption encryption algorithm name, {@code none} when not encrypted
 * @param keyEpoch key epoch that encrypted the batch; null when not encrypted
 * @param flushedAt flush time
 */
public record ChunkBatch(
        String batchId,
        String connectionId,
        List<Chunk> chunks,
        String compression,
        String encryption,
        Integer keyEpoch,
        Instant flushedAt
) {
    public static final String IDENTITY = "identity";
    public static final String NO_ENCRYPTION = "none";

    public ChunkBatch {
        Objects.requireNonNull(batchId, "batchId");
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(flushedAt, "flushedAt");
        chunks = List.copyOf(chunks);
        compression = compression == null ? IDENTITY : compression;
        encryption = encryption == null ? NO_ENCRYPTION : encryption;
    }

    public boolean isEncrypted() {
        return !NO_ENCRYPTION.equals(encryption);
    }

    public Optional<Integer> keyEpochIfPresent() {
        return Optional.ofNullable(keyEpoch);
    }

    public long firstSequence() {
        return chunks.isEmpty() ? -1 : chunks.get(0).sequence();
    }

    public long lastSequence() {
        return chunks.isEmpty() ? -1 : chunks.get(chunks.size() - 1).sequence();
    }

    public long byteSize() {
        long total = 0;
        for (Chunk chunk : chunks) {
            total += chunk.size();
        }
        return total;
    }
}
