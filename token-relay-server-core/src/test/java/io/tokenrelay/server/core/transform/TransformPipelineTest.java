package io.tokenrelay.server.core.transform;

import io.tokenrelay.core.ChunkType;
import io.tokenrelay.core.RelayException;
import io.tokenrelay.server.core.MutableClock;
import io.tokenrelay.server.spi.Chunk;
import io.tokenrelay.server.spi.ChunkBatch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransformPipelineTest {

    private final ExecutorService workers = Executors.newFixedThreadPool(2);
    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));

    @AfterEach
    void shutdown() {
        workers.shutdownNow();
    }

    @Test
    void compressThenEncryptAndDecodeBack() throws Exception {
        AesGcmEncryption aes = new AesGcmEncryption(Duration.ofHours(24), Duration.ofDays(7), clock);
        TransformPipeline pipeline = new TransformPipeline(GzipCompression.INSTANCE, aes, workers);
        List<Chunk> chunks = List.of(chunk(0, "{\"delta\":\"a\"}"), chunk(1, "{\"delta\":\"b\"}"));

        TransformPipeline.Encoded encoded = pipeline.encode(chunks, true, true);

        assertThat(encoded.compression()).isEqualTo("gzip");
        assertThat(encoded.encryption()).isEqualTo("aes-256-gcm");
        assertThat(encoded.keyEpoch()).isEqualTo(1);
        assertThat(encoded.chunks()).extracting(Chunk::sequence).containsExactly(0L, 1L);
        assertThat(encoded.chunks()).extracting(Chunk::size).containsExactly(13, 13);

        ChunkBatch batch = batch(encoded);
        List<Chunk> decoded = pipeline.decode(batch);
        assertThat(decoded.get(1).payload()).isEqualTo("{\"delta\":\"b\"}".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void transformedChunksAreAlwaysContent() throws Exception {
        TransformPipeline pipeline = new TransformPipeline(GzipCompression.INSTANCE, null, workers);
        Chunk control = new Chunk("id", "c1", 0, ChunkType.CONTROL, new byte[]{1, 2, 3}, clock.instant(), 3, null);

        TransformPipeline.Encoded encoded = pipeline.encode(List.of(control), true, false);

        assertThat(encoded.chunks().get(0).type()).isEqualTo(ChunkType.CONTENT);
        assertThat(encoded.keyEpoch()).isNull();
        assertThat(encoded.encryption()).isEqualTo(ChunkBatch.NO_ENCRYPTION);
    }

    @Test
    void compressionFailureFallsBackToIdentity() throws Exception {
        CompressionStrategy broken = new CompressionStrategy() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public byte[] compress(byte[] input) {
                throw new RelayException.CompressionFailure("boom", new IllegalStateException());
            }

            @Override
            public byte[] decompress(byte[] input) {
                return input;
            }
        };
        TransformPipeline pipeline = new TransformPipeline(broken, null, workers);
        Chunk chunk = chunk(0, "{\"delta\":\"a\"}");

        TransformPipeline.Encoded encoded = pipeline.encode(List.of(chunk), true, false);

        assertThat(encoded.compression()).isEqualTo(ChunkBatch.IDENTITY);
        assertThat(encoded.chunks().get(0).payload()).isEqualTo(chunk.payload());
        assertThat(pipeline.decode(batch(encoded)).get(0).payload()).isEqualTo(chunk.payload());
    }

    @Test
    void rotatesDueKeyBeforeEncrypting() throws Exception {
        AesGcmEncryption aes = new AesGcmEncryption(Duration.ofHours(1), Duration.ofDays(7), clock);
        TransformPipeline pipeline = new TransformPipeline(IdentityCompression.INSTANCE, aes, workers);
        ChunkBatch first = batch(pipeline.encode(List.of(chunk(0, "a")), false, true));

        clock.advance(Duration.ofHours(2));
        ChunkBatch second = batch(pipeline.encode(List.of(chunk(1, "b")), false, true));

        assertThat(first.keyEpoch()).isEqualTo(1);
        assertThat(second.keyEpoch()).isEqualTo(2);
        assertThat(pipeline.decode(first).get(0).payload()).isEqualTo("a".getBytes(StandardCharsets.UTF_8));
        assertThat(pipeline.decode(second).get(0).payload()).isEqualTo("b".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void decodingEncryptedBatchWithoutKeysFails() throws Exception {
        AesGcmEncryption aes = new AesGcmEncryption(Duration.ofHours(24), Duration.ofDays(7), clock);
        ChunkBatch stored = batch(new TransformPipeline(GzipCompression.INSTANCE, aes, workers)
                .encode(List.of(chunk(0, "a")), true, true));

        TransformPipeline otherKeys = new TransformPipeline(GzipCompression.INSTANCE,
                new AesGcmEncryption(Duration.ofHours(24), Duration.ofDays(7), clock), workers);
        TransformPipeline noKeys = new TransformPipeline(GzipCompression.INSTANCE, null, workers);

        assertThatThrownBy(() -> otherKeys.decode(stored)).isInstanceOf(RelayException.DecryptionError.class);
        assertThatThrownBy(() -> noKeys.decode(stored)).isInstanceOf(RelayException.DecryptionError.class);
    }

    @Test
    void adaptiveChoiceIsSizedByTheChunksThatAreCompressed() throws Exception {
        CompressionHistory history = new CompressionHistory();
        TransformPipeline pipeline = new TransformPipeline(new AdaptiveCompression(history), null, workers);
        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            chunks.add(chunk(i, "{\"delta\":\"" + "token ".repeat(30) + "\"}"));
        }

        TransformPipeline.Encoded encoded = pipeline.encode(chunks, true, false);

        assertThat(encoded.compression()).isEqualTo(GzipCompression.NAME);
        assertThat(history.snapshot()).isEmpty();
        assertThat(pipeline.decode(batch(encoded))).extracting(Chunk::payload)
                .containsExactlyElementsOf(chunks.stream().map(Chunk::payload).collect(Collectors.toList()));
    }

    private Chunk chunk(long sequence, String payload) {
        byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
        return new Chunk("chunk-" + sequence, "c1", sequence, ChunkType.CONTENT, bytes, clock.instant(), bytes.length, null);
    }

    private ChunkBatch batch(TransformPipeline.Encoded encoded) {
        return new ChunkBatch("b1", "c1", encoded.chunks(), encoded.compression(), encoded.encryption(),
                encoded.keyEpoch(), clock.instant());
    }
}
