package io.tokenrelay.server.core.transform;

import io.tokenrelay.core.RelayException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class CompressionTest {

    private static final byte[] TEXT = "the quick brown fox jumps over the lazy dog. ".repeat(200)
            .getBytes(StandardCharsets.UTF_8);

    @Test
    void gzipAndDeflateRestoreInputAndShrinkRepetitiveText() {
        for (CompressionStrategy strategy : new CompressionStrategy[]{GzipCompression.INSTANCE, DeflateCompression.INSTANCE}) {
            byte[] compressed = strategy.compress(TEXT);
            assertThat(compressed.length).as(strategy.name()).isLessThan(TEXT.length / 4);
            assertThat(strategy.decompress(compressed)).as(strategy.name()).isEqualTo(TEXT);
        }
    }

    @Test
    void detectsFormatByMagicBytes() {
        assertThat(Compressions.detect(GzipCompression.INSTANCE.compress(TEXT))).isSameAs(GzipCompression.INSTANCE);
        assertThat(Compressions.detect(DeflateCompression.INSTANCE.compress(TEXT))).isSameAs(DeflateCompression.INSTANCE);
        assertThat(Compressions.detect("{\"delta\":\"x\"}".getBytes(StandardCharsets.UTF_8))).isSameAs(IdentityCompression.INSTANCE);
    }

    @Test
    void unknownRecordedNameFallsBackToDetection() {
        byte[] compressed = DeflateCompression.INSTANCE.compress(TEXT);

        assertThat(Compressions.forRecordedName("zstd", compressed)).isSameAs(DeflateCompression.INSTANCE);
        assertThat(Compressions.forRecordedName("brotli", compressed)).isSameAs(BrotliCompression.INSTANCE);
        assertThat(Compressions.forRecordedName("identity", compressed)).isSameAs(IdentityCompression.INSTANCE);
    }

    @Test
    void corruptInputIsCompressionFailure() {
        byte[] compressed = GzipCompression.INSTANCE.compress(TEXT);
        compressed[compressed.length / 2] ^= 0x55;
        compressed[compressed.length / 2 + 1] ^= 0x55;

        assertThatThrownBy(() -> GzipCompression.INSTANCE.decompress(compressed))
                .isInstanceOf(RelayException.CompressionFailure.class)
                .extracting(e -> ((RelayException) e).code()).isEqualTo("compression_failed");
    }

    @Test
    void adaptiveUsesGzipForSmallPayloadsAndRecordsTrialsForLargerOnes() {
        CompressionHistory history = new CompressionHistory();
        AdaptiveCompression adaptive = new AdaptiveCompression(history);

        assertThat(adaptive.resolve(new byte[100])).isSameAs(GzipCompression.INSTANCE);
        assertThat(history.snapshot()).isEmpty();

        CompressionStrategy chosen = adaptive.resolve(TEXT);
        assertThat(chosen).isIn(GzipCompression.INSTANCE, DeflateCompression.INSTANCE);
        assertThat(history.stats("gzip").samples()).isEqualTo(1);
        assertThat(history.stats("deflate").samples()).isEqualTo(1);
        assertThat(history.stats("deflate").averageRatio()).isLessThan(1.0);

        assertThat(adaptive.decompress(adaptive.compress(TEXT))).isEqualTo(TEXT);
    }

    @Test
    void forNameRejectsUnknownAlgorithms() {
        assertThat(Compressions.forName("GZIP", new CompressionHistory())).isSameAs(GzipCompression.INSTANCE);
        assertThat(Compressions.forName("brotli", new CompressionHistory())).isSameAs(BrotliCompression.INSTANCE);
        assertThatThrownBy(() -> Compressions.forName("lz4", new CompressionHistory()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void brotliRestoresInputAndShrinksRepetitiveText() {
        assumeTrue(BrotliCompression.isAvailable(), "brotli native library not available");

        byte[] compressed = BrotliCompression.INSTANCE.compress(TEXT);

        assertThat(compressed.length).isLessThan(TEXT.length / 4);
        assertThat(BrotliCompression.INSTANCE.decompress(compressed)).isEqualTo(TEXT);
    }

    @Test
    void adaptiveTriesBrotliOnlyForLargePayloads() {
        assumeTrue(BrotliCompression.isAvailable(), "brotli native library not available");
        CompressionHistory history = new CompressionHistory();
        AdaptiveCompression adaptive = new AdaptiveCompression(history);

        adaptive.resolve(TEXT);
        assertThat(history.stats(BrotliCompression.NAME).samples()).isZero();

        byte[] large = "the quick brown fox jumps over the lazy dog. ".repeat(400).getBytes(StandardCharsets.UTF_8);
        CompressionStrategy chosen = adaptive.resolve(large);
        assertThat(history.stats(BrotliCompression.NAME).samples()).isEqualTo(1);
        assertThat(adaptive.decompress(chosen.compress(large))).isEqualTo(large);
    }

    @Test
    void adaptiveStopsTrialCompressingOnceEachCandidateHasEnoughSamples() {
        CompressionHistory history = new CompressionHistory();
        AdaptiveCompression adaptive = new AdaptiveCompression(history);

        List<CompressionStrategy> choices = new ArrayList<>();
        for (int i = 0; i < AdaptiveCompression.LEARNING_SAMPLES + 10; i++) {
            choices.add(adaptive.resolve(TEXT));
        }

        assertThat(history.stats("gzip").samples()).isEqualTo(AdaptiveCompression.LEARNING_SAMPLES);
        assertThat(history.stats("deflate").samples()).isEqualTo(AdaptiveCompression.LEARNING_SAMPLES);
        assertThat(choices.subList(AdaptiveCompression.LEARNING_SAMPLES, choices.size()))
                .containsOnly(choices.get(AdaptiveCompression.LEARNING_SAMPLES));

        for (int i = choices.size(); i < AdaptiveCompression.RETRIAL_EVERY; i++) {
            adaptive.resolve(TEXT);
        }
        assertThat(history.stats("gzip").samples()).isEqualTo(AdaptiveCompression.LEARNING_SAMPLES + 1);
    }

    @Test
    void sizeClassesLearnSeparately() {
        CompressionHistory history = new CompressionHistory();
        AdaptiveCompression adaptive = new AdaptiveCompression(List.of(GzipCompression.INSTANCE), history);
        for (int i = 0; i < AdaptiveCompression.LEARNING_SAMPLES; i++) {
            adaptive.resolve(TEXT);
        }

        byte[] large = new byte[AdaptiveCompression.MEDIUM_PAYLOAD];
        assertThat(adaptive.resolve(large)).isSameAs(GzipCompression.INSTANCE);
        assertThat(history.stats("gzip").samples()).isEqualTo(AdaptiveCompression.LEARNING_SAMPLES + 1);
    }

    @ParameterizedTest(name = "{0} with {1} bytes")
    @MethodSource("compressionsAndPayloads")
    void everyCompressionRestoresAnyPayload(String algorithm, int size, byte[] payload) {
        if (algorithm.equals(BrotliCompression.NAME)) {
            assumeTrue(BrotliCompression.isAvailable(), "brotli native library not available");
        }
        CompressionStrategy strategy = Compressions.forName(algorithm, new CompressionHistory());

        assertThat(strategy.decompress(strategy.compress(payload))).isEqualTo(payload);
    }

    static Stream<Arguments> compressionsAndPayloads() {
        List<Arguments> cases = new ArrayList<>();
        for (String algorithm : List.of("gzip", "deflate", "identity", "adaptive", "brotli")) {
            for (byte[] payload : payloads()) {
                cases.add(Arguments.of(algorithm, payload.length, payload));
            }
        }
        return cases.stream();
    }

    /** Empty, single byte, random binary and text at each side of the adaptive size classes. */
    static List<byte[]> payloads() {
        Random random = new Random(42);
        List<byte[]> payloads = new ArrayList<>();
        payloads.add(new byte[0]);
        payloads.add(new byte[]{7});
        for (int size : new int[]{1023, 1024, 10239, 10240}) {
            byte[] binary = new byte[size];
            random.nextBytes(binary);
            payloads.add(binary);
            byte[] text = new byte[size];
            for (int i = 0; i < size; i++) {
                text[i] = (byte) ('a' + random.nextInt(4));
            }
            payloads.add(text);
        }
        return payloads;
    }
}
