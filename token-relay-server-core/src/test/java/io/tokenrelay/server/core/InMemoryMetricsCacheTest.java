package io.tokenrelay.server.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryMetricsCacheTest {

    @Test
    void entriesExpireAfterTtl() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        InMemoryMetricsCache cache = new InMemoryMetricsCache(clock);

        cache.set("streaming_metrics", "{}", Duration.ofSeconds(300));
        clock.advance(Duration.ofSeconds(299));
        assertThat(cache.get("streaming_metrics")).contains("{}");

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("streaming_metrics")).isEmpty();
    }
}
