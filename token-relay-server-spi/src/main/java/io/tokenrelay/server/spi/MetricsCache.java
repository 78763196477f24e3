package io.tokenrelay.server.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value cache that holds the most recent metrics snapshot with a time-to-live.
 */
public interface MetricsCache {

    void set(String key, String value, Duration ttl) throws Exception;

    Optional<String> get(String key) throws Exception;
}
