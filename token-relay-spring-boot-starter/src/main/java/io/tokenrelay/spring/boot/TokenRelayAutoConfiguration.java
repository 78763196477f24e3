package io.tokenrelay.spring.boot;

import io.tokenrelay.json.spi.JsonCodec;
import io.tokenrelay.server.core.InMemoryMetricsCache;
import io.tokenrelay.server.core.InMemoryRelayStore;
import io.tokenrelay.server.core.ServiceLoaderJsonCodecs;
import io.tokenrelay.server.core.TokenRelay;
import io.tokenrelay.server.spi.FragmentProducer;
import io.tokenrelay.server.spi.MetricsCache;
import io.tokenrelay.server.spi.RelayStore;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Auto-configuration for the token relay.
 *
 * <p>Provides default in-memory beans for {@link RelayStore} and {@link MetricsCache}, and a
 * {@link TokenRelay} once the application defines a {@link FragmentProducer}. Each bean can be
 * overridden by defining your own.
 *
 * @see TokenRelayServletAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(TokenRelay.class)
@EnableConfigurationProperties(TokenRelayProperties.class)
public class TokenRelayAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RelayStore tokenRelayStore() {
        return new InMemoryRelayStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsCache tokenRelayMetricsCache() {
        return new InMemoryMetricsCache(Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonCodec tokenRelayJsonCodec() {
        return ServiceLoaderJsonCodecs.defaultCodec();
    }

    /**
     * Provides the {@link TokenRelay}; requires a {@link FragmentProducer} bean.
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(FragmentProducer.class)
    public TokenRelay tokenRelay(RelayStore store, FragmentProducer producer, MetricsCache metricsCache,
                                 JsonCodec json, TokenRelayProperties properties) {
        return TokenRelay.builder(store, producer)
                .config(properties.toRelayConfig())
                .metricsCache(metricsCache)
                .jsonCodec(json)
                .build();
    }
}
