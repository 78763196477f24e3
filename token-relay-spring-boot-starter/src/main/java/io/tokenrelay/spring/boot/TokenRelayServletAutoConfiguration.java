package io.tokenrelay.spring.boot;

import io.tokenrelay.json.spi.JsonCodec;
import io.tokenrelay.server.core.TokenRelay;
import io.tokenrelay.servlet.TokenRelayServlet;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Provides a {@link TokenRelayServlet} when the servlet transport is on the classpath.
 *
 * <p>No servlet mapping is registered. Register the servlet yourself, with async support:
 * <pre>{@code
 * @Bean
 * public ServletRegistrationBean<TokenRelayServlet> relayServlet(TokenRelayServlet servlet) {
 *     ServletRegistrationBean<TokenRelayServlet> bean = new ServletRegistrationBean<>(servlet, "/api/stream");
 *     bean.setAsyncSupported(true);
 *     return bean;
 * }
 * }</pre>
 */
@AutoConfiguration(after = TokenRelayAutoConfiguration.class)
@ConditionalOnClass(name = "jakarta.servlet.http.HttpServlet", value = TokenRelayServlet.class)
public class TokenRelayServletAutoConfiguration {

    @Bean(destroyMethod = "destroy")
    @ConditionalOnMissingBean
    @ConditionalOnBean(TokenRelay.class)
    public TokenRelayServlet tokenRelayServlet(TokenRelay relay, JsonCodec json) {
        return new TokenRelayServlet(relay, json);
    }
}
