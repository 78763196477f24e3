package io.tokenrelay.server.spi;

import java.util.Objects;

/**
 * One conversation message forwarded to the upstream provider.
 *
 * @param role speaker role ({@code system}, {@code user}, {@code assistant})
 * @param content message text
 */
public record Message(String role, String content) {
    public Message {
        Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
    }
}
