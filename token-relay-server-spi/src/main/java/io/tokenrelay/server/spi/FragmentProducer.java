package io.tokenrelay.server.spi;

/**
 * Upstream generation service.
 *
 * <p>Opening a stream starts one generation; the returned {@link FragmentStream} yields
 * fragments in upstream order. Implementations may block in {@code hasNext()} while waiting
 * for the next fragment.
 */
@FunctionalInterface
public interface FragmentProducer {

    FragmentStream open(StreamRequest request) throws Exception;
}
