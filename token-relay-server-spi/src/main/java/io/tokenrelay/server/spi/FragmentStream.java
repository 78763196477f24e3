package io.tokenrelay.server.spi;

import io.tokenrelay.core.Fragment;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered fragments of one upstream generation.
 *
 * <p>{@link #hasNext()} and {@link #next()} may throw unchecked exceptions to signal an
 * upstream failure. {@link #close()} releases the upstream and must be idempotent.
 */
public interface FragmentStream extends Iterator<Fragment>, AutoCloseable {

    @Override
    void close();

    /**
     * Stream over a fixed list of fragments.
     */
    static FragmentStream of(List<Fragment> fragments) {
        Objects.requireNonNull(fragments, "fragments");
        Iterator<Fragment> it = List.copyOf(fragments).iterator();
        return new FragmentStream() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public Fragment next() {
                return it.next();
            }

            @Override
            public void close() {
            }
        };
    }
}
