package io.tokenrelay.server.core;

import java.lang.reflect.Method;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for relay work. Stream orchestrations use virtual threads when the running JDK
 * has them; CPU-bound transforms use a bounded pool.
 */
public final class VirtualThreads {
    private VirtualThreads() {
    }

    public static ExecutorService newExecutor(String namePrefix) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        try {
            Method method = Executors.class.getMethod("newVirtualThreadPerTaskExecutor");
            return (ExecutorService) method.invoke(null);
        } catch (ReflectiveOperationException unavailable) {
            return Executors.newCachedThreadPool(new NamedThreadFactory(namePrefix));
        }
    }

    public static ExecutorService newBoundedExecutor(String namePrefix, int threads) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (threads <= 0) throw new IllegalArgumentException("threads must be positive");
        return Executors.newFixedThreadPool(threads, new NamedThreadFactory(namePrefix));
    }

    static ThreadFactory namedFactory(String namePrefix) {
        return new NamedThreadFactory(namePrefix);
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
