package io.chatbox.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory for stream publishers: virtual threads when the runtime offers them, daemon platform threads
 * otherwise.
 */
final class VirtualThreads {
    private static final Logger logger = LoggerFactory.getLogger(VirtualThreads.class);

    private VirtualThreads() {
    }

    static ThreadFactory newFactory(String namePrefix) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        try {
            Class<?> builderType = Class.forName("java.lang.Thread$Builder");
            Object builder = Thread.class.getMethod("ofVirtual").invoke(null);
            builder = builderType.getMethod("name", String.class, long.class).invoke(builder, namePrefix + "-", 1L);
            return (ThreadFactory) builderType.getMethod("factory").invoke(builder);
        } catch (ReflectiveOperationException | RuntimeException e) {
            logger.debug("Virtual threads unavailable, using platform threads for {}", namePrefix);
            return new NamedThreadFactory(namePrefix);
        }
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
