package io.chatbox.server.core.cache;

import io.chatbox.core.ChatEvent;
import io.chatbox.server.spi.DistributionBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process {@link DistributionBus}. Delivery is synchronous on the publishing thread; subscribers are expected to
 * hand events off (the stream publisher queues them).
 */
public final class LocalDistributionBus implements DistributionBus {
    private static final Logger logger = LoggerFactory.getLogger(LocalDistributionBus.class);

    private final List<Consumer<? super ChatEvent>> listeners = new CopyOnWriteArrayList<>();

    @Override
    public void publish(ChatEvent event) {
        Objects.requireNonNull(event, "event");
        for (Consumer<? super ChatEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                logger.warn("Subscriber failed on {}", event.getClass().getSimpleName(), e);
            }
        }
    }

    @Override
    public Subscription subscribe(Consumer<? super ChatEvent> listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int subscriberCount() {
        return listeners.size();
    }
}
