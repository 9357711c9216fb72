package io.chatbox.server.spi;

import io.chatbox.core.ChatEvent;

import java.util.function.Consumer;

/**
 * Fire-and-forget fan-out of {@link ChatEvent}s to every current subscriber.
 *
 * <p>No persistence and no replay: a subscriber only sees events published while subscribed. A failing
 * subscriber never affects other subscribers or the publisher.
 */
public interface DistributionBus {

    void publish(ChatEvent event);

    Subscription subscribe(Consumer<? super ChatEvent> listener);

    /**
     * Handle returned by {@link #subscribe}; closing it stops delivery.
     */
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
