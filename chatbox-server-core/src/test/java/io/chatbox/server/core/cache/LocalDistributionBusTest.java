package io.chatbox.server.core.cache;

import io.chatbox.core.ChatEvent;
import io.chatbox.server.spi.DistributionBus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LocalDistributionBusTest {

    @Test
    void failingSubscriberDoesNotStopDelivery() {
        LocalDistributionBus bus = new LocalDistributionBus();
        List<ChatEvent> received = new ArrayList<>();
        bus.subscribe(e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(received::add);

        bus.publish(new ChatEvent.Clear());

        assertThat(received).containsExactly(new ChatEvent.Clear());
    }

    @Test
    void closedSubscriptionReceivesNothing() {
        LocalDistributionBus bus = new LocalDistributionBus();
        List<ChatEvent> received = new ArrayList<>();
        DistributionBus.Subscription sub = bus.subscribe(received::add);

        sub.close();
        bus.publish(new ChatEvent.MessageDeleted("msg_1"));

        assertThat(received).isEmpty();
        assertThat(bus.subscriberCount()).isZero();
    }

    @Test
    void noReplayForLateSubscribers() {
        LocalDistributionBus bus = new LocalDistributionBus();
        bus.publish(new ChatEvent.Clear());

        List<ChatEvent> received = new ArrayList<>();
        bus.subscribe(received::add);

        assertThat(received).isEmpty();
    }
}
