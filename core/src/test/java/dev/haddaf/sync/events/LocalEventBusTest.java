package dev.haddaf.sync.events;

import static org.assertj.core.api.Assertions.assertThat;

import dev.haddaf.sync.QueuedExecutor;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LocalEventBusTest {

    private QueuedExecutor executor;
    private LocalEventBus bus;

    @BeforeEach
    void setUp() {
        executor = new QueuedExecutor();
        bus = new LocalEventBus(executor);
    }

    @Test
    void deliversMatchingEventsOnTheDeliveryExecutor() {
        List<Object> received = new ArrayList<>();
        bus.subscribe(String.class, received::add);
        bus.subscribe(Integer.class, received::add);

        bus.publish("post-1");
        assertThat(received).isEmpty();

        executor.runAll();
        assertThat(received).containsExactly("post-1");
    }

    @Test
    void supertypeSubscribersReceiveSubtypes() {
        List<Number> received = new ArrayList<>();
        bus.subscribe(Number.class, received::add);

        bus.publish(7L);
        bus.publish(2.5d);
        executor.runAll();

        assertThat(received).containsExactly(7L, 2.5d);
    }

    @Test
    void cancelledSubscriptionDropsQueuedEvents() {
        List<String> received = new ArrayList<>();
        EventSubscription subscription = bus.subscribe(String.class, received::add);

        bus.publish("queued");
        subscription.cancel();
        executor.runAll();

        assertThat(received).isEmpty();
    }

    @Test
    void failingListenerDoesNotAffectOthers() {
        List<String> received = new ArrayList<>();
        bus.subscribe(String.class, event -> {
            throw new IllegalStateException("listener bug");
        });
        bus.subscribe(String.class, received::add);

        bus.publish("post-2");
        executor.runAll();

        assertThat(received).containsExactly("post-2");
    }

    @Test
    void compositeSubscriptionCancelsAll() {
        List<Object> received = new ArrayList<>();
        EventSubscription subscription = EventSubscription.composite(
            bus.subscribe(String.class, received::add),
            bus.subscribe(Integer.class, received::add));

        subscription.cancel();
        bus.publish("post-3");
        bus.publish(3);
        executor.runAll();

        assertThat(received).isEmpty();
    }
}
