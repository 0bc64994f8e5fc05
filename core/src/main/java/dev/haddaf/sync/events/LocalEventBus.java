package dev.haddaf.sync.events;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process publish/subscribe for local state changes (post created, post deleted and similar).
 * Listeners are matched by event type and invoked on the delivery executor, so a listener registered with
 * the serialization executor may mutate projection state directly.
 */
public class LocalEventBus {

    private static final Logger log = LoggerFactory.getLogger(LocalEventBus.class);

    private final Executor deliveryExecutor;
    private final List<Listener<?>> listeners = new CopyOnWriteArrayList<>();

    public LocalEventBus(Executor deliveryExecutor) {
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
    }

    public <E> EventSubscription subscribe(Class<E> eventType, Consumer<? super E> consumer) {
        Listener<E> listener = new Listener<>(eventType, consumer);
        listeners.add(listener);
        return () -> {
            listener.active = false;
            listeners.remove(listener);
        };
    }

    public void publish(Object event) {
        Objects.requireNonNull(event, "event");
        int delivered = 0;
        for (Listener<?> listener : listeners) {
            if (listener.eventType.isInstance(event)) {
                deliveryExecutor.execute(() -> listener.deliver(event));
                delivered++;
            }
        }
        log.debug("Published {} to {} listener(s)", event.getClass().getSimpleName(), delivered);
    }

    private static final class Listener<E> {

        private final Class<E> eventType;
        private final Consumer<? super E> consumer;
        private volatile boolean active = true;

        private Listener(Class<E> eventType, Consumer<? super E> consumer) {
            this.eventType = eventType;
            this.consumer = consumer;
        }

        private void deliver(Object event) {
            if (!active) {
                return;
            }
            try {
                consumer.accept(eventType.cast(event));
            } catch (RuntimeException ex) {
                log.error("Listener for {} failed", eventType.getSimpleName(), ex);
            }
        }
    }
}
