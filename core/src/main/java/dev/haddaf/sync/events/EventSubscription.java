package dev.haddaf.sync.events;

/**
 * Handle returned when registering a listener. Cancelling twice is harmless.
 */
@FunctionalInterface
public interface EventSubscription {

    void cancel();

    static EventSubscription composite(EventSubscription... subscriptions) {
        return () -> {
            for (EventSubscription subscription : subscriptions) {
                subscription.cancel();
            }
        };
    }
}
