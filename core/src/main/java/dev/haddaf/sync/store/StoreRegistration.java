package dev.haddaf.sync.store;

@FunctionalInterface
public interface StoreRegistration {

    /**
     * Stops deliveries. Calling it more than once has no effect.
     */
    void remove();
}
