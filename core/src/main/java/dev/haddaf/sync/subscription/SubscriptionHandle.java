package dev.haddaf.sync.subscription;

/**
 * Identifies one start of a subscription. A later start of the same key gets a higher generation, and
 * deliveries tagged with an older generation are discarded.
 */
public record SubscriptionHandle(SubscriptionKey key, long generation) {
}
