package dev.haddaf.sync.subscription;

import org.springframework.util.StringUtils;

/**
 * Logical name of a live subscription. At most one subscription per key is active at a time.
 */
public record SubscriptionKey(String name) {

    public SubscriptionKey {
        if (!StringUtils.hasText(name)) {
            throw new IllegalArgumentException("Subscription key must not be blank");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
