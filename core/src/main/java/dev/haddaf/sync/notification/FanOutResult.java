package dev.haddaf.sync.notification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome per recipient of one fan-out, in recipient order.
 */
public record FanOutResult(Map<String, NotificationOutcome> outcomes) {

    public FanOutResult {
        outcomes = outcomes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public static FanOutResult empty() {
        return new FanOutResult(Map.of());
    }

    public NotificationOutcome outcomeFor(String recipientId) {
        return outcomes.get(recipientId);
    }

    public long count(NotificationOutcome outcome) {
        return outcomes.values().stream().filter(outcome::equals).count();
    }

    public long createdCount() {
        return count(NotificationOutcome.CREATED);
    }

    public boolean hasFailures() {
        return count(NotificationOutcome.FAILED) > 0;
    }
}
