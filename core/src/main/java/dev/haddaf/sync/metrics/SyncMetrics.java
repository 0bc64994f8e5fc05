package dev.haddaf.sync.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Counters for the sync core: dropped documents, late subscription deliveries and notification outcomes.
 */
public class SyncMetrics {

    public static final String METRIC_MALFORMED_DOCUMENTS = "sync.documents.malformed";
    public static final String METRIC_STALE_DELIVERIES = "sync.subscription.stale.dropped";
    public static final String METRIC_NOTIFICATION_OUTCOMES = "sync.notifications.outcome";

    private final MeterRegistry meterRegistry;
    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

    public SyncMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Metrics backed by a private registry, for components created outside the application context.
     */
    public static SyncMetrics detached() {
        return new SyncMetrics(new SimpleMeterRegistry());
    }

    public void recordMalformedDocument(String source) {
        counter(METRIC_MALFORMED_DOCUMENTS, "Remote documents dropped because they could not be decoded",
            Tags.of("source", source)).increment();
    }

    public void recordStaleDelivery(String subscription) {
        counter(METRIC_STALE_DELIVERIES, "Snapshots discarded after their subscription was replaced or cancelled",
            Tags.of("subscription", subscription)).increment();
    }

    public void recordNotificationOutcome(String type, String outcome) {
        counter(METRIC_NOTIFICATION_OUTCOMES, "Per-recipient notification fan-out outcomes",
            Tags.of("type", type, "outcome", outcome)).increment();
    }

    private Counter counter(String name, String description, Tags tags) {
        return counters.computeIfAbsent(name + tags, ignored -> Counter.builder(name)
            .description(description)
            .tags(tags)
            .register(meterRegistry));
    }
}
