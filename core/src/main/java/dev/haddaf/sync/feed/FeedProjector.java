package dev.haddaf.sync.feed;

import dev.haddaf.sync.events.EventSubscription;
import dev.haddaf.sync.metrics.SyncMetrics;
import dev.haddaf.sync.session.SessionLifecycleListener;
import dev.haddaf.sync.store.StoredDocument;
import dev.haddaf.sync.subscription.SnapshotConsumer;
import dev.haddaf.sync.subscription.SubscriptionHandle;
import dev.haddaf.sync.subscription.SubscriptionKey;
import dev.haddaf.sync.subscription.SubscriptionManager;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live, ordered projection of one feed for the signed in user.
 *
 * <p>Each snapshot is decoded, enriched concurrently on the fetch executor and published once all of its
 * enrichments settled, unless a newer snapshot arrived in the meantime. Local changes
 * ({@link #applyCreated}, {@link #applyDeleted}, {@link #applyUpdate}) show up immediately and are replaced
 * by the next snapshot; ids deleted locally stay hidden until a snapshot without them arrives or the
 * tombstone expires.
 *
 * <p>State is mutated on the serialization executor only; {@link #state()} may be read from any thread.
 */
public class FeedProjector<T extends FeedEntry> implements SessionLifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(FeedProjector.class);

    private static final Comparator<FeedEntry> NEWEST_FIRST = Comparator.comparing(FeedEntry::orderingTimestamp,
        Comparator.nullsLast(Comparator.reverseOrder()));

    private final FeedDefinition<T> definition;
    private final SubscriptionManager subscriptions;
    private final Executor serialExecutor;
    private final Executor fetchExecutor;
    private final SyncMetrics metrics;
    private final Clock clock;
    private final Duration tombstoneTtl;
    private final SubscriptionKey subscriptionKey;
    private final List<Consumer<FeedState<T>>> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, Instant> tombstones = new HashMap<>();

    private volatile FeedState<T> state = FeedState.idle();
    private String ownerId;
    private SubscriptionHandle handle;
    private long snapshotSequence;

    public FeedProjector(FeedDefinition<T> definition,
                         SubscriptionManager subscriptions,
                         Executor serialExecutor,
                         Executor fetchExecutor,
                         SyncMetrics metrics,
                         Clock clock,
                         Duration tombstoneTtl) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.serialExecutor = Objects.requireNonNull(serialExecutor, "serialExecutor");
        this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetchExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tombstoneTtl = Objects.requireNonNull(tombstoneTtl, "tombstoneTtl");
        this.subscriptionKey = new SubscriptionKey("feed." + definition.name());
    }

    @Override
    public void onSignedIn(String userId) {
        start(userId);
    }

    @Override
    public void onSignedOut() {
        stop();
    }

    public void start(String owner) {
        Objects.requireNonNull(owner, "owner");
        ownerId = owner;
        snapshotSequence++;
        tombstones.clear();
        publish(FeedState.loadingState());
        handle = subscriptions.start(subscriptionKey, definition.query(owner), new FeedConsumer(owner));
    }

    public void stop() {
        subscriptions.cancel(handle);
        handle = null;
        ownerId = null;
        snapshotSequence++;
        tombstones.clear();
        publish(FeedState.idle());
    }

    public FeedState<T> state() {
        return state;
    }

    public Optional<String> ownerId() {
        return Optional.ofNullable(ownerId);
    }

    public EventSubscription subscribe(Consumer<FeedState<T>> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Inserts a locally created item at the head unless an item with the same id is already present.
     */
    public void applyCreated(T item) {
        tombstones.remove(item.id());
        List<T> items = state.items();
        if (items.stream().anyMatch(existing -> existing.id().equals(item.id()))) {
            return;
        }
        List<T> next = new ArrayList<>(items.size() + 1);
        next.add(item);
        next.addAll(items);
        publish(state.withItems(next));
    }

    public void applyDeleted(String id) {
        tombstones.put(id, clock.instant());
        List<T> next = state.items().stream().filter(item -> !item.id().equals(id)).toList();
        publish(state.withItems(next));
    }

    public void applyUpdate(String id, UnaryOperator<T> change) {
        List<T> next = state.items().stream()
            .map(item -> item.id().equals(id) ? change.apply(item) : item)
            .toList();
        publish(state.withItems(next));
    }

    private void onSnapshot(String owner, List<StoredDocument> documents) {
        if (!owner.equals(ownerId)) {
            return;
        }
        long sequence = ++snapshotSequence;
        List<T> decoded = decode(owner, documents);
        List<CompletableFuture<T>> enrichments = new ArrayList<>(decoded.size());
        for (T item : decoded) {
            enrichments.add(CompletableFuture.supplyAsync(() -> definition.enrich(item), fetchExecutor)
                .exceptionally(ex -> {
                    log.warn("Enrichment of {} item {} failed; publishing it undecorated", definition.name(),
                        item.id(), ex);
                    return item;
                }));
        }
        CompletableFuture.allOf(enrichments.toArray(new CompletableFuture[0]))
            .whenComplete((ignored, error) -> serialExecutor.execute(() -> publishSnapshot(sequence, owner,
                enrichments.stream().map(CompletableFuture::join).toList())));
    }

    private List<T> decode(String owner, List<StoredDocument> documents) {
        List<T> decoded = new ArrayList<>(documents.size());
        for (StoredDocument document : documents) {
            Optional<T> item = definition.decode(document, owner);
            if (item.isPresent()) {
                decoded.add(item.get());
            } else {
                log.warn("Dropping malformed {} document {}", definition.name(), document.path());
                metrics.recordMalformedDocument(definition.name());
            }
        }
        return decoded;
    }

    private void publishSnapshot(long sequence, String owner, List<T> items) {
        if (sequence != snapshotSequence || !owner.equals(ownerId)) {
            log.debug("Discarding superseded {} snapshot {}", definition.name(), sequence);
            return;
        }
        Set<String> snapshotIds = new HashSet<>();
        items.forEach(item -> snapshotIds.add(item.id()));
        Instant expiry = clock.instant().minus(tombstoneTtl);
        tombstones.entrySet().removeIf(entry -> !snapshotIds.contains(entry.getKey())
            || entry.getValue().isBefore(expiry));

        List<T> visible = new ArrayList<>(items.size());
        for (T item : items) {
            if (!tombstones.containsKey(item.id())) {
                visible.add(item);
            }
        }
        visible.sort(NEWEST_FIRST);
        publish(new FeedState<>(visible, false, false));
    }

    private void publish(FeedState<T> next) {
        state = next;
        for (Consumer<FeedState<T>> listener : listeners) {
            listener.accept(next);
        }
    }

    private final class FeedConsumer implements SnapshotConsumer {

        private final String owner;

        private FeedConsumer(String owner) {
            this.owner = owner;
        }

        @Override
        public void onSnapshot(List<StoredDocument> documents) {
            FeedProjector.this.onSnapshot(owner, documents);
        }

        @Override
        public void onError(Throwable error) {
            if (!owner.equals(ownerId)) {
                return;
            }
            handle = null;
            log.warn("Feed {} subscription failed; keeping {} item(s) as stale", definition.name(),
                state.items().size(), error);
            publish(state.markStale());
        }
    }
}
