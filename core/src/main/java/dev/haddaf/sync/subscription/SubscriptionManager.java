package dev.haddaf.sync.subscription;

import dev.haddaf.sync.metrics.SyncMetrics;
import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.DocumentQuery;
import dev.haddaf.sync.store.DocumentStore;
import dev.haddaf.sync.store.StoreListener;
import dev.haddaf.sync.store.StoreRegistration;
import dev.haddaf.sync.store.StoredDocument;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the live store listeners of the sync core.
 *
 * <p>Every snapshot or error coming from the store is re-dispatched onto the serialization executor and
 * checked against the current generation of its key before it reaches the consumer. Once
 * {@link #cancel(SubscriptionHandle)} returns, or a newer subscription for the same key has been started,
 * the consumer of the old handle receives nothing more.
 */
public class SubscriptionManager {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);

    private final DocumentStore store;
    private final Executor serialExecutor;
    private final SyncMetrics metrics;
    private final AtomicLong generations = new AtomicLong();
    private final Map<SubscriptionKey, ActiveSubscription> active = new HashMap<>();

    public SubscriptionManager(DocumentStore store, Executor serialExecutor, SyncMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.serialExecutor = Objects.requireNonNull(serialExecutor, "serialExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public SubscriptionHandle start(SubscriptionKey key, DocumentQuery query, SnapshotConsumer consumer) {
        return start(key, consumer, listener -> store.listen(query, listener));
    }

    public SubscriptionHandle start(SubscriptionKey key, DocumentPath path, SnapshotConsumer consumer) {
        return start(key, consumer, listener -> store.listen(path, listener));
    }

    public void cancel(SubscriptionHandle handle) {
        if (handle == null) {
            return;
        }
        ActiveSubscription removed = null;
        synchronized (this) {
            ActiveSubscription current = active.get(handle.key());
            if (current != null && current.handle.equals(handle)) {
                removed = active.remove(handle.key());
                removed.close();
            }
        }
        if (removed != null) {
            log.debug("Cancelled subscription {} (generation {})", handle.key(), handle.generation());
        }
    }

    public void cancel(SubscriptionKey key) {
        synchronized (this) {
            ActiveSubscription removed = active.remove(key);
            if (removed != null) {
                removed.close();
            }
        }
    }

    public void cancelAll() {
        List<ActiveSubscription> removed;
        synchronized (this) {
            removed = new ArrayList<>(active.values());
            active.clear();
            removed.forEach(ActiveSubscription::close);
        }
        log.debug("Cancelled {} subscription(s)", removed.size());
    }

    public synchronized boolean isActive(SubscriptionHandle handle) {
        ActiveSubscription current = active.get(handle.key());
        return current != null && current.handle.equals(handle);
    }

    private SubscriptionHandle start(SubscriptionKey key, SnapshotConsumer consumer,
                                     Function<StoreListener, StoreRegistration> opener) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(consumer, "consumer");
        SubscriptionHandle handle;
        ActiveSubscription subscription;
        synchronized (this) {
            ActiveSubscription previous = active.remove(key);
            if (previous != null) {
                previous.close();
                log.debug("Replacing subscription {} (generation {})", key, previous.handle.generation());
            }
            handle = new SubscriptionHandle(key, generations.incrementAndGet());
            subscription = new ActiveSubscription(handle, consumer);
            active.put(key, subscription);
        }

        StoreRegistration registration;
        try {
            registration = opener.apply(new DispatchingListener(handle));
        } catch (RuntimeException ex) {
            log.warn("Failed to open subscription {}", key, ex);
            serialExecutor.execute(() -> terminate(handle, ex));
            return handle;
        }
        synchronized (this) {
            subscription.attach(registration);
        }
        return handle;
    }

    private synchronized ActiveSubscription current(SubscriptionHandle handle) {
        ActiveSubscription current = active.get(handle.key());
        return current != null && current.handle.equals(handle) ? current : null;
    }

    private void deliver(SubscriptionHandle handle, List<StoredDocument> documents) {
        ActiveSubscription subscription = current(handle);
        if (subscription == null) {
            log.debug("Dropping snapshot for stale subscription {} (generation {})", handle.key(),
                handle.generation());
            metrics.recordStaleDelivery(handle.key().name());
            return;
        }
        try {
            subscription.consumer.onSnapshot(documents);
        } catch (RuntimeException ex) {
            log.error("Consumer of subscription {} failed to apply a snapshot", handle.key(), ex);
        }
    }

    private void terminate(SubscriptionHandle handle, Throwable error) {
        ActiveSubscription subscription;
        synchronized (this) {
            subscription = current(handle);
            if (subscription == null) {
                return;
            }
            active.remove(handle.key());
            subscription.close();
        }
        log.warn("Subscription {} terminated: {}", handle.key(), error.getMessage());
        subscription.consumer.onError(error);
    }

    private final class DispatchingListener implements StoreListener {

        private final SubscriptionHandle handle;

        private DispatchingListener(SubscriptionHandle handle) {
            this.handle = handle;
        }

        @Override
        public void onSnapshot(List<StoredDocument> documents) {
            serialExecutor.execute(() -> deliver(handle, documents));
        }

        @Override
        public void onError(Throwable error) {
            serialExecutor.execute(() -> terminate(handle, error));
        }
    }

    private static final class ActiveSubscription {

        private final SubscriptionHandle handle;
        private final SnapshotConsumer consumer;
        private StoreRegistration registration;
        private boolean closed;

        private ActiveSubscription(SubscriptionHandle handle, SnapshotConsumer consumer) {
            this.handle = handle;
            this.consumer = consumer;
        }

        private void attach(StoreRegistration storeRegistration) {
            if (closed) {
                storeRegistration.remove();
            } else {
                registration = storeRegistration;
            }
        }

        private void close() {
            closed = true;
            if (registration != null) {
                registration.remove();
                registration = null;
            }
        }
    }
}
