package dev.haddaf.sync.notification;

import dev.haddaf.sync.events.EventSubscription;
import dev.haddaf.sync.metrics.SyncMetrics;
import dev.haddaf.sync.session.SessionLifecycleListener;
import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.DocumentQuery;
import dev.haddaf.sync.store.DocumentStore;
import dev.haddaf.sync.store.DocumentStoreException;
import dev.haddaf.sync.store.StoredDocument;
import dev.haddaf.sync.subscription.SnapshotConsumer;
import dev.haddaf.sync.subscription.SubscriptionHandle;
import dev.haddaf.sync.subscription.SubscriptionKey;
import dev.haddaf.sync.subscription.SubscriptionManager;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live list of the signed in user's notifications, newest first, with the unread counter derived from it.
 * Dismissed records are hidden.
 */
public class NotificationInbox implements SessionLifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(NotificationInbox.class);

    static final SubscriptionKey SUBSCRIPTION_KEY = new SubscriptionKey("notifications.inbox");

    private final SubscriptionManager subscriptions;
    private final DocumentStore store;
    private final SyncMetrics metrics;
    private final String notificationsCollection;
    private final List<Consumer<InboxState>> listeners = new CopyOnWriteArrayList<>();

    private volatile InboxState state = InboxState.empty();
    private volatile String userId;
    private SubscriptionHandle handle;

    public NotificationInbox(SubscriptionManager subscriptions,
                             DocumentStore store,
                             SyncMetrics metrics,
                             String notificationsCollection) {
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.store = Objects.requireNonNull(store, "store");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.notificationsCollection = Objects.requireNonNull(notificationsCollection, "notificationsCollection");
    }

    @Override
    public void onSignedIn(String uid) {
        userId = uid;
        publish(new InboxState(List.of(), 0, true, false));
        DocumentQuery query = DocumentQuery.collection(notificationsCollection)
            .whereEqualTo(NotificationRecord.USER_ID, uid)
            .orderBy(NotificationRecord.CREATED_AT, true);
        handle = subscriptions.start(SUBSCRIPTION_KEY, query, new InboxConsumer(uid));
    }

    @Override
    public void onSignedOut() {
        subscriptions.cancel(handle);
        handle = null;
        userId = null;
        publish(InboxState.empty());
    }

    public InboxState state() {
        return state;
    }

    public int unreadCount() {
        return state.unreadCount();
    }

    public Optional<NotificationRecord> find(String notificationId) {
        return state.notifications().stream()
            .filter(notification -> notification.id().equals(notificationId))
            .findFirst();
    }

    public EventSubscription subscribe(Consumer<InboxState> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * @return {@code true} when the store accepted the change
     */
    public boolean markRead(String notificationId) {
        return write(notificationId, Map.of(NotificationRecord.IS_READ, true), "mark read");
    }

    /**
     * Flags every unread record of the user as read. Records are kept so their idempotency keys stay taken.
     *
     * @return the number of records updated
     */
    public int markAllRead(String uid) {
        DocumentQuery unread = DocumentQuery.collection(notificationsCollection)
            .whereEqualTo(NotificationRecord.USER_ID, uid)
            .whereEqualTo(NotificationRecord.IS_READ, false);
        List<StoredDocument> documents;
        try {
            documents = store.query(unread);
        } catch (DocumentStoreException ex) {
            log.error("Failed to load unread notifications of {}", uid, ex);
            return 0;
        }
        int updated = 0;
        for (StoredDocument document : documents) {
            if (write(document.id(), Map.of(NotificationRecord.IS_READ, true), "mark read")) {
                updated++;
            }
        }
        log.info("Marked {} of {} notification(s) read for {}", updated, documents.size(), uid);
        return updated;
    }

    /**
     * Hides a record from the inbox without deleting it.
     */
    public boolean dismiss(String notificationId) {
        return write(notificationId, Map.of(NotificationRecord.DISMISSED, true, NotificationRecord.IS_READ, true),
            "dismiss");
    }

    private boolean write(String notificationId, Map<String, Object> fields, String action) {
        try {
            store.update(DocumentPath.of(notificationsCollection, notificationId), fields);
            return true;
        } catch (DocumentStoreException ex) {
            log.error("Failed to {} notification {}", action, notificationId, ex);
            return false;
        }
    }

    private void apply(String uid, List<StoredDocument> documents) {
        if (!uid.equals(userId)) {
            return;
        }
        List<NotificationRecord> visible = new ArrayList<>(documents.size());
        for (StoredDocument document : documents) {
            Optional<NotificationRecord> record = NotificationRecord.fromDocument(document);
            if (record.isEmpty()) {
                log.warn("Dropping malformed notification {}", document.path());
                metrics.recordMalformedDocument("notifications");
            } else if (!record.get().dismissed()) {
                visible.add(record.get());
            }
        }
        publish(InboxState.of(visible));
    }

    private void publish(InboxState next) {
        state = next;
        for (Consumer<InboxState> listener : listeners) {
            listener.accept(next);
        }
    }

    private final class InboxConsumer implements SnapshotConsumer {

        private final String uid;

        private InboxConsumer(String uid) {
            this.uid = uid;
        }

        @Override
        public void onSnapshot(List<StoredDocument> documents) {
            apply(uid, documents);
        }

        @Override
        public void onError(Throwable error) {
            if (uid.equals(userId)) {
                log.warn("Notification subscription for {} failed; keeping last inbox", uid, error);
                publish(state.markStale());
            }
        }
    }
}
