package dev.haddaf.sync.session;

import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.StoredDocument;
import dev.haddaf.sync.subscription.SnapshotConsumer;
import dev.haddaf.sync.subscription.SubscriptionHandle;
import dev.haddaf.sync.subscription.SubscriptionKey;
import dev.haddaf.sync.subscription.SubscriptionManager;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the role part of the {@link Session} in line with the live {@code users/{uid}} document.
 * {@link #start(String)} and {@link #stop()} are called on the serialization executor.
 */
public class RoleProjector {

    private static final Logger log = LoggerFactory.getLogger(RoleProjector.class);

    static final SubscriptionKey SUBSCRIPTION_KEY = new SubscriptionKey("session.role");

    private final SubscriptionManager subscriptions;
    private final SessionContext sessionContext;
    private final String usersCollection;

    private String userId;
    private SubscriptionHandle handle;
    private UserRole observedRole;
    private VerificationState observedStatus;

    public RoleProjector(SubscriptionManager subscriptions, SessionContext sessionContext, String usersCollection) {
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.sessionContext = Objects.requireNonNull(sessionContext, "sessionContext");
        this.usersCollection = Objects.requireNonNull(usersCollection, "usersCollection");
    }

    public void start(String uid) {
        Objects.requireNonNull(uid, "uid");
        userId = uid;
        observedRole = null;
        observedStatus = null;
        handle = subscriptions.start(SUBSCRIPTION_KEY, DocumentPath.of(usersCollection, uid), new UserDocumentConsumer(uid));
        log.debug("Role projection started for {}", uid);
    }

    public void stop() {
        subscriptions.cancel(handle);
        handle = null;
        userId = null;
        observedRole = null;
        observedStatus = null;
    }

    private void apply(String uid, List<StoredDocument> documents) {
        if (!uid.equals(userId)) {
            return;
        }
        RoleProjection projection;
        if (documents.isEmpty()) {
            observedRole = null;
            observedStatus = null;
            projection = RoleProjection.DEFAULT;
        } else {
            StoredDocument document = documents.get(0);
            projection = RoleProjection.project(document.data(), observedRole, observedStatus);
            observedRole = UserRole.fromValue(document.getString(RoleProjection.ROLE_FIELD)).orElse(observedRole);
            observedStatus = VerificationState.fromValue(document.getString(RoleProjection.STATUS_FIELD))
                .orElse(observedStatus);
        }
        sessionContext.update(session -> uid.equals(session.userId()) ? session.withRole(projection) : session);
    }

    private final class UserDocumentConsumer implements SnapshotConsumer {

        private final String uid;

        private UserDocumentConsumer(String uid) {
            this.uid = uid;
        }

        @Override
        public void onSnapshot(List<StoredDocument> documents) {
            apply(uid, documents);
        }

        @Override
        public void onError(Throwable error) {
            log.warn("Role subscription for {} failed; keeping last known role", uid, error);
        }
    }
}
