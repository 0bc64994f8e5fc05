package dev.haddaf.sync.notification;

import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.DocumentStore;
import dev.haddaf.sync.store.DocumentStoreException;
import dev.haddaf.sync.store.StoredDocument;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads notification preferences from {@code users/{uid}}. When the read fails the user is treated as opted
 * in.
 */
public class NotificationPreferences {

    private static final Logger log = LoggerFactory.getLogger(NotificationPreferences.class);

    private final DocumentStore store;
    private final String usersCollection;

    public NotificationPreferences(DocumentStore store, String usersCollection) {
        this.store = Objects.requireNonNull(store, "store");
        this.usersCollection = Objects.requireNonNull(usersCollection, "usersCollection");
    }

    public PreferenceSet load(String userId) {
        try {
            return store.fetch(DocumentPath.of(usersCollection, userId))
                .map(StoredDocument::data)
                .map(PreferenceSet::fromUserDocument)
                .orElse(PreferenceSet.ALL_ENABLED);
        } catch (DocumentStoreException ex) {
            log.warn("Could not read notification preferences of {}; treating all types as enabled", userId, ex);
            return PreferenceSet.ALL_ENABLED;
        }
    }

    public boolean isEnabled(String userId, NotificationType type) {
        return !type.isPreferenceGated() || load(userId).isEnabled(type);
    }
}
