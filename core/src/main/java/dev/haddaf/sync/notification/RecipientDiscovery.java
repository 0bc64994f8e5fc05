package dev.haddaf.sync.notification;

import java.util.Set;

/**
 * Looks up the recipients of a batch notification. May throw {@link dev.haddaf.sync.store.DocumentStoreException}.
 */
@FunctionalInterface
public interface RecipientDiscovery {

    Set<String> discoverRecipients();
}
