package dev.haddaf.sync.feed;

import dev.haddaf.sync.store.DocumentQuery;
import dev.haddaf.sync.store.StoredDocument;
import java.util.Optional;

/**
 * Describes one feed: which documents it follows, how to decode them and how to fill in the display fields
 * that need a second read.
 */
public interface FeedDefinition<T extends FeedEntry> {

    /**
     * Short name used for the subscription key, logs and metrics.
     */
    String name();

    DocumentQuery query(String ownerId);

    /**
     * @return the decoded item, or empty when the document is malformed
     */
    Optional<T> decode(StoredDocument document, String ownerId);

    /**
     * Completes an item with secondary lookups. Runs on the fetch executor and may block. Failures should
     * fall back to the undecorated item.
     */
    default T enrich(T item) {
        return item;
    }
}
