package dev.haddaf.sync.subscription;

import dev.haddaf.sync.store.StoredDocument;
import java.util.List;

/**
 * Receives the deliveries of one subscription on the serialization executor.
 */
public interface SnapshotConsumer {

    void onSnapshot(List<StoredDocument> documents);

    /**
     * Called once when the subscription fails. The subscription is already removed; the consumer may start
     * it again.
     */
    void onError(Throwable error);
}
