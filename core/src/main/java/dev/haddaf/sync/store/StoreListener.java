package dev.haddaf.sync.store;

import java.util.List;

/**
 * Receives full snapshots of a query or document. An empty list for a document listener means the document
 * does not exist. {@link #onError(Throwable)} is terminal.
 */
public interface StoreListener {

    void onSnapshot(List<StoredDocument> documents);

    void onError(Throwable error);
}
