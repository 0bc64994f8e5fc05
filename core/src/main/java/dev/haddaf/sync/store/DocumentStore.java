package dev.haddaf.sync.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port to the realtime document store. Writes accept {@link ServerValue} sentinels as field values.
 * Failures surface as {@link DocumentStoreException}.
 */
public interface DocumentStore {

    Optional<StoredDocument> fetch(DocumentPath path);

    List<StoredDocument> query(DocumentQuery query);

    /**
     * Creates the document only when no document exists at {@code path}.
     *
     * @return {@code true} when this call created the document
     */
    boolean createIfAbsent(DocumentPath path, Map<String, Object> data);

    /**
     * Adds a document with a store generated id.
     */
    DocumentPath add(String collection, Map<String, Object> data);

    void update(DocumentPath path, Map<String, Object> fields);

    void merge(DocumentPath path, Map<String, Object> fields);

    void delete(DocumentPath path);

    /**
     * Runs {@code work} atomically. A {@link TransactionPreconditionException} thrown by the work is rethrown
     * as is; other failures surface as {@link DocumentStoreException}.
     */
    <T> T runTransaction(TransactionWork<T> work);

    StoreRegistration listen(DocumentQuery query, StoreListener listener);

    StoreRegistration listen(DocumentPath path, StoreListener listener);
}
