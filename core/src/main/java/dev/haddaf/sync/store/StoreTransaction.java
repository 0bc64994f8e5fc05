package dev.haddaf.sync.store;

import java.util.Map;
import java.util.Optional;

/**
 * Transaction scope handed to {@link TransactionWork}. All reads must happen before the first write.
 */
public interface StoreTransaction {

    Optional<StoredDocument> get(DocumentPath path);

    /**
     * Updates fields of an existing document; the commit fails when the document is missing.
     */
    void update(DocumentPath path, Map<String, Object> fields);

    /**
     * Creates the document or merges the given fields into it.
     */
    void merge(DocumentPath path, Map<String, Object> fields);
}
