package dev.haddaf.sync.firestore;

import com.google.api.core.ApiFuture;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.ListenerRegistration;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.SetOptions;
import com.google.cloud.firestore.Transaction;
import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.DocumentQuery;
import dev.haddaf.sync.store.DocumentStore;
import dev.haddaf.sync.store.DocumentStoreException;
import dev.haddaf.sync.store.QueryFilter;
import dev.haddaf.sync.store.StoreListener;
import dev.haddaf.sync.store.StoreRegistration;
import dev.haddaf.sync.store.StoreTransaction;
import dev.haddaf.sync.store.StoredDocument;
import dev.haddaf.sync.store.TransactionPreconditionException;
import dev.haddaf.sync.store.TransactionWork;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DocumentStore} backed by Google Cloud Firestore. Blocking calls wait on the client's futures;
 * snapshot listeners are invoked on the supplied executor.
 */
public class FirestoreDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(FirestoreDocumentStore.class);

    private final Firestore firestore;
    private final Executor listenerExecutor;

    public FirestoreDocumentStore(Firestore firestore, Executor listenerExecutor) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.listenerExecutor = Objects.requireNonNull(listenerExecutor, "listenerExecutor");
    }

    @Override
    public Optional<StoredDocument> fetch(DocumentPath path) {
        DocumentSnapshot snapshot = await(reference(path).get(), "read " + path);
        return snapshot.exists() ? Optional.of(toDocument(snapshot)) : Optional.empty();
    }

    @Override
    public List<StoredDocument> query(DocumentQuery query) {
        QuerySnapshot snapshot = await(toQuery(query).get(), "query " + query.collection());
        return toDocuments(snapshot.getDocuments());
    }

    @Override
    public boolean createIfAbsent(DocumentPath path, Map<String, Object> data) {
        try {
            reference(path).create(FirestoreValues.toFirestore(data)).get();
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DocumentStoreException("Interrupted while creating " + path, ex);
        } catch (ExecutionException ex) {
            if (isAlreadyExists(ex)) {
                log.debug("Document {} already exists; create skipped", path);
                return false;
            }
            throw new DocumentStoreException("Failed to create " + path, ex.getCause());
        }
    }

    @Override
    public DocumentPath add(String collection, Map<String, Object> data) {
        DocumentReference reference = await(firestore.collection(collection).add(FirestoreValues.toFirestore(data)),
            "add to " + collection);
        return DocumentPath.of(collection, reference.getId());
    }

    @Override
    public void update(DocumentPath path, Map<String, Object> fields) {
        await(reference(path).update(FirestoreValues.toFirestore(fields)), "update " + path);
    }

    @Override
    public void merge(DocumentPath path, Map<String, Object> fields) {
        await(reference(path).set(FirestoreValues.toFirestore(fields), SetOptions.merge()), "merge " + path);
    }

    @Override
    public void delete(DocumentPath path) {
        await(reference(path).delete(), "delete " + path);
    }

    @Override
    public <T> T runTransaction(TransactionWork<T> work) {
        try {
            return firestore.runTransaction(transaction -> work.execute(new FirestoreStoreTransaction(transaction)))
                .get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DocumentStoreException("Interrupted while running transaction", ex);
        } catch (ExecutionException ex) {
            TransactionPreconditionException rejection = findCause(ex, TransactionPreconditionException.class);
            if (rejection != null) {
                throw rejection;
            }
            throw new DocumentStoreException("Transaction failed", ex.getCause());
        }
    }

    @Override
    public StoreRegistration listen(DocumentQuery query, StoreListener listener) {
        ListenerRegistration registration = toQuery(query).addSnapshotListener(listenerExecutor,
            (snapshot, error) -> {
                if (error != null) {
                    listener.onError(new DocumentStoreException("Listener on " + query.collection() + " failed", error));
                    return;
                }
                if (snapshot != null) {
                    listener.onSnapshot(toDocuments(snapshot.getDocuments()));
                }
            });
        return registration::remove;
    }

    @Override
    public StoreRegistration listen(DocumentPath path, StoreListener listener) {
        ListenerRegistration registration = reference(path).addSnapshotListener(listenerExecutor,
            (snapshot, error) -> {
                if (error != null) {
                    listener.onError(new DocumentStoreException("Listener on " + path + " failed", error));
                    return;
                }
                if (snapshot != null) {
                    listener.onSnapshot(snapshot.exists() ? List.of(toDocument(snapshot)) : List.of());
                }
            });
        return registration::remove;
    }

    private DocumentReference reference(DocumentPath path) {
        return firestore.collection(path.collection()).document(path.id());
    }

    private Query toQuery(DocumentQuery query) {
        Query result = firestore.collection(query.collection());
        for (QueryFilter filter : query.filters()) {
            Object value = FirestoreValues.toFirestore(filter.value());
            result = switch (filter.operator()) {
                case EQUAL -> result.whereEqualTo(filter.field(), value);
                case LESS_THAN -> result.whereLessThan(filter.field(), value);
                case LESS_THAN_OR_EQUAL -> result.whereLessThanOrEqualTo(filter.field(), value);
                case GREATER_THAN -> result.whereGreaterThan(filter.field(), value);
                case GREATER_THAN_OR_EQUAL -> result.whereGreaterThanOrEqualTo(filter.field(), value);
            };
        }
        if (query.orderByField() != null) {
            result = result.orderBy(query.orderByField(),
                query.descending() ? Query.Direction.DESCENDING : Query.Direction.ASCENDING);
        }
        if (query.limit() != null) {
            result = result.limit(query.limit());
        }
        return result;
    }

    private static List<StoredDocument> toDocuments(List<QueryDocumentSnapshot> snapshots) {
        List<StoredDocument> documents = new ArrayList<>(snapshots.size());
        for (QueryDocumentSnapshot snapshot : snapshots) {
            documents.add(toDocument(snapshot));
        }
        return List.copyOf(documents);
    }

    private static StoredDocument toDocument(DocumentSnapshot snapshot) {
        DocumentPath path = DocumentPath.of(snapshot.getReference().getParent().getPath(), snapshot.getId());
        return new StoredDocument(path, FirestoreValues.fromFirestore(snapshot.getData()));
    }

    private static <T> T await(ApiFuture<T> future, String operation) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DocumentStoreException("Interrupted during Firestore " + operation, ex);
        } catch (ExecutionException ex) {
            throw new DocumentStoreException("Firestore " + operation + " failed", ex.getCause());
        }
    }

    static boolean isAlreadyExists(Throwable error) {
        Throwable candidate = error;
        while (candidate != null) {
            if (candidate instanceof ApiException apiException
                && apiException.getStatusCode().getCode() == StatusCode.Code.ALREADY_EXISTS) {
                return true;
            }
            String message = candidate.getMessage();
            if (message != null && message.contains("ALREADY_EXISTS")) {
                return true;
            }
            candidate = candidate.getCause();
        }
        return false;
    }

    private static <E extends Throwable> E findCause(Throwable error, Class<E> type) {
        Throwable candidate = error;
        while (candidate != null) {
            if (type.isInstance(candidate)) {
                return type.cast(candidate);
            }
            candidate = candidate.getCause();
        }
        return null;
    }

    private final class FirestoreStoreTransaction implements StoreTransaction {

        private final Transaction transaction;

        private FirestoreStoreTransaction(Transaction transaction) {
            this.transaction = transaction;
        }

        @Override
        public Optional<StoredDocument> get(DocumentPath path) {
            DocumentSnapshot snapshot = await(transaction.get(reference(path)), "transactional read of " + path);
            return snapshot.exists() ? Optional.of(toDocument(snapshot)) : Optional.empty();
        }

        @Override
        public void update(DocumentPath path, Map<String, Object> fields) {
            transaction.update(reference(path), FirestoreValues.toFirestore(fields));
        }

        @Override
        public void merge(DocumentPath path, Map<String, Object> fields) {
            transaction.set(reference(path), FirestoreValues.toFirestore(fields), SetOptions.merge());
        }
    }
}
