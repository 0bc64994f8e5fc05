package dev.haddaf.sync.store;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DocumentStore} kept in memory. Used when Firestore is disabled and in tests.
 *
 * <p>All operations run under a single lock, so transactions are serializable. Listeners receive an initial
 * snapshot on registration and a new snapshot whenever their result changes; snapshots are handed to the
 * delivery executor in commit order.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final Object lock = new Object();
    private final Map<String, Map<String, Map<String, Object>>> collections = new HashMap<>();
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final Executor deliveryExecutor;
    private final Clock clock;

    public InMemoryDocumentStore() {
        this(Runnable::run, Clock.systemUTC());
    }

    public InMemoryDocumentStore(Executor deliveryExecutor, Clock clock) {
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<StoredDocument> fetch(DocumentPath path) {
        synchronized (lock) {
            return read(path);
        }
    }

    @Override
    public List<StoredDocument> query(DocumentQuery query) {
        synchronized (lock) {
            return evaluate(query);
        }
    }

    @Override
    public boolean createIfAbsent(DocumentPath path, Map<String, Object> data) {
        synchronized (lock) {
            if (documents(path.collection()).containsKey(path.id())) {
                return false;
            }
            write(path, data, false);
            dispatch();
            return true;
        }
    }

    @Override
    public DocumentPath add(String collection, Map<String, Object> data) {
        synchronized (lock) {
            DocumentPath path = DocumentPath.of(collection, UUID.randomUUID().toString().replace("-", ""));
            write(path, data, false);
            dispatch();
            return path;
        }
    }

    @Override
    public void update(DocumentPath path, Map<String, Object> fields) {
        synchronized (lock) {
            requireExisting(path);
            write(path, fields, true);
            dispatch();
        }
    }

    @Override
    public void merge(DocumentPath path, Map<String, Object> fields) {
        synchronized (lock) {
            write(path, fields, true);
            dispatch();
        }
    }

    @Override
    public void delete(DocumentPath path) {
        synchronized (lock) {
            documents(path.collection()).remove(path.id());
            dispatch();
        }
    }

    @Override
    public <T> T runTransaction(TransactionWork<T> work) {
        synchronized (lock) {
            BufferedTransaction transaction = new BufferedTransaction();
            T result = work.execute(transaction);
            transaction.commit();
            dispatch();
            return result;
        }
    }

    @Override
    public StoreRegistration listen(DocumentQuery query, StoreListener listener) {
        return register(new Registration(listener, () -> evaluate(query), query.collection()));
    }

    @Override
    public StoreRegistration listen(DocumentPath path, StoreListener listener) {
        return register(new Registration(listener, () -> read(path).map(List::of).orElse(List.of()), path.path()));
    }

    /**
     * Terminates every active listener with the given error, as a transport failure would.
     */
    public void failListeners(Throwable error) {
        synchronized (lock) {
            for (Registration registration : registrations) {
                registrations.remove(registration);
                deliveryExecutor.execute(() -> registration.fail(error));
            }
        }
    }

    public int activeListenerCount() {
        return registrations.size();
    }

    private StoreRegistration register(Registration registration) {
        synchronized (lock) {
            registrations.add(registration);
            registration.refresh();
        }
        return () -> {
            registration.active = false;
            registrations.remove(registration);
        };
    }

    private void dispatch() {
        for (Registration registration : registrations) {
            registration.refresh();
        }
    }

    private Optional<StoredDocument> read(DocumentPath path) {
        Map<String, Object> data = documents(path.collection()).get(path.id());
        return Optional.ofNullable(data).map(fields -> new StoredDocument(path, fields));
    }

    private List<StoredDocument> evaluate(DocumentQuery query) {
        List<StoredDocument> matches = new ArrayList<>();
        documents(query.collection()).forEach((id, data) -> {
            StoredDocument document = new StoredDocument(DocumentPath.of(query.collection(), id), data);
            if (query.matches(document)) {
                matches.add(document);
            }
        });
        Comparator<StoredDocument> order = Comparator.comparing(StoredDocument::id);
        if (query.orderByField() != null) {
            Comparator<StoredDocument> byField = (left, right) -> {
                Integer comparison = FilterOperator.compare(left.get(query.orderByField()),
                    right.get(query.orderByField()));
                return comparison == null ? 0 : comparison;
            };
            order = (query.descending() ? byField.reversed() : byField).thenComparing(StoredDocument::id);
        }
        matches.sort(order);
        if (query.limit() != null && matches.size() > query.limit()) {
            return List.copyOf(matches.subList(0, query.limit()));
        }
        return List.copyOf(matches);
    }

    private void requireExisting(DocumentPath path) {
        if (!documents(path.collection()).containsKey(path.id())) {
            throw new DocumentStoreException("No document to update: " + path);
        }
    }

    private void write(DocumentPath path, Map<String, Object> fields, boolean mergeWithExisting) {
        Map<String, Map<String, Object>> documents = documents(path.collection());
        Map<String, Object> target = new LinkedHashMap<>();
        if (mergeWithExisting && documents.containsKey(path.id())) {
            target.putAll(documents.get(path.id()));
        }
        Instant now = clock.instant();
        fields.forEach((field, value) -> {
            if (value == ServerValue.DELETE) {
                target.remove(field);
            } else if (value == ServerValue.TIMESTAMP) {
                target.put(field, now);
            } else {
                target.put(field, value);
            }
        });
        documents.put(path.id(), target);
    }

    private Map<String, Map<String, Object>> documents(String collection) {
        return collections.computeIfAbsent(collection, key -> new LinkedHashMap<>());
    }

    private final class Registration {

        private final StoreListener listener;
        private final Supplier<List<StoredDocument>> snapshot;
        private final String description;
        private volatile boolean active = true;
        private List<StoredDocument> lastDelivered;

        private Registration(StoreListener listener,
                             Supplier<List<StoredDocument>> snapshot,
                             String description) {
            this.listener = listener;
            this.snapshot = snapshot;
            this.description = description;
        }

        private void refresh() {
            List<StoredDocument> current = snapshot.get();
            if (current.equals(lastDelivered)) {
                return;
            }
            lastDelivered = current;
            deliveryExecutor.execute(() -> {
                if (active) {
                    listener.onSnapshot(current);
                }
            });
        }

        private void fail(Throwable error) {
            if (active) {
                active = false;
                log.debug("Terminating listener on {}", description);
                listener.onError(error);
            }
        }
    }

    private final class BufferedTransaction implements StoreTransaction {

        private final List<Runnable> writes = new ArrayList<>();

        @Override
        public Optional<StoredDocument> get(DocumentPath path) {
            if (!writes.isEmpty()) {
                throw new IllegalStateException("Transactions require all reads to be executed before all writes");
            }
            return read(path);
        }

        @Override
        public void update(DocumentPath path, Map<String, Object> fields) {
            Map<String, Object> copy = new LinkedHashMap<>(fields);
            writes.add(() -> {
                requireExisting(path);
                write(path, copy, true);
            });
        }

        @Override
        public void merge(DocumentPath path, Map<String, Object> fields) {
            Map<String, Object> copy = new LinkedHashMap<>(fields);
            writes.add(() -> write(path, copy, true));
        }

        private void commit() {
            Map<String, Map<String, Map<String, Object>>> backup = new HashMap<>();
            collections.forEach((name, documents) -> backup.put(name, new LinkedHashMap<>(documents)));
            try {
                writes.forEach(Runnable::run);
            } catch (RuntimeException ex) {
                collections.clear();
                collections.putAll(backup);
                throw ex;
            }
        }
    }
}
