package dev.haddaf.sync.feed;

import dev.haddaf.sync.session.SessionLifecycleListener;
import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.DocumentStore;
import dev.haddaf.sync.store.DocumentStoreException;
import dev.haddaf.sync.store.StoredDocument;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Cached reads of {@code users/{uid}} display fields. Safe to call from the fetch executor.
 *
 * <p>Entries expire after the configured time to live, and the whole cache is dropped whenever the signed in
 * user changes.
 */
public class UserProfileLookup implements SessionLifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(UserProfileLookup.class);

    static final String DEFAULT_NAME = "Player";
    static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final DocumentStore store;
    private final String usersCollection;
    private final Clock clock;
    private final Duration ttl;
    private final Map<String, CachedSummary> cache = new ConcurrentHashMap<>();

    public UserProfileLookup(DocumentStore store, String usersCollection) {
        this(store, usersCollection, Clock.systemUTC(), DEFAULT_TTL);
    }

    public UserProfileLookup(DocumentStore store, String usersCollection, Clock clock, Duration ttl) {
        this.store = Objects.requireNonNull(store, "store");
        this.usersCollection = Objects.requireNonNull(usersCollection, "usersCollection");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
    }

    public Optional<UserSummary> find(String userId) {
        if (!StringUtils.hasText(userId)) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        CachedSummary cached = cache.get(userId);
        if (cached != null && now.isBefore(cached.expiresAt())) {
            return Optional.of(cached.summary());
        }
        Optional<StoredDocument> document;
        try {
            document = store.fetch(DocumentPath.of(usersCollection, userId));
        } catch (DocumentStoreException ex) {
            log.debug("Profile lookup for {} failed: {}", userId, ex.getMessage());
            return Optional.empty();
        }
        Optional<UserSummary> summary = document.map(this::toSummary);
        if (summary.isPresent()) {
            cache.put(userId, new CachedSummary(summary.get(), now.plus(ttl)));
        } else {
            cache.remove(userId);
        }
        return summary;
    }

    @Override
    public void onSignedIn(String userId) {
        clear();
    }

    @Override
    public void onSignedOut() {
        clear();
    }

    public void clear() {
        cache.clear();
    }

    private UserSummary toSummary(StoredDocument document) {
        String first = trimmed(document.getString("firstName"));
        String last = trimmed(document.getString("lastName"));
        String fullName = (first + " " + last).trim();
        if (fullName.isEmpty()) {
            fullName = DEFAULT_NAME;
        }
        String photo = document.getString("profilePic");
        return new UserSummary(document.id(), fullName, StringUtils.hasText(photo) ? photo : null);
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }

    private record CachedSummary(UserSummary summary, Instant expiresAt) {
    }
}
