package dev.haddaf.sync.notification;

import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.DocumentQuery;
import dev.haddaf.sync.store.DocumentStore;
import dev.haddaf.sync.store.StoredDocument;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import org.springframework.util.StringUtils;

/**
 * Recipient queries used by the scheduled challenge notifications.
 */
public class RecipientDirectory {

    static final String SUBMISSIONS = "submissions";

    private final DocumentStore store;
    private final String usersCollection;
    private final String challengesCollection;

    public RecipientDirectory(DocumentStore store, String usersCollection, String challengesCollection) {
        this.store = Objects.requireNonNull(store, "store");
        this.usersCollection = Objects.requireNonNull(usersCollection, "usersCollection");
        this.challengesCollection = Objects.requireNonNull(challengesCollection, "challengesCollection");
    }

    /**
     * Users who submitted a video to the challenge; several submissions by one user count once.
     */
    public RecipientDiscovery submittersOf(String challengeId) {
        String submissions = DocumentPath.of(challengesCollection, challengeId).path() + "/" + SUBMISSIONS;
        return () -> {
            Set<String> recipients = new LinkedHashSet<>();
            for (StoredDocument submission : store.query(DocumentQuery.collection(submissions))) {
                String uid = submission.getString("uid");
                if (StringUtils.hasText(uid)) {
                    recipients.add(uid);
                }
            }
            return recipients;
        };
    }

    public RecipientDiscovery usersWithRole(String role) {
        return () -> {
            Set<String> recipients = new LinkedHashSet<>();
            for (StoredDocument user : store.query(DocumentQuery.collection(usersCollection).whereEqualTo("role", role))) {
                recipients.add(user.id());
            }
            return recipients;
        };
    }
}
