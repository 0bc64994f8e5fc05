package dev.haddaf.sync.notification;

import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.DocumentQuery;
import dev.haddaf.sync.store.DocumentStore;
import dev.haddaf.sync.store.DocumentStoreException;
import dev.haddaf.sync.store.FilterOperator;
import dev.haddaf.sync.store.StoredDocument;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic challenge checks. Each check is safe to repeat: the notifications it sends are keyed by challenge
 * id or by month.
 */
public class ChallengeNotificationJobs {

    private static final Logger log = LoggerFactory.getLogger(ChallengeNotificationJobs.class);

    static final Duration LOOKBACK = Duration.ofHours(24);
    static final String ADMIN_ROLE = "admin";
    static final String PLAYER_ROLE = "player";

    private final DocumentStore store;
    private final NotificationFanOutService fanOut;
    private final RecipientDirectory directory;
    private final Clock clock;
    private final String usersCollection;
    private final String challengesCollection;
    private final int reminderDayOfMonth;

    public ChallengeNotificationJobs(DocumentStore store,
                                     NotificationFanOutService fanOut,
                                     RecipientDirectory directory,
                                     Clock clock,
                                     String usersCollection,
                                     String challengesCollection,
                                     int reminderDayOfMonth) {
        this.store = Objects.requireNonNull(store, "store");
        this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.usersCollection = Objects.requireNonNull(usersCollection, "usersCollection");
        this.challengesCollection = Objects.requireNonNull(challengesCollection, "challengesCollection");
        if (reminderDayOfMonth < 1 || reminderDayOfMonth > 28) {
            throw new IllegalArgumentException("Reminder day must be between 1 and 28");
        }
        this.reminderDayOfMonth = reminderDayOfMonth;
    }

    /**
     * Tells the submitters of every challenge that ended within the last day.
     *
     * @return number of notifications created
     */
    public long notifyEndedChallenges() {
        Instant now = clock.instant();
        DocumentQuery ended = DocumentQuery.collection(challengesCollection)
            .where("endAt", FilterOperator.GREATER_THAN, now.minus(LOOKBACK))
            .where("endAt", FilterOperator.LESS_THAN, now);
        long created = 0;
        for (StoredDocument challenge : load(ended, "ended challenges")) {
            created += fanOut.notifyDiscovered(NotificationType.CHALLENGE_ENDED,
                directory.submittersOf(challenge.id()), challengeFields(challenge)).createdCount();
        }
        return created;
    }

    /**
     * Tells every player about challenges that started within the last day.
     *
     * @return number of notifications created
     */
    public long notifyNewChallenges() {
        Instant now = clock.instant();
        DocumentQuery started = DocumentQuery.collection(challengesCollection)
            .where("startAt", FilterOperator.GREATER_THAN, now.minus(LOOKBACK))
            .where("startAt", FilterOperator.LESS_THAN_OR_EQUAL, now);
        long created = 0;
        for (StoredDocument challenge : load(started, "new challenges")) {
            created += fanOut.notifyDiscovered(NotificationType.NEW_CHALLENGE_AVAILABLE,
                directory.usersWithRole(PLAYER_ROLE), challengeFields(challenge)).createdCount();
        }
        return created;
    }

    /**
     * Confirms a submission to the player who made it.
     */
    public FanOutResult confirmSubmission(String playerId, String challengeId) {
        Optional<StoredDocument> challenge;
        try {
            challenge = store.fetch(DocumentPath.of(challengesCollection, challengeId));
        } catch (DocumentStoreException ex) {
            log.warn("Could not read challenge {}; confirming submission without its details", challengeId, ex);
            challenge = Optional.empty();
        }
        Map<String, String> fields = challenge.map(this::challengeFields)
            .orElseGet(() -> Map.of(NotificationRecord.CHALLENGE_ID, challengeId,
                NotificationRecord.MONTH_NAME, monthName(clock.instant())));
        return fanOut.notify(NotificationType.PLAYER_CHALLENGE_SUBMITTED, Set.of(playerId), fields);
    }

    /**
     * On the reminder day, asks an administrator to add next month's challenge when it is still missing.
     *
     * @return {@code true} when a reminder was created
     */
    public boolean remindAdministrator(String userId) {
        try {
            Optional<StoredDocument> user = store.fetch(DocumentPath.of(usersCollection, userId));
            if (user.isEmpty() || !ADMIN_ROLE.equals(user.get().getString("role"))) {
                return false;
            }
            LocalDate today = LocalDate.now(clock);
            if (today.getDayOfMonth() != reminderDayOfMonth) {
                return false;
            }
            LocalDate nextMonth = today.plusMonths(1);
            String yearMonth = String.format(Locale.ROOT, "%04d-%02d", nextMonth.getYear(), nextMonth.getMonthValue());
            DocumentQuery planned = DocumentQuery.collection(challengesCollection)
                .whereEqualTo("yearMonth", yearMonth)
                .limit(1);
            if (!store.query(planned).isEmpty()) {
                return false;
            }
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put(NotificationRecord.YEAR_MONTH, yearMonth);
            fields.put(NotificationRecord.MONTH_NAME, nextMonth.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
            return fanOut.notify(NotificationType.ADMIN_MONTHLY_REMINDER, Set.of(userId), fields)
                .outcomeFor(userId) == NotificationOutcome.CREATED;
        } catch (DocumentStoreException ex) {
            log.error("Administrator reminder check for {} failed", userId, ex);
            return false;
        }
    }

    /**
     * Runs {@link #remindAdministrator(String)} for every administrator.
     *
     * @return number of reminders created
     */
    public long remindAdministrators() {
        DocumentQuery administrators = DocumentQuery.collection(usersCollection).whereEqualTo("role", ADMIN_ROLE);
        return load(administrators, "administrators").stream()
            .filter(administrator -> remindAdministrator(administrator.id()))
            .count();
    }

    private List<StoredDocument> load(DocumentQuery query, String description) {
        try {
            return store.query(query);
        } catch (DocumentStoreException ex) {
            log.error("Failed to load {}", description, ex);
            return List.of();
        }
    }

    private Map<String, String> challengeFields(StoredDocument challenge) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(NotificationRecord.CHALLENGE_ID, challenge.id());
        String title = challenge.getString("title");
        fields.put(NotificationRecord.CHALLENGE_TITLE, title == null || title.isBlank() ? "Challenge" : title);
        Instant startAt = challenge.getInstant("startAt");
        fields.put(NotificationRecord.MONTH_NAME, monthName(startAt != null ? startAt : clock.instant()));
        return fields;
    }

    // Challenges without a start date are named after the current month.
    private String monthName(Instant instant) {
        return instant.atZone(clock.getZone()).getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }
}
