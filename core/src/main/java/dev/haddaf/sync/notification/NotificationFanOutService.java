package dev.haddaf.sync.notification;

import dev.haddaf.sync.metrics.SyncMetrics;
import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.DocumentQuery;
import dev.haddaf.sync.store.DocumentStore;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Writes one notification record per recipient and event.
 *
 * <p>For each recipient the preference gate runs first, then the duplicate check: event bound types are
 * stored under an id derived from {@code (type, recipient, correlation id)} with create-if-absent, so
 * concurrent or repeated calls for the same event produce a single record. A failure for one recipient is
 * reported as {@link NotificationOutcome#FAILED} and the remaining recipients are still processed.
 */
public class NotificationFanOutService {

    private static final Logger log = LoggerFactory.getLogger(NotificationFanOutService.class);

    private final DocumentStore store;
    private final NotificationPreferences preferences;
    private final SyncMetrics metrics;
    private final String notificationsCollection;

    public NotificationFanOutService(DocumentStore store,
                                     NotificationPreferences preferences,
                                     SyncMetrics metrics,
                                     String notificationsCollection) {
        this.store = Objects.requireNonNull(store, "store");
        this.preferences = Objects.requireNonNull(preferences, "preferences");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.notificationsCollection = Objects.requireNonNull(notificationsCollection, "notificationsCollection");
    }

    public FanOutResult notify(NotificationType type, Collection<String> recipients, Map<String, String> correlationFields) {
        Objects.requireNonNull(type, "type");
        Map<String, String> fields = sanitize(correlationFields);
        NotificationContent content = NotificationMessages.compose(type, fields);

        Set<String> uniqueRecipients = new LinkedHashSet<>();
        for (String recipient : recipients == null ? Set.<String>of() : recipients) {
            if (StringUtils.hasText(recipient)) {
                uniqueRecipients.add(recipient);
            }
        }

        Map<String, NotificationOutcome> outcomes = new LinkedHashMap<>();
        for (String recipient : uniqueRecipients) {
            NotificationOutcome outcome;
            try {
                outcome = deliver(type, recipient, fields, content);
            } catch (RuntimeException ex) {
                log.error("Failed to notify {} of {}", recipient, type.value(), ex);
                outcome = NotificationOutcome.FAILED;
            }
            metrics.recordNotificationOutcome(type.value(), outcome.name());
            outcomes.put(recipient, outcome);
        }

        FanOutResult result = new FanOutResult(outcomes);
        log.info("Fan-out of {} to {} recipient(s): {} created, {} duplicate, {} opted out, {} failed",
            type.value(), outcomes.size(), result.createdCount(), result.count(NotificationOutcome.SKIPPED_DUPLICATE),
            result.count(NotificationOutcome.SKIPPED_PREFERENCE), result.count(NotificationOutcome.FAILED));
        return result;
    }

    /**
     * Discovers the recipients first, then fans out to them. A failed discovery notifies nobody.
     */
    public FanOutResult notifyDiscovered(NotificationType type, RecipientDiscovery discovery,
                                         Map<String, String> correlationFields) {
        Set<String> recipients;
        try {
            recipients = discovery.discoverRecipients();
        } catch (RuntimeException ex) {
            log.error("Recipient discovery for {} failed", type.value(), ex);
            return FanOutResult.empty();
        }
        return notify(type, recipients, correlationFields);
    }

    private NotificationOutcome deliver(NotificationType type, String recipient, Map<String, String> fields,
                                        NotificationContent content) {
        if (!preferences.isEnabled(recipient, type)) {
            log.debug("{} opted out of {}", recipient, type.value());
            return NotificationOutcome.SKIPPED_PREFERENCE;
        }

        NotificationRecord draft = NotificationRecord.draft(recipient, type, content, fields);
        Optional<String> correlationField = type.correlationField();
        String correlationId = correlationField.map(fields::get).orElse(null);
        if (correlationId == null) {
            if (correlationField.isPresent()) {
                log.warn("{} notification for {} has no {}; delivering without an idempotency key",
                    type.value(), recipient, correlationField.get());
            }
            store.add(notificationsCollection, draft.toNewDocument());
            return NotificationOutcome.CREATED;
        }

        if (existsWithCorrelation(type, recipient, correlationField.get(), correlationId)) {
            return NotificationOutcome.SKIPPED_DUPLICATE;
        }
        DocumentPath path = DocumentPath.of(notificationsCollection,
            NotificationIds.idempotencyKey(type, recipient, correlationId));
        return store.createIfAbsent(path, draft.toNewDocument())
            ? NotificationOutcome.CREATED
            : NotificationOutcome.SKIPPED_DUPLICATE;
    }

    // Records written before deterministic ids existed have random ids.
    private boolean existsWithCorrelation(NotificationType type, String recipient, String field, String value) {
        DocumentQuery query = DocumentQuery.collection(notificationsCollection)
            .whereEqualTo(NotificationRecord.USER_ID, recipient)
            .whereEqualTo(NotificationRecord.TYPE, type.value())
            .whereEqualTo(field, value)
            .limit(1);
        return !store.query(query).isEmpty();
    }

    private static Map<String, String> sanitize(Map<String, String> correlationFields) {
        Map<String, String> sanitized = new LinkedHashMap<>();
        if (correlationFields != null) {
            correlationFields.forEach((field, value) -> {
                if (StringUtils.hasText(field) && StringUtils.hasText(value)) {
                    sanitized.put(field, value);
                }
            });
        }
        return sanitized;
    }
}
