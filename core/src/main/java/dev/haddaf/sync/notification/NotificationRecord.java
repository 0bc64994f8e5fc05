package dev.haddaf.sync.notification;

import dev.haddaf.sync.feed.FeedEntry;
import dev.haddaf.sync.store.ServerValue;
import dev.haddaf.sync.store.StoredDocument;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * A document of the {@code notifications} collection.
 */
public record NotificationRecord(String id,
                                 String recipientId,
                                 NotificationType type,
                                 String title,
                                 String message,
                                 Instant createdAt,
                                 boolean read,
                                 boolean dismissed,
                                 Map<String, String> correlationFields) implements FeedEntry {

    public static final String USER_ID = "userId";
    public static final String TYPE = "type";
    public static final String TITLE = "title";
    public static final String MESSAGE = "message";
    public static final String CREATED_AT = "createdAt";
    public static final String IS_READ = "isRead";
    public static final String DISMISSED = "dismissed";

    public static final String CHALLENGE_ID = "challengeId";
    public static final String CHALLENGE_TITLE = "challengeTitle";
    public static final String MONTH_NAME = "monthName";
    public static final String YEAR_MONTH = "yearMonth";
    public static final String INVITATION_ID = "invitationId";
    public static final String TEAM_ID = "teamId";
    public static final String TEAM_NAME = "teamName";
    public static final String PLAYER_ID = "playerId";
    public static final String REQUEST_ID = "requestId";
    public static final String REJECTION_REASON = "rejectionReason";

    static final List<String> CORRELATION_FIELDS = List.of(CHALLENGE_ID, CHALLENGE_TITLE, MONTH_NAME, YEAR_MONTH,
        INVITATION_ID, TEAM_ID, TEAM_NAME, PLAYER_ID, REQUEST_ID, REJECTION_REASON);

    public NotificationRecord {
        correlationFields = correlationFields == null ? Map.of() : Map.copyOf(correlationFields);
    }

    @Override
    public Instant orderingTimestamp() {
        return createdAt;
    }

    public Optional<String> correlationValue(String field) {
        return Optional.ofNullable(correlationFields.get(field));
    }

    /**
     * Fields of a new record; {@code createdAt} is set by the store.
     */
    Map<String, Object> toNewDocument() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(USER_ID, recipientId);
        data.put(TYPE, type.value());
        data.put(TITLE, title);
        data.put(MESSAGE, message);
        data.put(CREATED_AT, ServerValue.TIMESTAMP);
        data.put(IS_READ, false);
        correlationFields.forEach(data::put);
        return data;
    }

    static NotificationRecord draft(String recipientId, NotificationType type, NotificationContent content,
                                    Map<String, String> correlationFields) {
        return new NotificationRecord(null, recipientId, type, content.title(), content.message(), null, false,
            false, correlationFields);
    }

    public static Optional<NotificationRecord> fromDocument(StoredDocument document) {
        String recipientId = document.getString(USER_ID);
        Optional<NotificationType> type = NotificationType.fromValue(document.getString(TYPE));
        String title = document.getString(TITLE);
        Instant createdAt = document.getInstant(CREATED_AT);
        if (!StringUtils.hasText(recipientId) || type.isEmpty() || title == null || createdAt == null) {
            return Optional.empty();
        }
        Map<String, String> correlation = new LinkedHashMap<>();
        for (String field : CORRELATION_FIELDS) {
            String value = document.getString(field);
            if (value != null) {
                correlation.put(field, value);
            }
        }
        return Optional.of(new NotificationRecord(
            document.id(),
            recipientId,
            type.get(),
            title,
            document.getString(MESSAGE) == null ? "" : document.getString(MESSAGE),
            createdAt,
            Boolean.TRUE.equals(document.getBoolean(IS_READ)),
            Boolean.TRUE.equals(document.getBoolean(DISMISSED)),
            correlation));
    }
}
