package dev.haddaf.sync.notification;

import java.util.Optional;

/**
 * The closed set of notification kinds. Preference gated kinds name the {@code users/{uid}} flag that can
 * turn them off; event bound kinds name the correlation field that makes a delivery unique per recipient.
 */
public enum NotificationType {
    ADMIN_MONTHLY_REMINDER("admin_monthly_reminder", null, NotificationRecord.YEAR_MONTH),
    PLAYER_CHALLENGE_SUBMITTED("player_challenge_submitted", null, NotificationRecord.CHALLENGE_ID),
    CHALLENGE_ENDED("challenge_ended", "notif_challengeEnded", NotificationRecord.CHALLENGE_ID),
    NEW_CHALLENGE_AVAILABLE("new_challenge_available", "notif_newChallenge", NotificationRecord.CHALLENGE_ID),
    TEAM_INVITATION_RECEIVED("team_invitation_received", "notif_teamInvitation", NotificationRecord.INVITATION_ID),
    INVITATION_ACCEPTED("invitation_accepted", null, NotificationRecord.INVITATION_ID),
    INVITATION_DECLINED("invitation_declined", null, NotificationRecord.INVITATION_ID),
    COACH_REQUEST_APPROVED("coach_request_approved", null, NotificationRecord.REQUEST_ID),
    COACH_REQUEST_REJECTED("coach_request_rejected", null, NotificationRecord.REQUEST_ID);

    private final String value;
    private final String preferenceField;
    private final String correlationField;

    NotificationType(String value, String preferenceField, String correlationField) {
        this.value = value;
        this.preferenceField = preferenceField;
        this.correlationField = correlationField;
    }

    public String value() {
        return value;
    }

    public Optional<String> preferenceField() {
        return Optional.ofNullable(preferenceField);
    }

    public boolean isPreferenceGated() {
        return preferenceField != null;
    }

    public Optional<String> correlationField() {
        return Optional.ofNullable(correlationField);
    }

    public static Optional<NotificationType> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (NotificationType type : values()) {
            if (type.value.equals(raw.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
