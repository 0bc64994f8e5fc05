package dev.haddaf.sync.notification;

public enum NotificationOutcome {
    CREATED,
    SKIPPED_PREFERENCE,
    SKIPPED_DUPLICATE,
    FAILED
}
