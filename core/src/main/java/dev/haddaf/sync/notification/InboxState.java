package dev.haddaf.sync.notification;

import java.util.List;

public record InboxState(List<NotificationRecord> notifications, int unreadCount, boolean loading, boolean stale) {

    public InboxState {
        notifications = notifications == null ? List.of() : List.copyOf(notifications);
    }

    public static InboxState empty() {
        return new InboxState(List.of(), 0, false, false);
    }

    static InboxState of(List<NotificationRecord> notifications) {
        int unread = (int) notifications.stream().filter(notification -> !notification.read()).count();
        return new InboxState(notifications, unread, false, false);
    }

    InboxState markStale() {
        return new InboxState(notifications, unreadCount, false, true);
    }
}
