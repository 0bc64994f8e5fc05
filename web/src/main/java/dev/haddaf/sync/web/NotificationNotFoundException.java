package dev.haddaf.sync.web;

public class NotificationNotFoundException extends RuntimeException {

    public NotificationNotFoundException(String notificationId) {
        super("Notification " + notificationId + " is not in the inbox");
    }
}
