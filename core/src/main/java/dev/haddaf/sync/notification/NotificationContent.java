package dev.haddaf.sync.notification;

public record NotificationContent(String title, String message) {
}
