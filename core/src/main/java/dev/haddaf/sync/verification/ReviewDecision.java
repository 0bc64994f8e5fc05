package dev.haddaf.sync.verification;

import dev.haddaf.sync.notification.FanOutResult;

/**
 * Result of an approve or reject: the reviewed request, its coach and the notification sent to them.
 */
public record ReviewDecision(String requestId, String coachId, String status, FanOutResult notification) {
}
