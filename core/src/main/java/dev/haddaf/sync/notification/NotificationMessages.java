package dev.haddaf.sync.notification;

import java.util.Map;

/**
 * Title and message text per notification type.
 */
public final class NotificationMessages {

    private NotificationMessages() {
    }

    public static NotificationContent compose(NotificationType type, Map<String, String> fields) {
        String month = fields.getOrDefault(NotificationRecord.MONTH_NAME, "this month");
        String challenge = fields.getOrDefault(NotificationRecord.CHALLENGE_TITLE, "Challenge");
        String team = fields.getOrDefault(NotificationRecord.TEAM_NAME, "the team");
        return switch (type) {
            case ADMIN_MONTHLY_REMINDER -> new NotificationContent("Monthly Challenge Reminder",
                "It's time to add a new challenge for " + month + "!");
            case PLAYER_CHALLENGE_SUBMITTED -> new NotificationContent("Challenge Submitted",
                "You have submitted your video for the " + month + " challenge: " + challenge);
            case CHALLENGE_ENDED -> new NotificationContent("Challenge Ended",
                "The " + month + " challenge has ended and winners have been announced! Check out the results now.");
            case NEW_CHALLENGE_AVAILABLE -> new NotificationContent("New Challenge Available!",
                "A new challenge for " + month + " has been added: " + challenge + ". Check it out now!");
            case TEAM_INVITATION_RECEIVED -> new NotificationContent("Team Invitation",
                "You have been invited to join " + team + ".");
            case INVITATION_ACCEPTED -> new NotificationContent("Invitation Accepted",
                "A player accepted your invitation to join " + team + ".");
            case INVITATION_DECLINED -> new NotificationContent("Invitation Declined",
                "A player declined your invitation to join " + team + ".");
            case COACH_REQUEST_APPROVED -> new NotificationContent("Coach Account Approved",
                "Your coach account has been verified. You can now create a team and invite players.");
            case COACH_REQUEST_REJECTED -> new NotificationContent("Coach Request Rejected",
                rejectionMessage(fields.get(NotificationRecord.REJECTION_REASON)));
        };
    }

    private static String rejectionMessage(String reason) {
        if (reason == null || reason.isBlank()) {
            return "Your coach verification request was not approved.";
        }
        return "Your coach verification request was not approved: " + reason;
    }
}
