package dev.haddaf.sync.invitation;

import dev.haddaf.sync.feed.FeedEntry;
import java.time.Instant;

/**
 * Entry of the invitations inbox: a pending invitation with the coach's name and the team logo.
 */
public record PendingInvitation(Invitation invitation, String coachName, String teamLogoUrl) implements FeedEntry {

    @Override
    public String id() {
        return invitation.id();
    }

    @Override
    public Instant orderingTimestamp() {
        return invitation.createdAt();
    }

    PendingInvitation withDetails(String name, String logoUrl) {
        return new PendingInvitation(invitation, name, logoUrl);
    }
}
