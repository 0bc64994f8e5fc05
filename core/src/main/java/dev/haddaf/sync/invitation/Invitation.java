package dev.haddaf.sync.invitation;

import dev.haddaf.sync.store.StoredDocument;
import java.time.Instant;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * A coach's invitation for a player to join a team. The status changes at most once, away from
 * {@link InvitationStatus#PENDING}.
 */
public record Invitation(String id,
                         String senderId,
                         String recipientId,
                         String teamId,
                         String teamName,
                         InvitationStatus status,
                         Instant createdAt) {

    static final String COACH_ID = "coachID";
    static final String PLAYER_ID = "playerID";
    static final String TEAM_ID = "teamID";
    static final String TEAM_NAME = "teamName";
    static final String STATUS = "status";
    static final String CREATED_AT = "createdAt";
    static final String RESPONDED_AT = "respondedAt";

    public Invitation withStatus(InvitationStatus next) {
        return new Invitation(id, senderId, recipientId, teamId, teamName, next, createdAt);
    }

    static Optional<Invitation> fromDocument(StoredDocument document) {
        String senderId = document.getString(COACH_ID);
        String recipientId = document.getString(PLAYER_ID);
        String teamId = document.getString(TEAM_ID);
        Optional<InvitationStatus> status = InvitationStatus.fromValue(document.getString(STATUS));
        if (!StringUtils.hasText(senderId) || !StringUtils.hasText(recipientId) || !StringUtils.hasText(teamId)
            || status.isEmpty()) {
            return Optional.empty();
        }
        String teamName = document.getString(TEAM_NAME);
        return Optional.of(new Invitation(document.id(), senderId, recipientId, teamId,
            teamName == null ? "" : teamName, status.get(), document.getInstant(CREATED_AT)));
    }
}
