package dev.haddaf.sync.invitation;

import dev.haddaf.sync.invitation.InvitationRejectedException.Reason;
import dev.haddaf.sync.notification.FanOutResult;
import dev.haddaf.sync.notification.NotificationFanOutService;
import dev.haddaf.sync.notification.NotificationRecord;
import dev.haddaf.sync.notification.NotificationType;
import dev.haddaf.sync.session.RoleProjection;
import dev.haddaf.sync.session.Session;
import dev.haddaf.sync.session.SessionContext;
import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.DocumentQuery;
import dev.haddaf.sync.store.DocumentStore;
import dev.haddaf.sync.store.DocumentStoreException;
import dev.haddaf.sync.store.ServerValue;
import dev.haddaf.sync.store.StoreTransaction;
import dev.haddaf.sync.store.StoredDocument;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Sends invitations and applies a player's answer.
 *
 * <p>An answer is committed in one transaction that re-reads the invitation, so of two concurrent answers
 * exactly one succeeds and the other is rejected with {@link Reason#NOT_PENDING}. The coach is notified only
 * after the commit.
 */
public class InvitationWorkflow {

    private static final Logger log = LoggerFactory.getLogger(InvitationWorkflow.class);

    static final String TEAM_PLAYERS = "players";

    private final DocumentStore store;
    private final NotificationFanOutService fanOut;
    private final SessionContext sessionContext;
    private final String invitationsCollection;
    private final String usersCollection;
    private final String teamsCollection;

    public InvitationWorkflow(DocumentStore store,
                              NotificationFanOutService fanOut,
                              SessionContext sessionContext,
                              String invitationsCollection,
                              String usersCollection,
                              String teamsCollection) {
        this.store = Objects.requireNonNull(store, "store");
        this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
        this.sessionContext = Objects.requireNonNull(sessionContext, "sessionContext");
        this.invitationsCollection = Objects.requireNonNull(invitationsCollection, "invitationsCollection");
        this.usersCollection = Objects.requireNonNull(usersCollection, "usersCollection");
        this.teamsCollection = Objects.requireNonNull(teamsCollection, "teamsCollection");
    }

    /**
     * Answers an invitation on behalf of the signed in player.
     */
    public InvitationResult respond(String invitationId, boolean accept) {
        Session session = sessionContext.current();
        if (!session.isAuthenticated() || session.guest() || session.isCoach()) {
            throw new InvitationRejectedException(Reason.UNAUTHORIZED, invitationId,
                "Only a signed in player can answer an invitation");
        }
        return respond(invitationId, session.userId(), accept);
    }

    /**
     * Answers an invitation on behalf of {@code recipientId}, who must be the player it is addressed to.
     */
    public InvitationResult respond(String invitationId, String recipientId, boolean accept) {
        if (!StringUtils.hasText(invitationId) || !StringUtils.hasText(recipientId)) {
            throw new IllegalArgumentException("Invitation id and recipient id are required");
        }
        InvitationStatus target = accept ? InvitationStatus.ACCEPTED : InvitationStatus.DECLINED;
        Invitation resolved;
        try {
            resolved = store.runTransaction(transaction -> transition(transaction, invitationId, recipientId, target));
        } catch (DocumentStoreException ex) {
            log.error("Answering invitation {} failed", invitationId, ex);
            throw new InvitationWorkflowException("Could not answer the invitation, please try again", ex);
        }
        log.info("Invitation {} {} by {}", invitationId, target.value(), recipientId);

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(NotificationRecord.INVITATION_ID, resolved.id());
        fields.put(NotificationRecord.TEAM_ID, resolved.teamId());
        fields.put(NotificationRecord.TEAM_NAME, resolved.teamName());
        fields.put(NotificationRecord.PLAYER_ID, recipientId);
        FanOutResult notification = fanOut.notify(
            accept ? NotificationType.INVITATION_ACCEPTED : NotificationType.INVITATION_DECLINED,
            Set.of(resolved.senderId()), fields);
        return new InvitationResult(resolved, notification);
    }

    /**
     * Invites a player to the signed in coach's team. Requires a verified coach and refuses a second pending
     * invitation for the same team and player.
     */
    public InvitationResult sendInvitation(String teamId, String teamName, String playerId) {
        requireTeamAndPlayer(teamId, playerId);
        Session session = sessionContext.current();
        if (!session.isVerifiedCoach()) {
            throw new InvitationRejectedException(Reason.UNAUTHORIZED, null,
                "Only a verified coach can send invitations");
        }
        return invite(session.userId(), teamId, teamName, playerId);
    }

    /**
     * Invites a player on behalf of {@code coachId}. The coach's role and verification are read from the
     * stored user document rather than from the signed in session.
     */
    public InvitationResult sendInvitation(String coachId, String teamId, String teamName, String playerId) {
        requireTeamAndPlayer(teamId, playerId);
        if (!StringUtils.hasText(coachId)) {
            throw new InvitationRejectedException(Reason.UNAUTHORIZED, null,
                "Only a verified coach can send invitations");
        }
        Optional<StoredDocument> coach;
        try {
            coach = store.fetch(DocumentPath.of(usersCollection, coachId));
        } catch (DocumentStoreException ex) {
            log.error("Reading coach {} failed", coachId, ex);
            throw new InvitationWorkflowException("Could not send the invitation, please try again", ex);
        }
        boolean verifiedCoach = coach
            .map(document -> RoleProjection.project(document.data(), null, null).isVerifiedCoach())
            .orElse(false);
        if (!verifiedCoach) {
            throw new InvitationRejectedException(Reason.UNAUTHORIZED, null,
                "User " + coachId + " is not a verified coach");
        }
        return invite(coachId, teamId, teamName, playerId);
    }

    private static void requireTeamAndPlayer(String teamId, String playerId) {
        if (!StringUtils.hasText(teamId) || !StringUtils.hasText(playerId)) {
            throw new IllegalArgumentException("Team id and player id are required");
        }
    }

    private InvitationResult invite(String coachId, String teamId, String teamName, String playerId) {
        Invitation invitation;
        try {
            DocumentQuery pending = DocumentQuery.collection(invitationsCollection)
                .whereEqualTo(Invitation.TEAM_ID, teamId)
                .whereEqualTo(Invitation.PLAYER_ID, playerId)
                .whereEqualTo(Invitation.STATUS, InvitationStatus.PENDING.value())
                .limit(1);
            if (!store.query(pending).isEmpty()) {
                throw new InvitationRejectedException(Reason.ALREADY_INVITED, null,
                    "Player " + playerId + " already has a pending invitation to this team");
            }
            String name = teamName == null ? "" : teamName.trim();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put(Invitation.COACH_ID, coachId);
            data.put(Invitation.TEAM_ID, teamId);
            data.put(Invitation.TEAM_NAME, name);
            data.put(Invitation.PLAYER_ID, playerId);
            data.put(Invitation.STATUS, InvitationStatus.PENDING.value());
            data.put(Invitation.CREATED_AT, ServerValue.TIMESTAMP);
            DocumentPath path = store.add(invitationsCollection, data);
            invitation = new Invitation(path.id(), coachId, playerId, teamId, name, InvitationStatus.PENDING, null);
        } catch (DocumentStoreException ex) {
            log.error("Sending invitation to {} failed", playerId, ex);
            throw new InvitationWorkflowException("Could not send the invitation, please try again", ex);
        }
        log.info("Coach {} invited {} to team {}", coachId, playerId, teamId);

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(NotificationRecord.INVITATION_ID, invitation.id());
        fields.put(NotificationRecord.TEAM_ID, teamId);
        fields.put(NotificationRecord.TEAM_NAME, invitation.teamName());
        FanOutResult notification = fanOut.notify(NotificationType.TEAM_INVITATION_RECEIVED, Set.of(playerId), fields);
        return new InvitationResult(invitation, notification);
    }

    private Invitation transition(StoreTransaction transaction, String invitationId, String recipientId,
                                  InvitationStatus target) {
        DocumentPath invitationPath = DocumentPath.of(invitationsCollection, invitationId);
        StoredDocument document = transaction.get(invitationPath)
            .orElseThrow(() -> new InvitationRejectedException(Reason.NOT_FOUND, invitationId,
                "Invitation " + invitationId + " does not exist"));
        Invitation invitation = Invitation.fromDocument(document)
            .orElseThrow(() -> new InvitationRejectedException(Reason.NOT_FOUND, invitationId,
                "Invitation " + invitationId + " is malformed"));
        if (!invitation.recipientId().equals(recipientId)) {
            throw new InvitationRejectedException(Reason.NOT_RECIPIENT, invitationId,
                "Invitation " + invitationId + " is addressed to another player");
        }
        if (invitation.status() != InvitationStatus.PENDING) {
            throw new InvitationRejectedException(Reason.NOT_PENDING, invitationId,
                "Invitation " + invitationId + " was already " + invitation.status().value());
        }
        DocumentPath userPath = DocumentPath.of(usersCollection, recipientId);
        if (target == InvitationStatus.ACCEPTED && transaction.get(userPath).isEmpty()) {
            throw new InvitationRejectedException(Reason.RECIPIENT_MISSING, invitationId,
                "Player " + recipientId + " has no profile");
        }

        transaction.update(invitationPath, Map.of(
            Invitation.STATUS, target.value(),
            Invitation.RESPONDED_AT, ServerValue.TIMESTAMP));
        if (target == InvitationStatus.ACCEPTED) {
            transaction.merge(DocumentPath.subCollection(teamsCollection, invitation.teamId(), TEAM_PLAYERS, recipientId),
                Map.of("playerId", recipientId, "joinedAt", ServerValue.TIMESTAMP));
            transaction.update(userPath, Map.of(
                "teamId", invitation.teamId(),
                "teamName", invitation.teamName()));
        }
        return invitation.withStatus(target);
    }
}
