package dev.haddaf.sync.invitation;

import dev.haddaf.sync.feed.FeedDefinition;
import dev.haddaf.sync.feed.UserProfileLookup;
import dev.haddaf.sync.feed.UserSummary;
import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.DocumentQuery;
import dev.haddaf.sync.store.DocumentStore;
import dev.haddaf.sync.store.DocumentStoreException;
import dev.haddaf.sync.store.StoredDocument;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pending invitations addressed to the signed in player.
 */
public class InvitationFeedDefinition implements FeedDefinition<PendingInvitation> {

    private static final Logger log = LoggerFactory.getLogger(InvitationFeedDefinition.class);

    static final String UNKNOWN_COACH = "Coach";

    private final DocumentStore store;
    private final UserProfileLookup profiles;
    private final String invitationsCollection;
    private final String teamsCollection;

    public InvitationFeedDefinition(DocumentStore store, UserProfileLookup profiles,
                                    String invitationsCollection, String teamsCollection) {
        this.store = Objects.requireNonNull(store, "store");
        this.profiles = Objects.requireNonNull(profiles, "profiles");
        this.invitationsCollection = Objects.requireNonNull(invitationsCollection, "invitationsCollection");
        this.teamsCollection = Objects.requireNonNull(teamsCollection, "teamsCollection");
    }

    @Override
    public String name() {
        return "invitations";
    }

    @Override
    public DocumentQuery query(String ownerId) {
        return DocumentQuery.collection(invitationsCollection)
            .whereEqualTo(Invitation.PLAYER_ID, ownerId)
            .whereEqualTo(Invitation.STATUS, InvitationStatus.PENDING.value());
    }

    @Override
    public Optional<PendingInvitation> decode(StoredDocument document, String ownerId) {
        return Invitation.fromDocument(document)
            .filter(invitation -> invitation.status() == InvitationStatus.PENDING)
            .map(invitation -> new PendingInvitation(invitation, UNKNOWN_COACH, null));
    }

    @Override
    public PendingInvitation enrich(PendingInvitation item) {
        String coachName = profiles.find(item.invitation().senderId())
            .map(UserSummary::fullName)
            .orElse(UNKNOWN_COACH);
        String logoUrl = null;
        try {
            logoUrl = store.fetch(DocumentPath.of(teamsCollection, item.invitation().teamId()))
                .map(team -> team.getString("logoURL"))
                .orElse(null);
        } catch (DocumentStoreException ex) {
            log.debug("Team {} lookup failed: {}", item.invitation().teamId(), ex.getMessage());
        }
        return item.withDetails(coachName, logoUrl);
    }
}
