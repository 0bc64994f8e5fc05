package dev.haddaf.sync.invitation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import dev.haddaf.sync.MutableClock;
import dev.haddaf.sync.invitation.InvitationRejectedException.Reason;
import dev.haddaf.sync.metrics.SyncMetrics;
import dev.haddaf.sync.notification.NotificationFanOutService;
import dev.haddaf.sync.notification.NotificationOutcome;
import dev.haddaf.sync.notification.NotificationPreferences;
import dev.haddaf.sync.session.Session;
import dev.haddaf.sync.session.SessionContext;
import dev.haddaf.sync.session.UserRole;
import dev.haddaf.sync.session.VerificationState;
import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.DocumentQuery;
import dev.haddaf.sync.store.DocumentStore;
import dev.haddaf.sync.store.DocumentStoreException;
import dev.haddaf.sync.store.InMemoryDocumentStore;
import dev.haddaf.sync.store.StoredDocument;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InvitationWorkflowTest {

    private static final Instant NOW = Instant.parse("2025-02-14T16:00:00Z");

    private InMemoryDocumentStore store;
    private SessionContext sessionContext;
    private NotificationFanOutService fanOut;
    private InvitationWorkflow workflow;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore(Runnable::run, new MutableClock(NOW));
        sessionContext = mock(SessionContext.class);
        when(sessionContext.current()).thenReturn(player("p1"));
        fanOut = new NotificationFanOutService(store, new NotificationPreferences(store, "users"),
            SyncMetrics.detached(), "notifications");
        workflow = new InvitationWorkflow(store, fanOut, sessionContext, "invitations", "users", "teams");

        store.merge(DocumentPath.of("users", "p1"), Map.of("role", "player", "firstName", "Omar"));
        store.merge(DocumentPath.of("users", "c1"), Map.of("role", "coach", "coachStatus", "approved"));
        store.merge(DocumentPath.of("invitations", "inv-1"), Map.of(
            "coachID", "c1",
            "playerID", "p1",
            "teamID", "t1",
            "teamName", "Jeddah Stars",
            "status", "pending",
            "createdAt", NOW.minusSeconds(3_600)));
    }

    @Test
    void acceptJoinsTheTeamAndNotifiesTheCoach() {
        InvitationResult result = workflow.respond("inv-1", true);

        assertThat(result.invitation().status()).isEqualTo(InvitationStatus.ACCEPTED);
        assertThat(result.notification().outcomeFor("c1")).isEqualTo(NotificationOutcome.CREATED);

        StoredDocument invitation = store.fetch(DocumentPath.of("invitations", "inv-1")).orElseThrow();
        assertThat(invitation.getString("status")).isEqualTo("accepted");
        assertThat(invitation.getInstant("respondedAt")).isEqualTo(NOW);
        assertThat(store.fetch(DocumentPath.subCollection("teams", "t1", "players", "p1"))).isPresent();
        StoredDocument user = store.fetch(DocumentPath.of("users", "p1")).orElseThrow();
        assertThat(user.getString("teamId")).isEqualTo("t1");
        assertThat(user.getString("teamName")).isEqualTo("Jeddah Stars");
        assertThat(notificationsOf("c1")).singleElement()
            .extracting(record -> record.getString("type")).isEqualTo("invitation_accepted");
    }

    @Test
    void declineLeavesTheTeamUntouched() {
        InvitationResult result = workflow.respond("inv-1", false);

        assertThat(result.invitation().status()).isEqualTo(InvitationStatus.DECLINED);
        assertThat(store.fetch(DocumentPath.subCollection("teams", "t1", "players", "p1"))).isEmpty();
        assertThat(store.fetch(DocumentPath.of("users", "p1")).orElseThrow().has("teamId")).isFalse();
        assertThat(notificationsOf("c1")).singleElement()
            .extracting(record -> record.getString("type")).isEqualTo("invitation_declined");
    }

    @Test
    void secondAnswerIsRejected() {
        workflow.respond("inv-1", true);

        assertThatThrownBy(() -> workflow.respond("inv-1", false))
            .isInstanceOfSatisfying(InvitationRejectedException.class,
                ex -> assertThat(ex.getReason()).isEqualTo(Reason.NOT_PENDING));
        assertThat(store.fetch(DocumentPath.of("invitations", "inv-1")).orElseThrow().getString("status"))
            .isEqualTo("accepted");
        assertThat(notificationsOf("c1")).hasSize(1);
    }

    @Test
    void concurrentAnswersHaveExactlyOneWinner() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<InvitationResult>> answers = new ArrayList<>();
        try {
            answers.add(pool.submit(answer(start, true)));
            answers.add(pool.submit(answer(start, false)));
            start.countDown();

            int succeeded = 0;
            int rejected = 0;
            for (Future<InvitationResult> answer : answers) {
                try {
                    answer.get();
                    succeeded++;
                } catch (ExecutionException ex) {
                    assertThat(ex.getCause()).isInstanceOfSatisfying(InvitationRejectedException.class,
                        rejection -> assertThat(rejection.getReason()).isEqualTo(Reason.NOT_PENDING));
                    rejected++;
                }
            }
            assertThat(succeeded).isEqualTo(1);
            assertThat(rejected).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(notificationsOf("c1")).hasSize(1);
    }

    @Test
    void onlyTheRecipientMayAnswer() {
        store.merge(DocumentPath.of("users", "p2"), Map.of("role", "player"));

        assertThatThrownBy(() -> workflow.respond("inv-1", "p2", true))
            .isInstanceOfSatisfying(InvitationRejectedException.class,
                ex -> assertThat(ex.getReason()).isEqualTo(Reason.NOT_RECIPIENT));
        assertThat(store.fetch(DocumentPath.of("invitations", "inv-1")).orElseThrow().getString("status"))
            .isEqualTo("pending");
    }

    @Test
    void unknownInvitationIsRejected() {
        assertThatThrownBy(() -> workflow.respond("inv-404", true))
            .isInstanceOfSatisfying(InvitationRejectedException.class,
                ex -> assertThat(ex.getReason()).isEqualTo(Reason.NOT_FOUND));
    }

    @Test
    void acceptWithoutAPlayerProfileWritesNothing() {
        store.delete(DocumentPath.of("users", "p1"));

        assertThatThrownBy(() -> workflow.respond("inv-1", true))
            .isInstanceOfSatisfying(InvitationRejectedException.class,
                ex -> assertThat(ex.getReason()).isEqualTo(Reason.RECIPIENT_MISSING));
        assertThat(store.fetch(DocumentPath.of("invitations", "inv-1")).orElseThrow().getString("status"))
            .isEqualTo("pending");
        assertThat(store.fetch(DocumentPath.subCollection("teams", "t1", "players", "p1"))).isEmpty();
        assertThat(notificationsOf("c1")).isEmpty();
    }

    @Test
    void storeFailureIsReportedAsRetriable() {
        DocumentStore failing = mock(DocumentStore.class);
        when(failing.runTransaction(any())).thenThrow(new DocumentStoreException("aborted"));
        InvitationWorkflow unavailable = new InvitationWorkflow(failing, fanOut, sessionContext, "invitations",
            "users", "teams");

        assertThatThrownBy(() -> unavailable.respond("inv-1", true))
            .isInstanceOf(InvitationWorkflowException.class)
            .hasCauseInstanceOf(DocumentStoreException.class);
        assertThat(notificationsOf("c1")).isEmpty();
    }

    @Test
    void guestsAndCoachesCannotAnswer() {
        when(sessionContext.current()).thenReturn(Session.guestSession());
        assertThatThrownBy(() -> workflow.respond("inv-1", true))
            .isInstanceOfSatisfying(InvitationRejectedException.class,
                ex -> assertThat(ex.getReason()).isEqualTo(Reason.UNAUTHORIZED));

        when(sessionContext.current()).thenReturn(coach("c1", VerificationState.APPROVED));
        assertThatThrownBy(() -> workflow.respond("inv-1", true))
            .isInstanceOfSatisfying(InvitationRejectedException.class,
                ex -> assertThat(ex.getReason()).isEqualTo(Reason.UNAUTHORIZED));
    }

    @Test
    void verifiedCoachInvitesAPlayer() {
        when(sessionContext.current()).thenReturn(coach("c1", VerificationState.APPROVED));

        InvitationResult result = workflow.sendInvitation("t2", " Dammam United ", "p1");

        assertThat(result.invitation().status()).isEqualTo(InvitationStatus.PENDING);
        assertThat(result.invitation().teamName()).isEqualTo("Dammam United");
        StoredDocument stored = store.fetch(DocumentPath.of("invitations", result.invitation().id())).orElseThrow();
        assertThat(stored.getString("coachID")).isEqualTo("c1");
        assertThat(stored.getInstant("createdAt")).isEqualTo(NOW);
        assertThat(notificationsOf("p1")).singleElement().extracting(record -> record.getString("message"))
            .isEqualTo("You have been invited to join Dammam United.");
    }

    @Test
    void secondPendingInvitationToTheSameTeamIsRefused() {
        when(sessionContext.current()).thenReturn(coach("c1", VerificationState.APPROVED));

        assertThatThrownBy(() -> workflow.sendInvitation("t1", "Jeddah Stars", "p1"))
            .isInstanceOfSatisfying(InvitationRejectedException.class,
                ex -> assertThat(ex.getReason()).isEqualTo(Reason.ALREADY_INVITED));
    }

    @Test
    void unverifiedCoachCannotInvite() {
        when(sessionContext.current()).thenReturn(coach("c1", VerificationState.PENDING));

        assertThatThrownBy(() -> workflow.sendInvitation("t2", "Dammam United", "p1"))
            .isInstanceOfSatisfying(InvitationRejectedException.class,
                ex -> assertThat(ex.getReason()).isEqualTo(Reason.UNAUTHORIZED));
        assertThat(store.query(DocumentQuery.collection("invitations"))).hasSize(1);
    }

    @Test
    void explicitCoachIsVerifiedFromTheStoredProfile() {
        store.merge(DocumentPath.of("users", "c2"), Map.of("role", "coach", "coachStatus", "pending"));

        assertThatThrownBy(() -> workflow.sendInvitation("p1", "t2", "Dammam United", "p1"))
            .isInstanceOfSatisfying(InvitationRejectedException.class,
                ex -> assertThat(ex.getReason()).isEqualTo(Reason.UNAUTHORIZED));
        assertThatThrownBy(() -> workflow.sendInvitation("c2", "t2", "Dammam United", "p1"))
            .isInstanceOfSatisfying(InvitationRejectedException.class,
                ex -> assertThat(ex.getReason()).isEqualTo(Reason.UNAUTHORIZED));
        assertThatThrownBy(() -> workflow.sendInvitation("ghost", "t2", "Dammam United", "p1"))
            .isInstanceOfSatisfying(InvitationRejectedException.class,
                ex -> assertThat(ex.getReason()).isEqualTo(Reason.UNAUTHORIZED));

        InvitationResult result = workflow.sendInvitation("c1", "t2", "Dammam United", "p1");

        assertThat(result.invitation().senderId()).isEqualTo("c1");
        assertThat(store.query(DocumentQuery.collection("invitations"))).hasSize(2);
    }

    private Callable<InvitationResult> answer(CountDownLatch start, boolean accept) {
        return () -> {
            start.await();
            return workflow.respond("inv-1", "p1", accept);
        };
    }

    private List<StoredDocument> notificationsOf(String uid) {
        return store.query(DocumentQuery.collection("notifications").whereEqualTo("userId", uid));
    }

    private static Session player(String uid) {
        return new Session(uid, false, UserRole.PLAYER, VerificationState.PENDING, null, null);
    }

    private static Session coach(String uid, VerificationState verification) {
        return new Session(uid, false, UserRole.COACH, verification, null, null);
    }
}
