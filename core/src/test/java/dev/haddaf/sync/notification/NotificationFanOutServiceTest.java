package dev.haddaf.sync.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import dev.haddaf.sync.MutableClock;
import dev.haddaf.sync.metrics.SyncMetrics;
import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.DocumentQuery;
import dev.haddaf.sync.store.DocumentStore;
import dev.haddaf.sync.store.DocumentStoreException;
import dev.haddaf.sync.store.InMemoryDocumentStore;
import dev.haddaf.sync.store.StoredDocument;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NotificationFanOutServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-30T10:00:00Z");

    private InMemoryDocumentStore store;
    private SimpleMeterRegistry meterRegistry;
    private NotificationFanOutService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore(Runnable::run, new MutableClock(NOW));
        meterRegistry = new SimpleMeterRegistry();
        service = fanOut(store);
    }

    @Test
    void repeatedEventCreatesOneRecordPerRecipient() {
        Map<String, String> fields = Map.of(NotificationRecord.INVITATION_ID, "inv-1",
            NotificationRecord.TEAM_NAME, "Riyadh Falcons");

        FanOutResult first = service.notify(NotificationType.TEAM_INVITATION_RECEIVED, List.of("p1"), fields);
        FanOutResult second = service.notify(NotificationType.TEAM_INVITATION_RECEIVED, List.of("p1"), fields);

        assertThat(first.outcomeFor("p1")).isEqualTo(NotificationOutcome.CREATED);
        assertThat(second.outcomeFor("p1")).isEqualTo(NotificationOutcome.SKIPPED_DUPLICATE);
        List<StoredDocument> records = store.query(DocumentQuery.collection("notifications"));
        assertThat(records).singleElement().satisfies(record -> {
            assertThat(record.id()).isEqualTo(
                NotificationIds.idempotencyKey(NotificationType.TEAM_INVITATION_RECEIVED, "p1", "inv-1"));
            assertThat(record.getString("title")).isEqualTo("Team Invitation");
            assertThat(record.getString("message")).isEqualTo("You have been invited to join Riyadh Falcons.");
            assertThat(record.getBoolean("isRead")).isFalse();
            assertThat(record.getInstant("createdAt")).isEqualTo(NOW);
        });
    }

    @Test
    void concurrentFanOutsForTheSameEventCreateOnce() throws Exception {
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<FanOutResult>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return service.notify(NotificationType.CHALLENGE_ENDED, Set.of("p1"),
                        Map.of(NotificationRecord.CHALLENGE_ID, "ch-7"));
                }));
            }
            start.countDown();

            long created = 0;
            for (Future<FanOutResult> result : results) {
                created += result.get().createdCount();
            }
            assertThat(created).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(store.query(DocumentQuery.collection("notifications"))).hasSize(1);
    }

    @Test
    void optedOutRecipientsAreSkipped() {
        store.merge(DocumentPath.of("users", "p1"), Map.of("notif_newChallenge", false));
        store.merge(DocumentPath.of("users", "p2"), Map.of("notif_newChallenge", true));

        FanOutResult result = service.notify(NotificationType.NEW_CHALLENGE_AVAILABLE, List.of("p1", "p2", "p3"),
            Map.of(NotificationRecord.CHALLENGE_ID, "ch-1"));

        assertThat(result.outcomes()).containsExactly(
            Map.entry("p1", NotificationOutcome.SKIPPED_PREFERENCE),
            Map.entry("p2", NotificationOutcome.CREATED),
            Map.entry("p3", NotificationOutcome.CREATED));
        assertThat(meterRegistry.get(SyncMetrics.METRIC_NOTIFICATION_OUTCOMES)
            .tag("type", "new_challenge_available").tag("outcome", "SKIPPED_PREFERENCE").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void typesWithoutAPreferenceAreAlwaysDelivered() {
        store.merge(DocumentPath.of("users", "c1"), Map.of("notif_teamInvitation", false));

        FanOutResult result = service.notify(NotificationType.INVITATION_ACCEPTED, List.of("c1"),
            Map.of(NotificationRecord.INVITATION_ID, "inv-1"));

        assertThat(result.outcomeFor("c1")).isEqualTo(NotificationOutcome.CREATED);
    }

    @Test
    void unreadablePreferencesCountAsEnabled() {
        DocumentStore failingReads = mock(DocumentStore.class);
        when(failingReads.fetch(any())).thenThrow(new DocumentStoreException("deadline exceeded"));
        when(failingReads.query(any())).thenReturn(List.of());
        when(failingReads.createIfAbsent(any(), anyMap())).thenReturn(true);

        FanOutResult result = fanOut(failingReads).notify(NotificationType.CHALLENGE_ENDED, List.of("p1"),
            Map.of(NotificationRecord.CHALLENGE_ID, "ch-1"));

        assertThat(result.outcomeFor("p1")).isEqualTo(NotificationOutcome.CREATED);
    }

    @Test
    void failureForOneRecipientDoesNotStopTheOthers() {
        String failingId = NotificationIds.idempotencyKey(NotificationType.CHALLENGE_ENDED, "p2", "ch-1");
        DocumentStore partlyFailing = mock(DocumentStore.class);
        when(partlyFailing.fetch(any())).thenReturn(Optional.empty());
        when(partlyFailing.query(any())).thenReturn(List.of());
        when(partlyFailing.createIfAbsent(any(), anyMap())).thenReturn(true);
        when(partlyFailing.createIfAbsent(argThat(path -> path != null && failingId.equals(path.id())), anyMap()))
            .thenThrow(new DocumentStoreException("write rejected"));

        FanOutResult result = fanOut(partlyFailing).notify(NotificationType.CHALLENGE_ENDED,
            List.of("p1", "p2", "p3"), Map.of(NotificationRecord.CHALLENGE_ID, "ch-1"));

        assertThat(result.outcomeFor("p1")).isEqualTo(NotificationOutcome.CREATED);
        assertThat(result.outcomeFor("p2")).isEqualTo(NotificationOutcome.FAILED);
        assertThat(result.outcomeFor("p3")).isEqualTo(NotificationOutcome.CREATED);
        assertThat(result.hasFailures()).isTrue();
    }

    @Test
    void recordsWrittenWithRandomIdsStillCountAsDuplicates() {
        store.merge(DocumentPath.of("notifications", "legacy-1"), Map.of(
            "userId", "p1",
            "type", "challenge_ended",
            "challengeId", "ch-1",
            "title", "Challenge Ended",
            "createdAt", NOW.minusSeconds(3_600)));

        FanOutResult result = service.notify(NotificationType.CHALLENGE_ENDED, List.of("p1"),
            Map.of(NotificationRecord.CHALLENGE_ID, "ch-1"));

        assertThat(result.outcomeFor("p1")).isEqualTo(NotificationOutcome.SKIPPED_DUPLICATE);
        assertThat(store.query(DocumentQuery.collection("notifications"))).hasSize(1);
    }

    @Test
    void missingCorrelationValueStillDelivers() {
        service.notify(NotificationType.CHALLENGE_ENDED, List.of("p1"), Map.of());
        service.notify(NotificationType.CHALLENGE_ENDED, List.of("p1"), Map.of(NotificationRecord.CHALLENGE_ID, " "));

        assertThat(store.query(DocumentQuery.collection("notifications"))).hasSize(2);
    }

    @Test
    void blankAndRepeatedRecipientsAreIgnored() {
        List<String> recipients = new ArrayList<>(List.of("p1", "", "p1"));
        recipients.add(null);

        FanOutResult result = service.notify(NotificationType.COACH_REQUEST_APPROVED, recipients,
            Map.of(NotificationRecord.REQUEST_ID, "req-1"));

        assertThat(result.outcomes()).containsOnlyKeys("p1");
    }

    @Test
    void failedDiscoveryNotifiesNobody() {
        FanOutResult result = service.notifyDiscovered(NotificationType.CHALLENGE_ENDED, () -> {
            throw new DocumentStoreException("query failed");
        }, Map.of(NotificationRecord.CHALLENGE_ID, "ch-1"));

        assertThat(result.outcomes()).isEmpty();
        assertThat(store.query(DocumentQuery.collection("notifications"))).isEmpty();
    }

    private NotificationFanOutService fanOut(DocumentStore documentStore) {
        return new NotificationFanOutService(documentStore, new NotificationPreferences(documentStore, "users"),
            new SyncMetrics(meterRegistry), "notifications");
    }
}
