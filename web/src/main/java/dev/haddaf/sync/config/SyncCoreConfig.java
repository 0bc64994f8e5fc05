package dev.haddaf.sync.config;

import com.google.cloud.firestore.Firestore;
import com.google.firebase.auth.FirebaseAuth;
import dev.haddaf.sync.events.EventSubscription;
import dev.haddaf.sync.events.LocalEventBus;
import dev.haddaf.sync.feed.FeedProjector;
import dev.haddaf.sync.feed.PostActions;
import dev.haddaf.sync.feed.PostFeedDefinition;
import dev.haddaf.sync.feed.PostFeedEvents;
import dev.haddaf.sync.feed.UserProfileLookup;
import dev.haddaf.sync.feed.VideoPost;
import dev.haddaf.sync.firestore.FirestoreDocumentStore;
import dev.haddaf.sync.invitation.InvitationFeedDefinition;
import dev.haddaf.sync.invitation.InvitationWorkflow;
import dev.haddaf.sync.invitation.PendingInvitation;
import dev.haddaf.sync.metrics.SyncMetrics;
import dev.haddaf.sync.notification.ChallengeNotificationJobs;
import dev.haddaf.sync.notification.NotificationFanOutService;
import dev.haddaf.sync.notification.NotificationInbox;
import dev.haddaf.sync.notification.NotificationPreferences;
import dev.haddaf.sync.notification.RecipientDirectory;
import dev.haddaf.sync.session.IdentityResolver;
import dev.haddaf.sync.session.LocalAuthenticationStateSource;
import dev.haddaf.sync.session.RoleProjector;
import dev.haddaf.sync.session.SessionContext;
import dev.haddaf.sync.store.DocumentStore;
import dev.haddaf.sync.store.InMemoryDocumentStore;
import dev.haddaf.sync.subscription.SubscriptionManager;
import dev.haddaf.sync.verification.CoachReviewWorkflow;
import dev.haddaf.sync.web.DevelopmentIdTokenVerifier;
import dev.haddaf.sync.web.FirebaseIdTokenVerifier;
import dev.haddaf.sync.web.IdTokenVerifier;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the sync core. All published state is mutated on the single {@code sync-serial} thread; secondary
 * fetches run on the {@code sync-fetch} pool.
 */
@Configuration
@EnableConfigurationProperties(SyncProperties.class)
public class SyncCoreConfig {

    private static final Logger log = LoggerFactory.getLogger(SyncCoreConfig.class);

    static final String SERIAL_EXECUTOR = "syncSerialExecutor";
    static final String FETCH_EXECUTOR = "syncFetchExecutor";

    private final FirestoreProperties firestoreProperties;
    private final SyncProperties syncProperties;

    public SyncCoreConfig(FirestoreProperties firestoreProperties, SyncProperties syncProperties) {
        this.firestoreProperties = firestoreProperties;
        this.syncProperties = syncProperties;
    }

    @Bean(name = SERIAL_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService syncSerialExecutor() {
        return Executors.newSingleThreadExecutor(namedThreads("sync-serial"));
    }

    @Bean(name = FETCH_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService syncFetchExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, syncProperties.fetchThreads()), namedThreads("sync-fetch"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SyncMetrics syncMetrics(MeterRegistry meterRegistry) {
        return new SyncMetrics(meterRegistry);
    }

    @Bean
    public DocumentStore documentStore(ObjectProvider<Firestore> firestoreProvider, Clock clock) {
        Firestore firestore = firestoreProvider.getIfAvailable();
        if (firestore != null) {
            log.info("Using Firestore document store");
            return new FirestoreDocumentStore(firestore, Runnable::run);
        }
        log.info("Firestore integration is disabled; using the in-memory document store. "
            + "Set firestore.enabled=true to connect to Firestore.");
        return new InMemoryDocumentStore(Runnable::run, clock);
    }

    @Bean
    public SubscriptionManager subscriptionManager(DocumentStore documentStore,
                                                   @Qualifier(SERIAL_EXECUTOR) ExecutorService serial,
                                                   SyncMetrics metrics) {
        return new SubscriptionManager(documentStore, serial, metrics);
    }

    @Bean
    public LocalEventBus localEventBus(@Qualifier(SERIAL_EXECUTOR) ExecutorService serial) {
        return new LocalEventBus(serial);
    }

    @Bean
    public SessionContext sessionContext() {
        return new SessionContext();
    }

    @Bean
    public LocalAuthenticationStateSource authenticationStateSource() {
        return new LocalAuthenticationStateSource();
    }

    @Bean
    public RoleProjector roleProjector(SubscriptionManager subscriptions, SessionContext sessionContext) {
        return new RoleProjector(subscriptions, sessionContext, firestoreProperties.getUsersCollection());
    }

    @Bean
    public UserProfileLookup userProfileLookup(DocumentStore documentStore, Clock clock) {
        return new UserProfileLookup(documentStore, firestoreProperties.getUsersCollection(), clock,
            syncProperties.profileCacheTtl());
    }

    @Bean
    public FeedProjector<VideoPost> postFeed(UserProfileLookup profiles,
                                             SubscriptionManager subscriptions,
                                             @Qualifier(SERIAL_EXECUTOR) ExecutorService serial,
                                             @Qualifier(FETCH_EXECUTOR) ExecutorService fetch,
                                             SyncMetrics metrics,
                                             Clock clock) {
        return new FeedProjector<>(new PostFeedDefinition(firestoreProperties.getPostsCollection(), profiles),
            subscriptions, serial, fetch, metrics, clock, syncProperties.tombstoneTtl());
    }

    @Bean
    public FeedProjector<PendingInvitation> invitationFeed(DocumentStore documentStore,
                                                           UserProfileLookup profiles,
                                                           SubscriptionManager subscriptions,
                                                           @Qualifier(SERIAL_EXECUTOR) ExecutorService serial,
                                                           @Qualifier(FETCH_EXECUTOR) ExecutorService fetch,
                                                           SyncMetrics metrics,
                                                           Clock clock) {
        InvitationFeedDefinition definition = new InvitationFeedDefinition(documentStore, profiles,
            firestoreProperties.getInvitationsCollection(), firestoreProperties.getTeamsCollection());
        return new FeedProjector<>(definition, subscriptions, serial, fetch, metrics, clock,
            syncProperties.tombstoneTtl());
    }

    @Bean
    public PostActions postActions(DocumentStore documentStore, LocalEventBus bus) {
        return new PostActions(documentStore, bus, firestoreProperties.getPostsCollection());
    }

    @Bean(destroyMethod = "cancel")
    public EventSubscription postFeedEvents(LocalEventBus bus, FeedProjector<VideoPost> postFeed) {
        return PostFeedEvents.bind(bus, postFeed);
    }

    @Bean
    public NotificationPreferences notificationPreferences(DocumentStore documentStore) {
        return new NotificationPreferences(documentStore, firestoreProperties.getUsersCollection());
    }

    @Bean
    public NotificationFanOutService notificationFanOutService(DocumentStore documentStore,
                                                               NotificationPreferences preferences,
                                                               SyncMetrics metrics) {
        return new NotificationFanOutService(documentStore, preferences, metrics,
            firestoreProperties.getNotificationsCollection());
    }

    @Bean
    public NotificationInbox notificationInbox(SubscriptionManager subscriptions,
                                               DocumentStore documentStore,
                                               SyncMetrics metrics) {
        return new NotificationInbox(subscriptions, documentStore, metrics,
            firestoreProperties.getNotificationsCollection());
    }

    @Bean
    public ChallengeNotificationJobs challengeNotificationJobs(DocumentStore documentStore,
                                                               NotificationFanOutService fanOut,
                                                               Clock clock) {
        RecipientDirectory directory = new RecipientDirectory(documentStore,
            firestoreProperties.getUsersCollection(), firestoreProperties.getChallengesCollection());
        return new ChallengeNotificationJobs(documentStore, fanOut, directory, clock,
            firestoreProperties.getUsersCollection(), firestoreProperties.getChallengesCollection(),
            syncProperties.adminReminderDay());
    }

    @Bean
    public InvitationWorkflow invitationWorkflow(DocumentStore documentStore,
                                                 NotificationFanOutService fanOut,
                                                 SessionContext sessionContext) {
        return new InvitationWorkflow(documentStore, fanOut, sessionContext,
            firestoreProperties.getInvitationsCollection(), firestoreProperties.getUsersCollection(),
            firestoreProperties.getTeamsCollection());
    }

    @Bean
    public CoachReviewWorkflow coachReviewWorkflow(DocumentStore documentStore,
                                                   NotificationFanOutService fanOut,
                                                   SessionContext sessionContext) {
        return new CoachReviewWorkflow(documentStore, fanOut, sessionContext,
            firestoreProperties.getUsersCollection(), firestoreProperties.getCoachRequestsCollection());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public IdentityResolver identityResolver(LocalAuthenticationStateSource authenticationSource,
                                             SessionContext sessionContext,
                                             RoleProjector roleProjector,
                                             UserProfileLookup profiles,
                                             NotificationInbox inbox,
                                             FeedProjector<VideoPost> postFeed,
                                             FeedProjector<PendingInvitation> invitationFeed,
                                             @Qualifier(SERIAL_EXECUTOR) ExecutorService serial) {
        return new IdentityResolver(authenticationSource, sessionContext, roleProjector,
            List.of(profiles, inbox, postFeed, invitationFeed), serial);
    }

    @Bean
    public IdTokenVerifier idTokenVerifier(ObjectProvider<FirebaseAuth> firebaseAuthProvider) {
        FirebaseAuth firebaseAuth = firebaseAuthProvider.getIfAvailable();
        if (firebaseAuth != null) {
            return new FirebaseIdTokenVerifier(firebaseAuth);
        }
        log.warn("Firebase integration is disabled; bearer tokens are taken as bare uids. "
            + "Set firebase.enabled=true in production.");
        return new DevelopmentIdTokenVerifier();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
