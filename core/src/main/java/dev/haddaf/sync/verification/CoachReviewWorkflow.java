package dev.haddaf.sync.verification;

import dev.haddaf.sync.notification.FanOutResult;
import dev.haddaf.sync.notification.NotificationFanOutService;
import dev.haddaf.sync.notification.NotificationRecord;
import dev.haddaf.sync.notification.NotificationType;
import dev.haddaf.sync.session.Session;
import dev.haddaf.sync.session.SessionContext;
import dev.haddaf.sync.store.DocumentPath;
import dev.haddaf.sync.store.DocumentStore;
import dev.haddaf.sync.store.DocumentStoreException;
import dev.haddaf.sync.store.ServerValue;
import dev.haddaf.sync.store.StoreTransaction;
import dev.haddaf.sync.store.StoredDocument;
import dev.haddaf.sync.store.TransactionWork;
import dev.haddaf.sync.verification.CoachReviewRejectedException.Reason;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Administrator review of coach verification requests. The request and the coach's user document are
 * updated in one transaction; the coach's role projection picks the change up from the live subscription.
 */
public class CoachReviewWorkflow {

    private static final Logger log = LoggerFactory.getLogger(CoachReviewWorkflow.class);

    static final String ADMIN_ROLE = "admin";
    static final String STATUS = "status";
    static final String PENDING = "pending";
    static final String UNDER_REVIEW = "under_review";
    static final String APPROVED = "approved";
    static final String REJECTED = "rejected";

    private final DocumentStore store;
    private final NotificationFanOutService fanOut;
    private final SessionContext sessionContext;
    private final String usersCollection;
    private final String coachRequestsCollection;

    public CoachReviewWorkflow(DocumentStore store,
                               NotificationFanOutService fanOut,
                               SessionContext sessionContext,
                               String usersCollection,
                               String coachRequestsCollection) {
        this.store = Objects.requireNonNull(store, "store");
        this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
        this.sessionContext = Objects.requireNonNull(sessionContext, "sessionContext");
        this.usersCollection = Objects.requireNonNull(usersCollection, "usersCollection");
        this.coachRequestsCollection = Objects.requireNonNull(coachRequestsCollection, "coachRequestsCollection");
    }

    /**
     * Approves a request as the signed in user.
     */
    public ReviewDecision approve(String requestId) {
        return approve(requestId, sessionUser());
    }

    /**
     * Approves a request as {@code reviewerId}, who must hold the administrator role in the users collection.
     */
    public ReviewDecision approve(String requestId, String reviewerId) {
        String reviewer = requireAdministrator(reviewerId);
        String coachId = commit(requestId, transaction -> {
            String uid = readPendingRequest(transaction, requestId);
            Map<String, Object> request = new LinkedHashMap<>();
            request.put(STATUS, APPROVED);
            request.put("reviewedAt", ServerValue.TIMESTAMP);
            request.put("reviewedBy", reviewer);
            transaction.merge(DocumentPath.of(coachRequestsCollection, requestId), request);

            Map<String, Object> user = new LinkedHashMap<>();
            user.put("role", "coach");
            user.put("coachStatus", APPROVED);
            user.put("rejectionReason", ServerValue.DELETE);
            user.put("rejectionCategory", ServerValue.DELETE);
            transaction.merge(DocumentPath.of(usersCollection, uid), user);
            return uid;
        });
        log.info("Coach request {} approved by {}", requestId, reviewer);
        FanOutResult notification = fanOut.notify(NotificationType.COACH_REQUEST_APPROVED, Set.of(coachId),
            Map.of(NotificationRecord.REQUEST_ID, requestId));
        return new ReviewDecision(requestId, coachId, APPROVED, notification);
    }

    public ReviewDecision reject(String requestId, String reason, String category) {
        return reject(requestId, sessionUser(), reason, category);
    }

    public ReviewDecision reject(String requestId, String reviewerId, String reason, String category) {
        if (!StringUtils.hasText(reason)) {
            throw new IllegalArgumentException("A rejection reason is required");
        }
        String reviewer = requireAdministrator(reviewerId);
        String coachId = commit(requestId, transaction -> {
            String uid = readPendingRequest(transaction, requestId);
            Map<String, Object> rejection = new LinkedHashMap<>();
            rejection.put("rejectionReason", reason.trim());
            rejection.put("rejectionCategory", StringUtils.hasText(category) ? category.trim() : ServerValue.DELETE);

            Map<String, Object> request = new LinkedHashMap<>(rejection);
            request.put(STATUS, REJECTED);
            request.put("reviewedAt", ServerValue.TIMESTAMP);
            request.put("reviewedBy", reviewer);
            transaction.merge(DocumentPath.of(coachRequestsCollection, requestId), request);

            Map<String, Object> user = new LinkedHashMap<>(rejection);
            user.put("coachStatus", REJECTED);
            transaction.merge(DocumentPath.of(usersCollection, uid), user);
            return uid;
        });
        log.info("Coach request {} rejected by {}", requestId, reviewer);
        FanOutResult notification = fanOut.notify(NotificationType.COACH_REQUEST_REJECTED, Set.of(coachId),
            Map.of(NotificationRecord.REQUEST_ID, requestId, NotificationRecord.REJECTION_REASON, reason.trim()));
        return new ReviewDecision(requestId, coachId, REJECTED, notification);
    }

    private String sessionUser() {
        Session session = sessionContext.current();
        return session.isAuthenticated() ? session.userId() : null;
    }

    private String requireAdministrator(String uid) {
        if (!StringUtils.hasText(uid)) {
            throw new CoachReviewRejectedException(Reason.NOT_ADMINISTRATOR, "Sign in as an administrator");
        }
        Optional<StoredDocument> user;
        try {
            user = store.fetch(DocumentPath.of(usersCollection, uid));
        } catch (DocumentStoreException ex) {
            throw new CoachReviewException("Could not verify administrator rights", ex);
        }
        if (user.isEmpty() || !ADMIN_ROLE.equals(user.get().getString("role"))) {
            throw new CoachReviewRejectedException(Reason.NOT_ADMINISTRATOR,
                "User " + uid + " is not an administrator");
        }
        return uid;
    }

    private String readPendingRequest(StoreTransaction transaction, String requestId) {
        StoredDocument request = transaction.get(DocumentPath.of(coachRequestsCollection, requestId))
            .orElseThrow(() -> new CoachReviewRejectedException(Reason.NOT_FOUND,
                "Coach request " + requestId + " does not exist"));
        String status = request.getString(STATUS);
        if (!PENDING.equals(status) && !UNDER_REVIEW.equals(status)) {
            throw new CoachReviewRejectedException(Reason.ALREADY_REVIEWED,
                "Coach request " + requestId + " was already " + status);
        }
        String uid = request.getString("uid");
        if (!StringUtils.hasText(uid) || transaction.get(DocumentPath.of(usersCollection, uid)).isEmpty()) {
            throw new CoachReviewRejectedException(Reason.COACH_MISSING,
                "Coach request " + requestId + " has no matching user");
        }
        return uid;
    }

    private String commit(String requestId, TransactionWork<String> work) {
        if (!StringUtils.hasText(requestId)) {
            throw new IllegalArgumentException("Request id is required");
        }
        try {
            return store.runTransaction(work);
        } catch (DocumentStoreException ex) {
            log.error("Review of coach request {} failed", requestId, ex);
            throw new CoachReviewException("Could not complete the review, please try again", ex);
        }
    }
}
