package dev.haddaf.sync.session;

import java.util.Map;

/**
 * Authorization relevant view of a {@code users/{uid}} document.
 */
public record RoleProjection(UserRole role,
                             VerificationState verification,
                             String rejectionReason,
                             String rejectionCategory) {

    public static final String ROLE_FIELD = "role";
    public static final String STATUS_FIELD = "coachStatus";
    public static final String REJECTION_REASON_FIELD = "rejectionReason";
    public static final String REJECTION_CATEGORY_FIELD = "rejectionCategory";

    public static final RoleProjection DEFAULT =
        new RoleProjection(UserRole.PLAYER, VerificationState.PENDING, null, null);

    public RoleProjection {
        role = role == null ? UserRole.PLAYER : role;
        verification = verification == null ? VerificationState.PENDING : verification;
        if (verification == VerificationState.APPROVED && role != UserRole.COACH) {
            verification = VerificationState.PENDING;
        }
    }

    public boolean isVerifiedCoach() {
        return role == UserRole.COACH && verification == VerificationState.APPROVED;
    }

    /**
     * Projects the raw fields of a user document. Total: unknown or mistyped values never throw.
     *
     * <p>A field that is absent (or unreadable) keeps its last observed value, or takes its default when it
     * has never been observed. Rejection fields always follow the document.
     *
     * @param data user document fields, or {@code null} when the document does not exist
     * @param lastObservedRole last role read from a document of this user, {@code null} if none yet
     * @param lastObservedStatus last status read from a document of this user, {@code null} if none yet
     */
    public static RoleProjection project(Map<String, Object> data,
                                         UserRole lastObservedRole,
                                         VerificationState lastObservedStatus) {
        if (data == null) {
            return DEFAULT;
        }
        UserRole role = UserRole.fromValue(text(data.get(ROLE_FIELD)))
            .orElse(lastObservedRole != null ? lastObservedRole : UserRole.PLAYER);
        VerificationState status = VerificationState.fromValue(text(data.get(STATUS_FIELD)))
            .orElse(lastObservedStatus != null ? lastObservedStatus : VerificationState.PENDING);
        return new RoleProjection(role, status,
            text(data.get(REJECTION_REASON_FIELD)),
            text(data.get(REJECTION_CATEGORY_FIELD)));
    }

    private static String text(Object value) {
        return value instanceof String string && !string.isBlank() ? string : null;
    }
}
