package dev.haddaf.sync.session;

import java.util.Optional;

/**
 * Immutable authorization state of the current user. Published as a whole, so identity, guest flag and role
 * are always read together.
 */
public record Session(String userId,
                      boolean guest,
                      UserRole role,
                      VerificationState verification,
                      String rejectionReason,
                      String rejectionCategory) {

    public Session {
        verification = verification == null ? VerificationState.PENDING : verification;
        if (verification == VerificationState.APPROVED && role != UserRole.COACH) {
            verification = VerificationState.PENDING;
        }
    }

    public static Session signedOut() {
        return new Session(null, false, null, VerificationState.PENDING, null, null);
    }

    public static Session guestSession() {
        return new Session(null, true, null, VerificationState.PENDING, null, null);
    }

    /**
     * Session of a freshly signed in user whose role has not been read yet.
     */
    public static Session signedIn(String userId) {
        return new Session(userId, false, null, VerificationState.PENDING, null, null);
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    public Optional<String> currentUserId() {
        return Optional.ofNullable(userId);
    }

    public boolean isCoach() {
        return role == UserRole.COACH;
    }

    public boolean isVerifiedCoach() {
        return role == UserRole.COACH && verification == VerificationState.APPROVED;
    }

    public Session withRole(RoleProjection projection) {
        return new Session(userId, guest, projection.role(), projection.verification(),
            projection.rejectionReason(), projection.rejectionCategory());
    }
}
