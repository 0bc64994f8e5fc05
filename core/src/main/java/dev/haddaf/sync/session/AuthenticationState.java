package dev.haddaf.sync.session;

/**
 * What the identity provider reports: a signed in uid, a guest, or nobody.
 */
public record AuthenticationState(String userId, boolean guest) {

    public AuthenticationState {
        if (userId != null && guest) {
            throw new IllegalArgumentException("A guest has no user id");
        }
    }

    public static AuthenticationState signedIn(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id must not be blank");
        }
        return new AuthenticationState(userId, false);
    }

    public static AuthenticationState guestState() {
        return new AuthenticationState(null, true);
    }

    public static AuthenticationState signedOut() {
        return new AuthenticationState(null, false);
    }

    public boolean isSignedIn() {
        return userId != null;
    }
}
