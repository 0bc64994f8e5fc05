package dev.haddaf.sync.web;

/**
 * Turns the credential presented at sign-in into a uid.
 */
public interface IdTokenVerifier {

    /**
     * @return the uid the token was issued to
     * @throws InvalidCredentialsException when the token is invalid, expired or revoked
     */
    String verifyIdToken(String idToken);

    /**
     * Whether a bare uid may be presented instead of a token.
     */
    boolean acceptsRawUid();
}
