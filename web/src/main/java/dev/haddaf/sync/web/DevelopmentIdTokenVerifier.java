package dev.haddaf.sync.web;

import org.springframework.util.StringUtils;

/**
 * Used when Firebase is disabled: tokens cannot be checked, so the presented token is taken as the uid itself.
 */
public class DevelopmentIdTokenVerifier implements IdTokenVerifier {

    @Override
    public String verifyIdToken(String idToken) {
        if (!StringUtils.hasText(idToken)) {
            throw new InvalidCredentialsException("An ID token is required");
        }
        return idToken.trim();
    }

    @Override
    public boolean acceptsRawUid() {
        return true;
    }
}
