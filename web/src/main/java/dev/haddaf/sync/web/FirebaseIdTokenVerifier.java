package dev.haddaf.sync.web;

import com.google.firebase.auth.FirebaseAuth;
import com.google.firebase.auth.FirebaseAuthException;
import com.google.firebase.auth.FirebaseToken;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

public class FirebaseIdTokenVerifier implements IdTokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(FirebaseIdTokenVerifier.class);

    private final FirebaseAuth firebaseAuth;

    public FirebaseIdTokenVerifier(FirebaseAuth firebaseAuth) {
        this.firebaseAuth = Objects.requireNonNull(firebaseAuth, "firebaseAuth");
    }

    @Override
    public String verifyIdToken(String idToken) {
        if (!StringUtils.hasText(idToken)) {
            throw new InvalidCredentialsException("An ID token is required");
        }
        try {
            FirebaseToken token = firebaseAuth.verifyIdToken(idToken, true);
            return token.getUid();
        } catch (FirebaseAuthException ex) {
            log.warn("Rejected ID token: {}", ex.getAuthErrorCode());
            throw new InvalidCredentialsException("The ID token could not be verified", ex);
        }
    }

    @Override
    public boolean acceptsRawUid() {
        return false;
    }
}
