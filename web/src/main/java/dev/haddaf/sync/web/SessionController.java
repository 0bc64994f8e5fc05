package dev.haddaf.sync.web;

import dev.haddaf.sync.session.AuthenticationState;
import dev.haddaf.sync.session.LocalAuthenticationStateSource;
import dev.haddaf.sync.session.Session;
import dev.haddaf.sync.session.SessionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Authentication transitions. Sign-in and sign-out are applied asynchronously by the identity resolver, so
 * both answer {@code 202 Accepted} with the session they move to; clients poll {@code GET /api/session} for the
 * resolved role. Only the user the session is signed in as may read or end it.
 */
@RestController
@RequestMapping("/api/session")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final LocalAuthenticationStateSource authenticationSource;
    private final SessionContext sessionContext;
    private final IdTokenVerifier idTokenVerifier;
    private final CallerResolver callers;

    public SessionController(LocalAuthenticationStateSource authenticationSource,
                             SessionContext sessionContext,
                             IdTokenVerifier idTokenVerifier,
                             CallerResolver callers) {
        this.authenticationSource = authenticationSource;
        this.sessionContext = sessionContext;
        this.idTokenVerifier = idTokenVerifier;
        this.callers = callers;
    }

    @GetMapping
    public SessionView current(Authentication authentication) {
        callers.requireSessionOwner(authentication);
        return SessionView.from(sessionContext.current());
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SessionView signIn(@RequestBody SignInRequest request) {
        if (request.guest()) {
            authenticationSource.publish(AuthenticationState.guestState());
            log.info("Continuing as guest");
            return SessionView.from(Session.guestSession());
        }
        String uid;
        if (StringUtils.hasText(request.idToken())) {
            uid = idTokenVerifier.verifyIdToken(request.idToken());
        } else if (StringUtils.hasText(request.uid())) {
            if (!idTokenVerifier.acceptsRawUid()) {
                throw new InvalidCredentialsException("Sign in with an ID token");
            }
            uid = request.uid().trim();
        } else {
            throw new IllegalArgumentException("Provide an idToken, a uid or guest=true");
        }
        authenticationSource.publish(AuthenticationState.signedIn(uid));
        log.info("Sign-in accepted for {}", uid);
        return SessionView.from(Session.signedIn(uid));
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SessionView signOut(Authentication authentication) {
        String uid = callers.requireSessionOwner(authentication);
        authenticationSource.publish(AuthenticationState.signedOut());
        log.info("Sign-out requested by {}", uid);
        return SessionView.from(Session.signedOut());
    }

    public record SignInRequest(String idToken, String uid, boolean guest) {
    }
}
