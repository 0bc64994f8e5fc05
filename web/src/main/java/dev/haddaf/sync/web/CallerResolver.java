package dev.haddaf.sync.web;

import dev.haddaf.sync.session.Session;
import dev.haddaf.sync.session.SessionContext;
import java.util.Objects;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves the uid a request acts for from its verified credential.
 *
 * <p>Feeds and the inbox are projected for the user of the signed in session. Requests that read or change
 * them must come from that same user; {@link #requireSessionOwner} enforces this.
 */
@Component
public class CallerResolver {

    private final SessionContext sessionContext;

    public CallerResolver(SessionContext sessionContext) {
        this.sessionContext = Objects.requireNonNull(sessionContext, "sessionContext");
    }

    /**
     * @throws NotSignedInException when the request carries no verified user credential
     */
    public String requireUid(Authentication authentication) {
        if (authentication == null
            || !authentication.isAuthenticated()
            || authentication instanceof AnonymousAuthenticationToken
            || !StringUtils.hasText(authentication.getName())) {
            throw new NotSignedInException();
        }
        return authentication.getName();
    }

    /**
     * @throws SessionMismatchException when the caller is not the user the session is signed in as
     */
    public String requireSessionOwner(Authentication authentication) {
        String uid = requireUid(authentication);
        Session session = sessionContext.current();
        if (!uid.equals(session.userId())) {
            throw new SessionMismatchException(uid);
        }
        return uid;
    }
}
