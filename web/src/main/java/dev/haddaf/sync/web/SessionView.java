package dev.haddaf.sync.web;

import dev.haddaf.sync.session.Session;
import java.util.Locale;

public record SessionView(String userId,
                          boolean authenticated,
                          boolean guest,
                          String role,
                          String verification,
                          boolean verifiedCoach,
                          String rejectionReason,
                          String rejectionCategory) {

    static SessionView from(Session session) {
        return new SessionView(
            session.userId(),
            session.isAuthenticated(),
            session.guest(),
            session.role() == null ? null : session.role().value(),
            session.verification().name().toLowerCase(Locale.ROOT),
            session.isVerifiedCoach(),
            session.rejectionReason(),
            session.rejectionCategory());
    }
}
