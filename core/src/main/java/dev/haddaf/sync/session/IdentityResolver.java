package dev.haddaf.sync.session;

import dev.haddaf.sync.events.EventSubscription;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns authentication changes into {@link Session} publications and drives the per-user components.
 *
 * <p>Each change is handled on the serialization executor: the previous user's subscriptions are stopped
 * before the new session is published, and the role projector starts right after it.
 */
public class IdentityResolver implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final AuthenticationStateSource source;
    private final SessionContext sessionContext;
    private final RoleProjector roleProjector;
    private final List<SessionLifecycleListener> lifecycleListeners;
    private final Executor serialExecutor;

    private EventSubscription subscription;

    public IdentityResolver(AuthenticationStateSource source,
                            SessionContext sessionContext,
                            RoleProjector roleProjector,
                            List<SessionLifecycleListener> lifecycleListeners,
                            Executor serialExecutor) {
        this.source = Objects.requireNonNull(source, "source");
        this.sessionContext = Objects.requireNonNull(sessionContext, "sessionContext");
        this.roleProjector = Objects.requireNonNull(roleProjector, "roleProjector");
        this.lifecycleListeners = List.copyOf(lifecycleListeners);
        this.serialExecutor = Objects.requireNonNull(serialExecutor, "serialExecutor");
    }

    public synchronized void start() {
        if (subscription != null) {
            return;
        }
        subscription = source.addListener(state -> serialExecutor.execute(() -> apply(state)));
        log.info("Identity resolver started with {} session listener(s)", lifecycleListeners.size());
    }

    @Override
    public synchronized void close() {
        if (subscription != null) {
            subscription.cancel();
            subscription = null;
        }
    }

    private void apply(AuthenticationState state) {
        Session current = sessionContext.current();
        if (state.isSignedIn()) {
            if (state.userId().equals(current.userId())) {
                return;
            }
            if (current.isAuthenticated()) {
                endUserScope(current.userId());
            }
            String uid = state.userId();
            sessionContext.update(session -> Session.signedIn(uid));
            roleProjector.start(uid);
            for (SessionLifecycleListener listener : lifecycleListeners) {
                try {
                    listener.onSignedIn(uid);
                } catch (RuntimeException ex) {
                    log.error("Session listener {} failed on sign-in", listener.getClass().getSimpleName(), ex);
                }
            }
            log.info("Signed in as {}", uid);
            return;
        }
        if (current.isAuthenticated()) {
            endUserScope(current.userId());
        }
        Session next = state.guest() ? Session.guestSession() : Session.signedOut();
        sessionContext.update(session -> next);
    }

    private void endUserScope(String uid) {
        roleProjector.stop();
        for (SessionLifecycleListener listener : lifecycleListeners) {
            try {
                listener.onSignedOut();
            } catch (RuntimeException ex) {
                log.error("Session listener {} failed on sign-out", listener.getClass().getSimpleName(), ex);
            }
        }
        log.info("Signed out {}", uid);
    }
}
