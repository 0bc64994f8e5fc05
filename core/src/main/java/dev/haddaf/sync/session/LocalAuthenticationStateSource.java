package dev.haddaf.sync.session;

import dev.haddaf.sync.events.EventSubscription;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authentication source fed by the host after it verified a credential.
 */
public class LocalAuthenticationStateSource implements AuthenticationStateSource {

    private static final Logger log = LoggerFactory.getLogger(LocalAuthenticationStateSource.class);

    private final List<Consumer<AuthenticationState>> listeners = new CopyOnWriteArrayList<>();
    private volatile AuthenticationState current = AuthenticationState.signedOut();

    @Override
    public EventSubscription addListener(Consumer<AuthenticationState> listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        listener.accept(current);
        return () -> listeners.remove(listener);
    }

    public synchronized void publish(AuthenticationState state) {
        Objects.requireNonNull(state, "state");
        current = state;
        log.debug("Authentication state changed: signedIn={} guest={}", state.isSignedIn(), state.guest());
        for (Consumer<AuthenticationState> listener : listeners) {
            listener.accept(state);
        }
    }

    public AuthenticationState current() {
        return current;
    }
}
