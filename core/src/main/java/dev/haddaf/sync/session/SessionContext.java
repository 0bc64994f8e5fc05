package dev.haddaf.sync.session;

import dev.haddaf.sync.events.EventSubscription;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the current {@link Session}. Readers may call {@link #current()} from any thread; updates happen on
 * the serialization executor only.
 */
public class SessionContext {

    private static final Logger log = LoggerFactory.getLogger(SessionContext.class);

    private final List<Consumer<Session>> listeners = new CopyOnWriteArrayList<>();
    private volatile Session current = Session.signedOut();

    public Session current() {
        return current;
    }

    public EventSubscription subscribe(Consumer<Session> listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    void update(UnaryOperator<Session> change) {
        Session next = change.apply(current);
        if (next.equals(current)) {
            return;
        }
        current = next;
        log.debug("Session updated: user={} guest={} role={} verification={}",
            next.userId(), next.guest(), next.role(), next.verification());
        for (Consumer<Session> listener : listeners) {
            listener.accept(next);
        }
    }
}
