package dev.haddaf.sync.session;

import dev.haddaf.sync.events.EventSubscription;
import java.util.function.Consumer;

/**
 * Long-lived source of authentication changes. A new listener is told the current state right away.
 */
public interface AuthenticationStateSource {

    EventSubscription addListener(Consumer<AuthenticationState> listener);
}
