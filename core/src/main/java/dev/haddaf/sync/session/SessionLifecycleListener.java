package dev.haddaf.sync.session;

/**
 * Per-user components that start their subscriptions on sign-in and drop them on sign-out. Invoked on the
 * serialization executor.
 */
public interface SessionLifecycleListener {

    void onSignedIn(String userId);

    void onSignedOut();
}
