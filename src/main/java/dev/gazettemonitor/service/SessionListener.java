package dev.gazettemonitor.service;

import dev.gazettemonitor.model.Session;
import dev.gazettemonitor.model.SessionEndReason;

/**
 * Receives session lifecycle transitions from {@link SessionGuard}.
 */
public interface SessionListener {

    default void onAuthenticated(Session session) {
    }

    /**
     * Called after the credential has been cleared from memory and storage.
     */
    default void onSessionEnded(SessionEndReason reason) {
    }
}
