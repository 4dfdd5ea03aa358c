package dev.gazettemonitor.service;

import dev.gazettemonitor.exception.AuthException;
import dev.gazettemonitor.model.Screen;
import dev.gazettemonitor.model.Session;
import dev.gazettemonitor.model.SessionEndReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks the operator's active screen.
 * Switching is refused while a manual search runs; a session end always forces LOGIN.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScreenNavigator implements SessionListener {

    private final ExecutionMutex executionMutex;

    private final AtomicReference<Screen> current = new AtomicReference<>(Screen.LOGIN);
    private final AtomicBoolean authenticated = new AtomicBoolean(false);

    /**
     * @throws dev.gazettemonitor.exception.BusyException while a manual search runs; the screen is unchanged
     * @throws AuthException when the target screen needs a session and there is none
     */
    public Screen switchTo(Screen target) {
        executionMutex.ensureIdle("switch screens");
        if (target.requiresSession() && !authenticated.get()) {
            throw new AuthException("Log in to open " + target);
        }
        Screen previous = current.getAndSet(target);
        if (previous != target) {
            log.debug("Screen {} -> {}", previous, target);
        }
        return target;
    }

    public Screen current() {
        return current.get();
    }

    @Override
    public void onAuthenticated(Session session) {
        authenticated.set(true);
        current.compareAndSet(Screen.LOGIN, Screen.MANUAL_SEARCH);
    }

    @Override
    public void onSessionEnded(SessionEndReason reason) {
        authenticated.set(false);
        Screen previous = current.getAndSet(Screen.LOGIN);
        if (reason == SessionEndReason.EXPIRED && previous != Screen.LOGIN) {
            log.warn("Session expired on {} - redirecting to login", previous);
        }
    }
}
