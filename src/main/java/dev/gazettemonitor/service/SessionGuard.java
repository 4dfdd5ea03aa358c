package dev.gazettemonitor.service;

import dev.gazettemonitor.client.IdentityClient;
import dev.gazettemonitor.exception.AuthException;
import dev.gazettemonitor.exception.LoginFailedException;
import dev.gazettemonitor.exception.NetworkException;
import dev.gazettemonitor.metrics.MonitorMetrics;
import dev.gazettemonitor.model.Session;
import dev.gazettemonitor.model.SessionEndReason;
import dev.gazettemonitor.model.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the bearer token: acquisition, persistence, verification and teardown.
 *
 * <p>States move {@code ANONYMOUS -> AUTHENTICATING -> AUTHENTICATED -> ANONYMOUS}.
 * Only {@link #login}, {@link #restore}, {@link #logout} and {@link #expire} write the
 * session; everything else reads it through {@link #currentToken()} or {@link #requireSession()}.
 * Verification failures of any kind, transport errors included, leave the guard anonymous.
 */
@Slf4j
@Service
public class SessionGuard {

    private final IdentityClient identityClient;
    private final CredentialStore credentialStore;
    private final List<SessionListener> listeners;
    private final MonitorMetrics metrics;
    private final Clock clock;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.ANONYMOUS);
    private volatile Session session;

    public SessionGuard(IdentityClient identityClient, CredentialStore credentialStore,
                        List<SessionListener> listeners, MonitorMetrics metrics, Clock clock) {
        this.identityClient = identityClient;
        this.credentialStore = credentialStore;
        this.listeners = List.copyOf(listeners);
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Authenticate with the identity server and persist the resulting credential.
     *
     * @return the new session
     * @throws LoginFailedException with the server's message when the credentials are rejected
     * @throws NetworkException when the identity server cannot be reached
     */
    public Mono<Session> login(String username, String password) {
        return Mono.defer(() -> {
            state.set(SessionState.AUTHENTICATING);
            log.info("Logging in as {}", username);
            return identityClient.login(username, password);
        }).map(response -> {
            if (response.getAccessToken() == null || response.getAccessToken().isBlank()) {
                throw new LoginFailedException("Login answer carried no access token");
            }
            if (response.getUser() == null || response.getUser().username() == null
                    || response.getUser().username().isBlank()) {
                throw new LoginFailedException("Login answer carried no user");
            }
            Session established = new Session(response.getAccessToken(), response.getUser(), clock.instant());
            credentialStore.save(established);
            authenticate(established);
            metrics.recordLogin("success");
            log.info("Logged in as {} ({})", established.username(),
                    established.user() != null ? established.user().role() : "no role");
            return established;
        }).doOnError(e -> {
            // a failed re-login ends the previous session too, storage and listeners included
            if (session != null) {
                discard(SessionEndReason.LOGIN_FAILED);
            } else {
                state.set(SessionState.ANONYMOUS);
            }
            if (e instanceof LoginFailedException) {
                metrics.recordLogin("rejected");
                log.warn("Login rejected for {}: {}", username, e.getMessage());
            } else {
                metrics.recordLogin("error");
                log.warn("Login failed for {}: {}", username, e.getMessage());
            }
        });
    }

    /**
     * Re-establish the stored session, if any, with exactly one verification round trip.
     * Anything other than a positive answer clears the stored credential.
     *
     * @return the resulting state, never an error
     */
    public Mono<SessionState> restore() {
        return Mono.defer(() -> {
            Optional<Session> stored;
            try {
                stored = credentialStore.load();
            } catch (RuntimeException e) {
                log.warn("Stored credential is unreadable, discarding it: {}", e.getMessage());
                discard(SessionEndReason.VERIFICATION_FAILED);
                return Mono.just(SessionState.ANONYMOUS);
            }
            if (stored.isEmpty()) {
                log.info("No stored credential - starting anonymous");
                return Mono.just(SessionState.ANONYMOUS);
            }

            Session candidate = stored.get();
            state.set(SessionState.AUTHENTICATING);
            return identityClient.verify(candidate.token())
                    .defaultIfEmpty(false)
                    .onErrorResume(e -> {
                        log.warn("Token verification failed: {}", e.getMessage());
                        return Mono.just(false);
                    })
                    .map(valid -> {
                        if (Boolean.TRUE.equals(valid)) {
                            authenticate(candidate.withVerifiedAt(clock.instant()));
                            log.info("Restored session for {}", candidate.username());
                        } else {
                            log.info("Stored credential for {} is no longer valid", candidate.username());
                            discard(SessionEndReason.VERIFICATION_FAILED);
                        }
                        return state.get();
                    });
        });
    }

    /**
     * Clear the session in memory and in storage. Never touches the network.
     */
    public void logout() {
        log.info("Logging out {}", session != null ? session.username() : "anonymous operator");
        discard(SessionEndReason.LOGOUT);
    }

    /**
     * Teardown after the backend answered 401 to an authenticated request.
     * Listeners are told the session expired so the active screen can send the operator to login.
     */
    public void expire() {
        log.warn("Session for {} expired", session != null ? session.username() : "anonymous operator");
        metrics.recordSessionExpired();
        discard(SessionEndReason.EXPIRED);
    }

    public SessionState getState() {
        return state.get();
    }

    public boolean isAuthenticated() {
        return state.get() == SessionState.AUTHENTICATED && session != null;
    }

    public Optional<Session> currentSession() {
        return isAuthenticated() ? Optional.of(session) : Optional.empty();
    }

    public Optional<String> currentToken() {
        return currentSession().map(Session::token);
    }

    /**
     * @throws AuthException when no session is established
     */
    public Session requireSession() {
        return currentSession().orElseThrow(() -> new AuthException("Not authenticated"));
    }

    private void authenticate(Session established) {
        session = established;
        state.set(SessionState.AUTHENTICATED);
        listeners.forEach(listener -> listener.onAuthenticated(established));
    }

    private void discard(SessionEndReason reason) {
        session = null;
        state.set(SessionState.ANONYMOUS);
        try {
            credentialStore.clear();
        } catch (RuntimeException e) {
            log.error("Failed to clear stored credential: {}", e.getMessage(), e);
        }
        listeners.forEach(listener -> listener.onSessionEnded(reason));
    }
}
