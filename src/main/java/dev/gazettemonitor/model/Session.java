package dev.gazettemonitor.model;

import java.time.Instant;

/**
 * An authenticated operator session. {@code verifiedAt} is the last time the backend accepted the token.
 */
public record Session(String token, UserInfo user, Instant verifiedAt) {

    public Session withVerifiedAt(Instant instant) {
        return new Session(token, user, instant);
    }

    public String username() {
        return user != null ? user.username() : null;
    }

    @Override
    public String toString() {
        // never print the token
        return "Session[user=" + user + ", verifiedAt=" + verifiedAt + "]";
    }
}
