package dev.gazettemonitor.model;

/**
 * Operator screens. LOGIN is the only one reachable without a session.
 */
public enum Screen {
    LOGIN,
    MANUAL_SEARCH,
    SCHEDULES,
    SETTINGS,
    ACTIVITY_LOG;

    public boolean requiresSession() {
        return this != LOGIN;
    }
}
