package dev.gazettemonitor.model;

public enum SessionState {
    ANONYMOUS,
    AUTHENTICATING,
    AUTHENTICATED
}
