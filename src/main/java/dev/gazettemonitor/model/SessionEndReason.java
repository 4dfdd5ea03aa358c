package dev.gazettemonitor.model;

public enum SessionEndReason {
    LOGOUT,
    EXPIRED,
    VERIFICATION_FAILED,
    LOGIN_FAILED
}
