package dev.gazettemonitor.exception;

/**
 * The session is missing, expired or was rejected by the backend.
 * Never recovered locally: the operator has to authenticate again.
 */
public class AuthException extends MonitorException {

    public AuthException(String message) {
        super(message);
    }
}
