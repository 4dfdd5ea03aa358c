package dev.gazettemonitor.exception;

/**
 * Login was rejected. The message is the identity server's own text, unmodified.
 */
public class LoginFailedException extends MonitorException {

    public LoginFailedException(String serverMessage) {
        super(serverMessage);
    }
}
