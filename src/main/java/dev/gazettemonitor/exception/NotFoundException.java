package dev.gazettemonitor.exception;

/**
 * The referenced job no longer exists. Callers refresh their job list.
 */
public class NotFoundException extends MonitorException {

    public NotFoundException(String message) {
        super(message);
    }
}
