package dev.gazettemonitor.exception;

/**
 * Base type for every failure surfaced by the monitor client.
 * All subtypes are unchecked; none of them is retried automatically.
 */
public class MonitorException extends RuntimeException {

    public MonitorException(String message) {
        super(message);
    }

    public MonitorException(String message, Throwable cause) {
        super(message, cause);
    }
}
