package dev.gazettemonitor.exception;

/**
 * Raised when an operation is attempted while a manual search holds the execution lock.
 * The attempted operation is discarded, not queued.
 */
public class BusyException extends MonitorException {

    public BusyException(String operation) {
        super("Cannot " + operation + " while a manual search is running");
    }
}
