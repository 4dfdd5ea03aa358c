package dev.gazettemonitor.exception;

/**
 * Non-success answer from the backend that is not covered by a more specific type.
 */
public class BackendException extends MonitorException {

    private final int status;

    public BackendException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
