package dev.gazettemonitor.exception;

public class AlreadyRunningException extends MonitorException {

    public AlreadyRunningException() {
        super("A manual search is already running");
    }
}
