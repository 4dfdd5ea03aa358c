package dev.gazettemonitor.exception;

public class NetworkException extends MonitorException {

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
