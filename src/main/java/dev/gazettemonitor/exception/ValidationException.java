package dev.gazettemonitor.exception;

import java.util.List;

/**
 * A job, search or settings payload was rejected before (or by) the backend.
 * Recoverable: the caller shows the violations next to the form.
 */
public class ValidationException extends MonitorException {

    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
