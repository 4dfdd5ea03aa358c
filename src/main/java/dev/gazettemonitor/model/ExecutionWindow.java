package dev.gazettemonitor.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Result of resolving a job against a candidate date.
 * When {@code fires} is false the dates are null and no search may be issued.
 */
public record ExecutionWindow(boolean fires, LocalDate fromDate, LocalDate toDate) {

    private static final ExecutionWindow IDLE = new ExecutionWindow(false, null, null);

    public static ExecutionWindow idle() {
        return IDLE;
    }

    public static ExecutionWindow between(LocalDate fromDate, LocalDate toDate) {
        return new ExecutionWindow(true, fromDate, toDate);
    }

    /**
     * Number of calendar days covered, both endpoints included. Zero when idle.
     */
    public long days() {
        if (!fires) {
            return 0;
        }
        return ChronoUnit.DAYS.between(fromDate, toDate) + 1;
    }
}
