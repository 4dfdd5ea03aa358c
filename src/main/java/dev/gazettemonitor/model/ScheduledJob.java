package dev.gazettemonitor.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * A persisted recurring search. The id is assigned by the backend.
 * An empty weekday set means the job fires every day.
 */
@Value
@With
@Builder(toBuilder = true)
public class ScheduledJob {

    Long id;

    @Builder.Default
    List<String> searchTerms = List.of();

    // Local time in America/Sao_Paulo
    LocalTime triggerTime;

    @Builder.Default
    Set<DayOfWeek> weekdays = Set.of();

    int lookbackDays;

    String notifyEmail;

    boolean active;

    // Audit metadata, advisory only
    String lastModifiedBy;
    Instant lastModifiedAt;

    public boolean firesEveryDay() {
        return weekdays == null || weekdays.isEmpty();
    }
}
