package dev.gazettemonitor.service;

import dev.gazettemonitor.model.ExecutionWindow;
import dev.gazettemonitor.model.ScheduledJob;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Maps a job and a candidate trigger date to the date range its search covers.
 * Stateless; the same input always resolves to the same window.
 */
@Component
public class WindowResolver {

    public static final ZoneId ZONE = ZoneId.of("America/Sao_Paulo");

    /**
     * Resolve the window for a São Paulo calendar date.
     *
     * @param job       the scheduled job
     * @param candidate trigger date, already local to São Paulo
     * @return the window, or {@link ExecutionWindow#idle()} when the job does not fire that day
     */
    public ExecutionWindow resolve(ScheduledJob job, LocalDate candidate) {
        if (!firesOn(job, candidate)) {
            return ExecutionWindow.idle();
        }
        int lookback = Math.max(0, job.getLookbackDays());
        return ExecutionWindow.between(candidate.minusDays(lookback), candidate);
    }

    /**
     * Resolve for an instant. The instant is converted to the São Paulo date first,
     * so 23:59 local never rolls over to the next day through UTC.
     */
    public ExecutionWindow resolve(ScheduledJob job, Instant instant) {
        return resolve(job, localDate(instant));
    }

    public ExecutionWindow resolve(ScheduledJob job, ZonedDateTime dateTime) {
        return resolve(job, localDate(dateTime.toInstant()));
    }

    public boolean firesOn(ScheduledJob job, LocalDate candidate) {
        return job.firesEveryDay() || job.getWeekdays().contains(candidate.getDayOfWeek());
    }

    public static LocalDate localDate(Instant instant) {
        return instant.atZone(ZONE).toLocalDate();
    }
}
