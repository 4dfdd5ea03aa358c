package dev.gazettemonitor.model;

import java.util.List;
import java.util.Optional;

/**
 * Job list as returned by the backend, with its summary counters.
 * Counters come from the wrapped response when it carries them and are recomputed otherwise.
 */
public record JobCollection(
        List<ScheduledJob> jobs,
        int totalJobs,
        int activeJobs,
        int inactiveJobs,
        String lastExecution) {

    public static JobCollection of(List<ScheduledJob> jobs) {
        return withCounters(jobs, null, null, null, null);
    }

    public static JobCollection withCounters(List<ScheduledJob> jobs, Integer total, Integer active,
                                             Integer inactive, String lastExecution) {
        List<ScheduledJob> copy = List.copyOf(jobs);
        int computedActive = (int) copy.stream().filter(ScheduledJob::isActive).count();
        return new JobCollection(
                copy,
                total != null ? total : copy.size(),
                active != null ? active : computedActive,
                inactive != null ? inactive : copy.size() - computedActive,
                lastExecution);
    }

    public static JobCollection empty() {
        return of(List.of());
    }

    public Optional<ScheduledJob> findById(long id) {
        return jobs.stream()
                .filter(job -> job.getId() != null && job.getId() == id)
                .findFirst();
    }
}
