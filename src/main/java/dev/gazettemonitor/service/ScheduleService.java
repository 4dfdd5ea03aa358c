package dev.gazettemonitor.service;

import dev.gazettemonitor.client.MonitorApiClient;
import dev.gazettemonitor.exception.NotFoundException;
import dev.gazettemonitor.metrics.MonitorMetrics;
import dev.gazettemonitor.model.JobCollection;
import dev.gazettemonitor.model.ScheduledJob;
import dev.gazettemonitor.model.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Create, update, toggle and delete scheduled jobs.
 *
 * <p>Every mutation is refused while a manual search runs and requires a session.
 * Each one is a single request awaited before the next; nothing is batched or retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleService {

    private final MonitorApiClient apiClient;
    private final ScheduleValidator validator;
    private final ExecutionMutex executionMutex;
    private final SessionGuard sessionGuard;
    private final AuditService auditService;
    private final MonitorMetrics metrics;
    private final Clock clock;

    public Mono<JobCollection> list() {
        return Mono.defer(() -> {
            sessionGuard.requireSession();
            return apiClient.listJobs();
        }).doOnNext(jobs -> log.debug("Loaded {} jobs ({} active)", jobs.totalJobs(), jobs.activeJobs()));
    }

    /**
     * Validate and create a job.
     *
     * @return the normalized job, with the backend-assigned id when the backend reports one
     */
    public Mono<ScheduledJob> create(ScheduledJob draft) {
        return Mono.defer(() -> {
            Session session = beginMutation("create a schedule");
            ScheduledJob normalized = validator.normalize(draft).withId(null);
            return apiClient.createJob(normalized)
                    .map(created -> stamp("create", created, session));
        });
    }

    public Mono<ScheduledJob> update(long id, ScheduledJob draft) {
        return Mono.defer(() -> {
            Session session = beginMutation("update a schedule");
            ScheduledJob normalized = validator.normalize(draft).withId(id);
            return apiClient.updateJob(normalized)
                    .then(Mono.fromCallable(() -> stamp("update", normalized, session)));
        });
    }

    /**
     * Flip {@code active} on the job as currently stored. Reads first, so two sequential
     * calls restore the original state.
     */
    public Mono<ScheduledJob> toggle(long id) {
        return Mono.defer(() -> {
            Session session = beginMutation("toggle a schedule");
            return apiClient.listJobs()
                    .flatMap(jobs -> Mono.justOrEmpty(jobs.findById(id)))
                    .switchIfEmpty(Mono.error(() -> new NotFoundException("Schedule " + id + " does not exist")))
                    .flatMap(current -> {
                        ScheduledJob flipped = current.withActive(!current.isActive());
                        return apiClient.updateJob(flipped)
                                .then(Mono.fromCallable(() -> stamp("toggle", flipped, session)));
                    });
        });
    }

    /**
     * Irreversibly delete a job.
     *
     * @throws NotFoundException (as an error signal) when the id does not exist
     */
    public Mono<Void> delete(long id) {
        return Mono.defer(() -> {
            Session session = beginMutation("delete a schedule");
            return apiClient.deleteJob(id)
                    .then(Mono.fromRunnable(() -> {
                        audit("delete", id, session.username(), clock.instant());
                        metrics.recordScheduleMutation("delete");
                        log.info("Deleted schedule {}", id);
                    }));
        });
    }

    private Session beginMutation(String operation) {
        executionMutex.ensureIdle(operation);
        return sessionGuard.requireSession();
    }

    /**
     * The backend has already committed the mutation; a failed local write must not turn it into an error.
     */
    private void audit(String action, Long jobId, String modifiedBy, Instant at) {
        try {
            auditService.record(action, jobId, modifiedBy, at);
        } catch (DataAccessException e) {
            log.warn("Could not record {} of schedule {} in the audit trail: {}", action, jobId, e.getMessage());
        }
    }

    private ScheduledJob stamp(String action, ScheduledJob job, Session session) {
        Instant now = clock.instant();
        ScheduledJob stamped = job.toBuilder()
                .lastModifiedBy(session.username())
                .lastModifiedAt(now)
                .build();
        audit(action, stamped.getId(), session.username(), now);
        metrics.recordScheduleMutation(action);
        log.info("Schedule {} ({}): terms={}, trigger={}, active={}", stamped.getId(), action,
                stamped.getSearchTerms(), stamped.getTriggerTime(), stamped.isActive());
        return stamped;
    }
}
