package dev.gazettemonitor.service;

import dev.gazettemonitor.entity.ScheduleAudit;
import dev.gazettemonitor.repository.ScheduleAuditRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Local trail of schedule mutations. Advisory: never consulted for concurrency control.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final ScheduleAuditRepository repository;
    private final Clock clock;

    @Transactional
    public void record(String action, Long jobId, String modifiedBy, Instant modifiedAt) {
        repository.save(ScheduleAudit.builder()
                .jobId(jobId)
                .action(action)
                .modifiedBy(modifiedBy)
                .modifiedAt(LocalDateTime.ofInstant(modifiedAt, clock.getZone()))
                .build());
        log.debug("Audit: {} job {} by {}", action, jobId, modifiedBy);
    }

    public List<ScheduleAudit> historyOf(long jobId) {
        return repository.findByJobIdOrderByModifiedAtDesc(jobId);
    }

    @Transactional
    public void cleanupOlderThan(int daysToKeep) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(daysToKeep);
        repository.deleteByModifiedAtBefore(cutoff);
        log.info("Cleaned up audit entries older than {} days", daysToKeep);
    }
}
