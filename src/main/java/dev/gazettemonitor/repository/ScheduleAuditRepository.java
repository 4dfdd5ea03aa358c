package dev.gazettemonitor.repository;

import dev.gazettemonitor.entity.ScheduleAudit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for the local schedule mutation trail.
 */
@Repository
public interface ScheduleAuditRepository extends JpaRepository<ScheduleAudit, Long> {

    /**
     * Mutations of one job, newest first.
     */
    List<ScheduleAudit> findByJobIdOrderByModifiedAtDesc(Long jobId);

    /**
     * Delete entries older than a certain date (for cleanup).
     */
    void deleteByModifiedAtBefore(LocalDateTime date);
}
