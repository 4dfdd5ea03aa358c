package dev.gazettemonitor.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One successful schedule mutation issued from this client.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "schedule_audit", indexes = {
        @Index(name = "idx_audit_job", columnList = "jobId"),
        @Index(name = "idx_audit_modified_at", columnList = "modifiedAt")
})
public class ScheduleAudit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long jobId;

    @Column(nullable = false, length = 16)
    private String action;

    @Column(nullable = false)
    private String modifiedBy;

    @Column(nullable = false)
    private LocalDateTime modifiedAt;
}
