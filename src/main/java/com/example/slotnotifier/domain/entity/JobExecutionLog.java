package com.example.slotnotifier.domain.entity;

import com.example.slotnotifier.domain.enums.FireOutcome;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Execution history of notification jobs, one row per fire.
 */
@Entity
@Table(name = "job_execution_logs", indexes = {
        @Index(name = "idx_exec_log_job_id", columnList = "job_id"),
        @Index(name = "idx_exec_log_started_at", columnList = "started_at"),
        @Index(name = "idx_exec_log_outcome", columnList = "outcome")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobExecutionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false, length = 120)
    private String jobId;

    @Column(name = "user_identity", nullable = false, length = 100)
    private String userIdentity;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 40)
    private FireOutcome outcome;

    /**
     * Instant the fire was due
     */
    @Column(name = "scheduled_for")
    private Instant scheduledFor;

    @Column(name = "matched_slot_count")
    private Integer matchedSlotCount;

    @Column(name = "delivery_attempts")
    private Integer deliveryAttempts;

    @Column(name = "executor_instance", length = 100)
    private String executorInstance;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "error_type", length = 100)
    private String errorType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }

    public void complete(FireOutcome outcome, Instant completedAt) {
        this.outcome = outcome;
        this.completedAt = completedAt;
        if (startedAt != null) {
            this.durationMs = completedAt.toEpochMilli() - startedAt.toEpochMilli();
        }
    }
}
