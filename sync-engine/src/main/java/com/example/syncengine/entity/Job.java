package com.example.syncengine.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * Persisted unit of work.
 *
 * State transitions are never applied through dirty checking; the repository
 * performs them as conditional updates so a row can only move out of a state it
 * is still in.
 */
@Entity
@Table(name = "jobs", indexes = {
        @Index(name = "idx_jobs_user_status_created", columnList = "user_id,status,created_at"),
        @Index(name = "idx_jobs_batch_id", columnList = "batch_id"),
        @Index(name = "idx_jobs_status_updated", columnList = "status,updated_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Job extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 30)
    private JobKind kind;

    /**
     * JSON document interpreted only by the handler registered for {@link #kind}.
     */
    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "batch_id", length = 64)
    private String batchId;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    /**
     * JSON result. Holds the error classification once the job fails terminally.
     */
    @Column(name = "result", columnDefinition = "TEXT")
    private String result;

    public static Job queued(UUID userId, JobKind kind, String payload, String batchId) {
        return Job.builder()
                .userId(userId)
                .kind(kind)
                .payload(payload)
                .batchId(batchId)
                .status(JobStatus.QUEUED)
                .attempts(0)
                .build();
    }
}
