package com.example.syncengine.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One end-to-end import and normalize run, polled by clients for progress.
 *
 * Invariant: completedAt is null exactly while the status is active.
 * Both the progress path and the cancellation path are guarded by {@link #version}.
 */
@Entity
@Table(name = "sync_sessions", indexes = {
        @Index(name = "idx_sync_sessions_user_service", columnList = "user_id,service"),
        @Index(name = "idx_sync_sessions_user_status", columnList = "user_id,status"),
        @Index(name = "idx_sync_sessions_created_at", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncSession extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "service", nullable = false, length = 20)
    private ServiceType service;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SessionStatus status;

    @Column(name = "progress_percentage", nullable = false)
    private double progressPercentage;

    @Column(name = "current_step", length = 500)
    private String currentStep;

    @Column(name = "total_items", nullable = false)
    private int totalItems;

    @Column(name = "imported_items", nullable = false)
    private int importedItems;

    @Column(name = "processed_items", nullable = false)
    private int processedItems;

    @Column(name = "failed_items", nullable = false)
    private int failedItems;

    @Column(name = "error_details", columnDefinition = "TEXT")
    private String errorDetails;

    @Column(name = "preferences", columnDefinition = "TEXT")
    private String preferences;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public boolean isActive() {
        return status != null && !status.isTerminal();
    }

    /**
     * Move to a new status. The first transition into a terminal status stamps completedAt.
     *
     * @throws IllegalStateException when the session is already terminal
     */
    public void transitionTo(SessionStatus next, Instant now) {
        if (!isActive()) {
            throw new IllegalStateException("Session " + id + " is already " + status);
        }
        this.status = next;
        if (next.isTerminal()) {
            this.completedAt = now;
        }
    }
}
