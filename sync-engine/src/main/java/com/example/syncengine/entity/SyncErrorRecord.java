package com.example.syncengine.entity;

import com.example.syncengine.error.ErrorCategory;
import com.example.syncengine.error.ErrorSeverity;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A classified failure, kept for the error summary window.
 */
@Entity
@Table(name = "sync_errors", indexes = {
        @Index(name = "idx_sync_errors_user_occurred", columnList = "user_id,occurred_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncErrorRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "service", length = 20)
    private String service;

    @Column(name = "stage", nullable = false, length = 50)
    private String stage;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 20)
    private ErrorCategory category;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 20)
    private ErrorSeverity severity;

    @Column(name = "retryable", nullable = false)
    private boolean retryable;

    @Column(name = "session_id")
    private UUID sessionId;

    @Column(name = "batch_id", length = 64)
    private String batchId;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;
}
