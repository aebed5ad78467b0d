package com.example.syncengine.session;

import com.example.syncengine.dto.response.SessionProgressResponse;
import com.example.syncengine.entity.ServiceType;
import com.example.syncengine.entity.SessionStatus;
import com.example.syncengine.entity.SyncSession;
import com.example.syncengine.error.ErrorClassification;
import com.example.syncengine.error.ErrorStage;
import com.example.syncengine.exception.InvalidProgressUpdateException;
import com.example.syncengine.exception.SessionNotCancellableException;
import com.example.syncengine.exception.SessionNotFoundException;
import com.example.syncengine.metrics.SyncMetrics;
import com.example.syncengine.repository.SyncSessionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the lifecycle of sync sessions.
 *
 * CRITICAL DESIGN:
 * - A session is finalized exactly once. Updates to a terminal session are ignored
 *   and reported as not applied
 * - Progress writes are read-modify-write under the entity version
 * - Cancellation is a conditional update on the active statuses that bumps the version,
 *   so a completion and a cancellation cannot both win
 * - Sessions of other users are reported as not found
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncSessionTracker {

    private static final int MAX_LIST_LIMIT = 100;
    private static final int MAX_STEP_LENGTH = 500;

    private final SyncSessionRepository sessionRepository;
    private final ObjectMapper objectMapper;
    private final SyncMetrics syncMetrics;
    private final Clock clock;

    @Transactional
    public UUID createSession(UUID userId, ServiceType service, Map<String, Object> preferences) {
        SyncSession session = SyncSession.builder()
                .userId(userId)
                .service(service)
                .status(SessionStatus.STARTED)
                .progressPercentage(0)
                .currentStep("Initializing " + service.getDisplayName() + " sync...")
                .preferences(preferences == null || preferences.isEmpty() ? null : toJson(preferences))
                .startedAt(Instant.now(clock))
                .build();
        SyncSession saved = sessionRepository.save(session);
        log.info("Created sync session: sessionId={}, userId={}, service={}",
                saved.getId(), userId, service.getPathValue());
        return saved.getId();
    }

    /**
     * Apply a partial update. The percentage is clamped to [0, 100]; negative
     * counters and a NaN percentage reject the whole update.
     *
     * @return false when the session is already terminal and nothing changed
     * @throws InvalidProgressUpdateException for invalid values
     * @throws SessionNotFoundException       for unknown sessions
     */
    @Transactional
    public boolean updateProgress(UUID sessionId, SyncProgressUpdate update) {
        validate(update);
        SyncSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (!session.isActive()) {
            log.debug("Ignoring progress for finished sessionId={} in status={}", sessionId, session.getStatus());
            return false;
        }

        Instant now = Instant.now(clock);
        if (update.getProgressPercentage() != null) {
            session.setProgressPercentage(clamp(update.getProgressPercentage()));
        }
        if (update.getCurrentStep() != null) {
            session.setCurrentStep(truncate(update.getCurrentStep()));
        }
        if (update.getTotalItems() != null) {
            session.setTotalItems(update.getTotalItems());
        }
        if (update.getImportedItems() != null) {
            session.setImportedItems(update.getImportedItems());
        }
        if (update.getProcessedItems() != null) {
            session.setProcessedItems(update.getProcessedItems());
        }
        if (update.getFailedItems() != null) {
            session.setFailedItems(update.getFailedItems());
        }
        if (update.getStatus() != null && update.getStatus() != session.getStatus()) {
            session.transitionTo(update.getStatus(), now);
            if (update.getStatus().isTerminal()) {
                syncMetrics.recordSessionFinished(session.getService(), update.getStatus());
            }
        }
        return true;
    }

    /**
     * Finalize as failed. Accumulated counters are kept; errorDetails carries the classification.
     *
     * @return false when the session had already finished
     */
    @Transactional
    public boolean markFailed(UUID sessionId, ErrorClassification classification, ErrorStage stage) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("category", classification.category().getWireName());
        details.put("severity", classification.severity().getWireName());
        details.put("message", classification.userMessage());
        details.put("technicalMessage", classification.technicalMessage());
        details.put("stage", stage.getWireName());
        details.put("retryable", classification.retryable());
        details.put("timestamp", Instant.now(clock).toString());

        SyncSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (!session.isActive()) {
            log.info("Session {} already {}, not marking failed", sessionId, session.getStatus());
            return false;
        }
        session.setErrorDetails(toJson(details));
        session.setCurrentStep(session.getService().getDisplayName() + " sync failed");
        session.transitionTo(SessionStatus.FAILED, Instant.now(clock));
        syncMetrics.recordSessionFinished(session.getService(), SessionStatus.FAILED);
        log.warn("⚠️ Sync session failed: sessionId={}, stage={}, category={}",
                sessionId, stage.getWireName(), classification.category().getWireName());
        return true;
    }

    /**
     * Finalize as completed at 100%, applying the final counters.
     *
     * @return false when the session had already finished
     */
    @Transactional
    public boolean markCompleted(UUID sessionId, SyncProgressUpdate finalCounts) {
        SyncProgressUpdate update = SyncProgressUpdate.builder()
                .status(SessionStatus.COMPLETED)
                .progressPercentage(100.0)
                .currentStep(finalCounts.getCurrentStep() != null ? finalCounts.getCurrentStep() : "Sync completed")
                .totalItems(finalCounts.getTotalItems())
                .importedItems(finalCounts.getImportedItems())
                .processedItems(finalCounts.getProcessedItems())
                .failedItems(finalCounts.getFailedItems())
                .build();
        boolean applied = updateProgress(sessionId, update);
        if (applied) {
            log.info("✅ Sync session completed: sessionId={}", sessionId);
        }
        return applied;
    }

    /**
     * @throws SessionNotFoundException      when missing or owned by another user
     * @throws SessionNotCancellableException when the session already finished
     */
    @Transactional
    public SessionProgressResponse cancelSession(UUID sessionId, UUID userId) {
        int updated = sessionRepository.cancelIfActive(sessionId, userId, SessionStatus.ACTIVE,
                "Sync cancelled by user", Instant.now(clock));
        SyncSession session = sessionRepository.findByIdAndUserId(sessionId, userId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (updated == 0) {
            throw new SessionNotCancellableException(sessionId, session.getStatus());
        }
        syncMetrics.recordSessionFinished(session.getService(), SessionStatus.CANCELLED);
        log.info("Sync session cancelled: sessionId={}, userId={}", sessionId, userId);
        return toResponse(session, Instant.now(clock));
    }

    @Transactional(readOnly = true)
    public SessionProgressResponse getProgressData(UUID sessionId, UUID userId) {
        SyncSession session = sessionRepository.findByIdAndUserId(sessionId, userId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        return toResponse(session, Instant.now(clock));
    }

    @Transactional(readOnly = true)
    public Optional<SessionStatus> findStatus(UUID sessionId) {
        return sessionRepository.findById(sessionId).map(SyncSession::getStatus);
    }

    @Transactional(readOnly = true)
    public List<SessionProgressResponse> listSessions(UUID userId, ServiceType service, SessionStatus status,
                                                      int limit) {
        Instant now = Instant.now(clock);
        int pageSize = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        return sessionRepository.findForUser(userId, service, status, PageRequest.of(0, pageSize)).stream()
                .map(session -> toResponse(session, now))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<SessionProgressResponse> getActiveSessions(UUID userId) {
        Instant now = Instant.now(clock);
        return sessionRepository.findByUserIdAndStatusInOrderByStartedAtDesc(userId, SessionStatus.ACTIVE).stream()
                .map(session -> toResponse(session, now))
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<SessionProgressResponse> getLatestSession(UUID userId, ServiceType service) {
        return sessionRepository.findFirstByUserIdAndServiceOrderByStartedAtDesc(userId, service)
                .map(session -> toResponse(session, Instant.now(clock)));
    }

    /**
     * Delete sessions created more than {@code days} days ago, whatever their status.
     *
     * @return number of deleted sessions
     */
    @Transactional
    public int cleanupOldSessions(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("Retention must be at least one day, got " + days);
        }
        Instant cutoff = Instant.now(clock).minus(Duration.ofDays(days));
        int deleted = sessionRepository.deleteCreatedBefore(cutoff);
        log.info("Deleted {} sync session(s) created before {}", deleted, cutoff);
        return deleted;
    }

    private SessionProgressResponse toResponse(SyncSession session, Instant now) {
        return SessionProgressResponse.builder()
                .sessionId(session.getId())
                .service(session.getService().getPathValue())
                .status(session.getStatus())
                .progressPercentage(session.getProgressPercentage())
                .currentStep(session.getCurrentStep())
                .totalItems(session.getTotalItems())
                .importedItems(session.getImportedItems())
                .processedItems(session.getProcessedItems())
                .failedItems(session.getFailedItems())
                .errorDetails(readDetails(session))
                .startedAt(session.getStartedAt())
                .completedAt(session.getCompletedAt())
                .estimate(estimate(session, now))
                .build();
    }

    static SessionProgressResponse.TimeEstimate estimate(SyncSession session, Instant now) {
        SessionStatus status = session.getStatus();
        double percentage = session.getProgressPercentage();
        if ((status != SessionStatus.IMPORTING && status != SessionStatus.PROCESSING)
                || percentage <= 0 || percentage >= 100 || session.getStartedAt() == null) {
            return null;
        }
        long elapsed = Math.max(0, Duration.between(session.getStartedAt(), now).toMillis());
        long estimatedTotal = Math.round(elapsed / percentage * 100);
        return new SessionProgressResponse.TimeEstimate(elapsed, estimatedTotal, Math.max(0, estimatedTotal - elapsed));
    }

    private static void validate(SyncProgressUpdate update) {
        if (update == null) {
            throw new InvalidProgressUpdateException("Progress update must not be null");
        }
        if (update.getProgressPercentage() != null && update.getProgressPercentage().isNaN()) {
            throw new InvalidProgressUpdateException("progressPercentage must be a number");
        }
        requireNonNegative("totalItems", update.getTotalItems());
        requireNonNegative("importedItems", update.getImportedItems());
        requireNonNegative("processedItems", update.getProcessedItems());
        requireNonNegative("failedItems", update.getFailedItems());
    }

    private static void requireNonNegative(String field, Integer value) {
        if (value != null && value < 0) {
            throw new InvalidProgressUpdateException(field + " must be a non-negative integer, got " + value);
        }
    }

    private static double clamp(double percentage) {
        return Math.max(0, Math.min(100, percentage));
    }

    private static String truncate(String step) {
        return step.length() <= MAX_STEP_LENGTH ? step : step.substring(0, MAX_STEP_LENGTH);
    }

    private Map<String, Object> readDetails(SyncSession session) {
        if (session.getErrorDetails() == null) {
            return null;
        }
        try {
            return objectMapper.readValue(session.getErrorDetails(),
                    objectMapper.getTypeFactory().constructMapType(Map.class, String.class, Object.class));
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Unreadable errorDetails on sessionId={}: {}", session.getId(), e.getOriginalMessage());
            return Map.of("message", session.getErrorDetails());
        }
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Session document is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
