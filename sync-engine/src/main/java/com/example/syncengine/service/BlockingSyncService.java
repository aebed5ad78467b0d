package com.example.syncengine.service;

import com.example.syncengine.client.provider.ProviderSyncResult;
import com.example.syncengine.dto.request.SyncRunRequest;
import com.example.syncengine.dto.response.SyncRunResponse;
import com.example.syncengine.entity.ServiceType;
import com.example.syncengine.entity.SessionStatus;
import com.example.syncengine.error.ClassifiedFailure;
import com.example.syncengine.error.ErrorClassification;
import com.example.syncengine.error.ErrorClassifier;
import com.example.syncengine.error.ErrorStage;
import com.example.syncengine.error.ErrorTrackingService;
import com.example.syncengine.exception.ReauthorizationRequiredException;
import com.example.syncengine.exception.SyncFailedException;
import com.example.syncengine.exception.TokenRefreshFailedException;
import com.example.syncengine.job.JobRunResult;
import com.example.syncengine.job.JobRunner;
import com.example.syncengine.session.ProgressChannel;
import com.example.syncengine.session.SyncProgressEvent;
import com.example.syncengine.session.SyncProgressUpdate;
import com.example.syncengine.session.SyncSessionTracker;
import com.example.syncengine.token.TokenManager;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Client-facing sync: import, then normalize inline, reporting progress on a session.
 *
 * CRITICAL DESIGN:
 * - Runs OUTSIDE any transaction; every write goes through a transactional collaborator
 * - Missing OAuth configuration or integration fails before a session exists
 * - Progress is published on a {@link ProgressChannel}; this class never writes the session row
 *   except for the final transition
 * - Cancellation is checked between runner rounds; an in-flight provider call is not interrupted
 * - Runner rounds claim only this run's batch
 * - Any failure after the session exists finalizes it as failed with its accumulated counters intact
 */
@Service
@Slf4j
public class BlockingSyncService {

    static final double IMPORT_STARTED_PERCENT = 5;
    static final double PROCESSING_STARTED_PERCENT = 75;

    private final TokenManager tokenManager;
    private final ProviderImportService providerImportService;
    private final JobRunner jobRunner;
    private final SyncSessionTracker sessionTracker;
    private final ProgressChannel progressChannel;
    private final ErrorClassifier errorClassifier;
    private final ErrorTrackingService errorTrackingService;
    private final int batchSize;
    private final int maxRounds;

    public BlockingSyncService(TokenManager tokenManager,
                               ProviderImportService providerImportService,
                               JobRunner jobRunner,
                               SyncSessionTracker sessionTracker,
                               ProgressChannel progressChannel,
                               ErrorClassifier errorClassifier,
                               ErrorTrackingService errorTrackingService,
                               @Value("${sync.jobs.batch-size:10}") int batchSize,
                               @Value("${sync.jobs.max-rounds:10}") int maxRounds) {
        this.tokenManager = tokenManager;
        this.providerImportService = providerImportService;
        this.jobRunner = jobRunner;
        this.sessionTracker = sessionTracker;
        this.progressChannel = progressChannel;
        this.errorClassifier = errorClassifier;
        this.errorTrackingService = errorTrackingService;
        this.batchSize = batchSize;
        this.maxRounds = maxRounds;
    }

    /**
     * @throws SyncFailedException when the import or processing failed; the session is marked failed
     */
    public SyncRunResponse runBlockingSync(UUID userId, ServiceType service, SyncRunRequest request) {
        tokenManager.requireOAuthConfigured();
        tokenManager.requireIntegration(userId, service);

        SyncRunRequest options = request == null ? new SyncRunRequest() : request;
        String batchId = UUID.randomUUID().toString();
        UUID sessionId = sessionTracker.createSession(userId, service, options.getPreferences());

        MDC.put("sessionId", sessionId.toString());
        MDC.put("batchId", batchId);
        try {
            log.info("Starting blocking {} sync for userId={}", service.getPathValue(), userId);
            return run(userId, service, options, sessionId, batchId);
        } finally {
            MDC.remove("sessionId");
            MDC.remove("batchId");
        }
    }

    private SyncRunResponse run(UUID userId, ServiceType service, SyncRunRequest options,
                                UUID sessionId, String batchId) {
        ProviderSyncResult imported;
        try {
            publish(sessionId, SyncProgressUpdate.builder()
                    .status(SessionStatus.IMPORTING)
                    .progressPercentage(IMPORT_STARTED_PERCENT)
                    .currentStep("Discovering new " + service.getItemNoun() + "...")
                    .build());
            imported = providerImportService.importItems(userId, service, batchId, options.toProviderOptions());
        } catch (ReauthorizationRequiredException | TokenRefreshFailedException e) {
            // already recorded by the token manager
            throw fail(userId, service, sessionId, batchId, e, ErrorStage.TOKEN_REFRESH, false);
        } catch (RuntimeException e) {
            throw fail(userId, service, sessionId, batchId, e, ErrorStage.INGESTION, true);
        }
        if (!imported.success()) {
            throw fail(userId, service, sessionId, batchId, imported.error(), ErrorStage.INGESTION, true);
        }

        try {
            return process(userId, service, sessionId, batchId, imported);
        } catch (RuntimeException e) {
            throw fail(userId, service, sessionId, batchId, e, ErrorStage.PROCESSING, true);
        }
    }

    /**
     * Normalize the imported items of this batch. Queued jobs of other batches are left
     * to the background drain.
     */
    private SyncRunResponse process(UUID userId, ServiceType service, UUID sessionId, String batchId,
                                    ProviderSyncResult imported) {
        int synced = imported.itemsSynced();
        if (isCancelled(sessionId)) {
            return cancelled(sessionId, service, synced, 0, 0, batchId);
        }
        publish(sessionId, SyncProgressUpdate.builder()
                .status(SessionStatus.PROCESSING)
                .progressPercentage(PROCESSING_STARTED_PERCENT)
                .currentStep("Processing " + synced + " " + service.getItemNoun() + "...")
                .totalItems(synced)
                .importedItems(synced)
                .build());

        int processed = 0;
        int failed = 0;
        List<UUID> normalizeJobs = providerImportService.enqueueNormalization(userId, service, batchId, imported);
        int expected = Math.max(1, normalizeJobs.size());

        for (int round = 0; round < maxRounds && !normalizeJobs.isEmpty(); round++) {
            if (isCancelled(sessionId)) {
                log.info("Session cancelled after {} runner round(s), stopping", round);
                return cancelled(sessionId, service, synced, processed, failed, batchId);
            }
            JobRunResult result = jobRunner.processUserJobs(userId, batchId, batchSize);
            if (result.processed() == 0) {
                break;
            }
            processed += result.succeeded();
            failed += (int) result.terminalFailures();

            double percent = PROCESSING_STARTED_PERCENT
                    + (100 - PROCESSING_STARTED_PERCENT) * Math.min(1.0, (double) (processed + failed) / expected);
            publish(sessionId, SyncProgressUpdate.builder()
                    .progressPercentage(Math.min(99.0, percent))
                    .currentStep("Normalized " + processed + " of " + normalizeJobs.size() + " batch(es)...")
                    .processedItems(processed)
                    .failedItems(failed)
                    .build());
        }

        String message = synced > 0
                ? "Successfully synced " + synced + " " + service.getItemNoun()
                        + " and processed " + processed + " normalizations"
                : service.getDisplayName() + " sync completed - no new " + service.getItemNoun() + " found";

        SyncProgressUpdate finalCounts = SyncProgressUpdate.builder()
                .currentStep(message)
                .totalItems(synced)
                .importedItems(synced)
                .processedItems(processed)
                .failedItems(failed)
                .build();
        if (!complete(sessionId, finalCounts)) {
            return cancelled(sessionId, service, synced, processed, failed, batchId);
        }

        log.info("✅ Blocking {} sync finished: synced={}, processed={}, failed={}",
                service.getPathValue(), synced, processed, failed);
        return new SyncRunResponse(sessionId, SessionStatus.COMPLETED, message,
                new SyncRunResponse.Stats(synced, processed, failed, batchId));
    }

    private void publish(UUID sessionId, SyncProgressUpdate update) {
        progressChannel.publish(new SyncProgressEvent(sessionId, update));
    }

    private boolean isCancelled(UUID sessionId) {
        return sessionTracker.findStatus(sessionId)
                .map(status -> status == SessionStatus.CANCELLED)
                .orElse(true);
    }

    /**
     * @return false when a concurrent cancellation finalized the session first
     */
    private boolean complete(UUID sessionId, SyncProgressUpdate finalCounts) {
        try {
            return sessionTracker.markCompleted(sessionId, finalCounts);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.info("Session changed while completing, re-reading sessionId={}", sessionId);
            return sessionTracker.markCompleted(sessionId, finalCounts);
        }
    }

    private SyncRunResponse cancelled(UUID sessionId, ServiceType service, int synced, int processed,
                                      int failed, String batchId) {
        log.info("Blocking {} sync stopped by cancellation: synced={}, processed={}",
                service.getPathValue(), synced, processed);
        return new SyncRunResponse(sessionId, SessionStatus.CANCELLED,
                service.getDisplayName() + " sync cancelled",
                new SyncRunResponse.Stats(synced, processed, failed, batchId));
    }

    /**
     * The caller still receives the original failure when the session row cannot be written.
     */
    private void markFailed(UUID sessionId, ErrorClassification classification, ErrorStage stage) {
        try {
            try {
                sessionTracker.markFailed(sessionId, classification, stage);
            } catch (ObjectOptimisticLockingFailureException e) {
                sessionTracker.markFailed(sessionId, classification, stage);
            }
        } catch (RuntimeException e) {
            log.error("❌ Could not mark session {} failed at stage={}: {}",
                    sessionId, stage.getWireName(), e.getMessage(), e);
        }
    }

    private SyncFailedException fail(UUID userId, ServiceType service, UUID sessionId, String batchId,
                                     RuntimeException cause, ErrorStage stage, boolean record) {
        ErrorClassification classification = errorClassifier.classify(cause);
        markFailed(sessionId, classification, stage);
        if (record) {
            errorTrackingService.record(userId, service, stage, classification, sessionId, batchId);
        }

        log.error("❌ Blocking {} sync failed at stage={}: category={}, retryable={}, message={}",
                service.getPathValue(), stage.getWireName(), classification.category().getWireName(),
                classification.retryable(), classification.technicalMessage());
        String message = cause instanceof ClassifiedFailure
                ? cause.getMessage()
                : service.getDisplayName() + " sync failed: " + classification.userMessage();
        return new SyncFailedException(sessionId, message, classification, cause);
    }
}
