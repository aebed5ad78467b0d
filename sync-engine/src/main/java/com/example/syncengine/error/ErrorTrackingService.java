package com.example.syncengine.error;

import com.example.syncengine.entity.ServiceType;
import com.example.syncengine.entity.SyncErrorRecord;
import com.example.syncengine.repository.SyncErrorRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Persists classified failures for the error summary.
 *
 * CRITICAL DESIGN:
 * - Recording is best effort: a failed insert is logged and never replaces the
 *   failure the caller is handling
 * - The insert is flushed inside its own transaction, so constraint violations
 *   surface here and not at a later commit
 */
@Service
@Slf4j
public class ErrorTrackingService {

    private static final int MAX_MESSAGE_LENGTH = 2000;

    private final SyncErrorRecordRepository errorRecordRepository;
    private final TransactionTemplate recordTransaction;
    private final Clock clock;

    public ErrorTrackingService(SyncErrorRecordRepository errorRecordRepository,
                                PlatformTransactionManager transactionManager,
                                Clock clock) {
        this.errorRecordRepository = errorRecordRepository;
        this.recordTransaction = new TransactionTemplate(transactionManager);
        this.recordTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * @return true when the record was stored
     */
    public boolean record(UUID userId,
                       ServiceType service,
                       ErrorStage stage,
                       ErrorClassification classification,
                       UUID sessionId,
                       String batchId) {
        if (stage == null || classification == null) {
            log.warn("⚠️ Skipping error record without stage or classification for userId={}", userId);
            return false;
        }
        SyncErrorRecord record = SyncErrorRecord.builder()
                .userId(userId)
                .service(service == null ? null : service.getPathValue())
                .stage(stage.getWireName())
                .message(truncate(classification.technicalMessage()))
                .category(classification.category())
                .severity(classification.severity())
                .retryable(classification.retryable())
                .sessionId(sessionId)
                .batchId(batchId)
                .occurredAt(Instant.now(clock))
                .build();
        try {
            recordTransaction.executeWithoutResult(status -> errorRecordRepository.saveAndFlush(record));
            log.debug("Recorded {} error: userId={}, stage={}, severity={}",
                    classification.category().getWireName(), userId, stage.getWireName(),
                    classification.severity().getWireName());
            return true;
        } catch (RuntimeException e) {
            log.warn("⚠️ Failed to record error for userId={}, stage={}: {}",
                    userId, stage.getWireName(), e.getMessage());
            return false;
        }
    }

    /**
     * @return number of deleted records
     */
    @Transactional
    public int purgeOlderThan(int days) {
        Instant cutoff = Instant.now(clock).minus(Duration.ofDays(days));
        int deleted = errorRecordRepository.deleteOlderThan(cutoff);
        log.info("Deleted {} error record(s) older than {}", deleted, cutoff);
        return deleted;
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH);
    }
}
