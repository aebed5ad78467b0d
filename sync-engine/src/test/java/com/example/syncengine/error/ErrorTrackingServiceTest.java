package com.example.syncengine.error;

import com.example.syncengine.config.JpaConfig;
import com.example.syncengine.entity.ServiceType;
import com.example.syncengine.repository.SyncErrorRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Error records are written in their own committed transaction.
 *
 * Scenarios:
 * 1. A valid failure is stored with its classification
 * 2. A row the database rejects is logged, never thrown to the caller
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({JpaConfig.class, ErrorTrackingService.class})
class ErrorTrackingServiceTest {

    @Autowired
    private ErrorTrackingService errorTrackingService;
    @Autowired
    private SyncErrorRecordRepository errorRecordRepository;

    private final ErrorClassifier classifier = new ErrorClassifier();

    @BeforeEach
    void setUp() {
        errorRecordRepository.deleteAll();
    }

    @Test
    void record_storesClassification() {
        UUID userId = UUID.randomUUID();
        ErrorClassification classification = classifier.classify("Quota exceeded", 429, null);

        boolean stored = errorTrackingService.record(userId, ServiceType.GMAIL, ErrorStage.INGESTION,
                classification, null, "batch-1");

        assertThat(stored).isTrue();
        assertThat(errorRecordRepository.findAll()).singleElement().satisfies(saved -> {
            assertThat(saved.getUserId()).isEqualTo(userId);
            assertThat(saved.getService()).isEqualTo("gmail");
            assertThat(saved.getCategory()).isEqualTo(ErrorCategory.RATE_LIMIT);
            assertThat(saved.getBatchId()).isEqualTo("batch-1");
        });
    }

    /**
     * Scenario: the insert violates a NOT NULL constraint.
     * Expected: record returns false and the caller keeps handling its own failure.
     */
    @Test
    void rejectedInsert_isNotThrown() {
        ErrorClassification classification = classifier.classify("backend unavailable", 503, null);

        assertThatCode(() -> errorTrackingService.record(null, null, ErrorStage.PROCESSING,
                classification, null, null))
                .doesNotThrowAnyException();
        assertThat(errorTrackingService.record(null, null, ErrorStage.PROCESSING, classification, null, null))
                .isFalse();
        assertThat(errorRecordRepository.count()).isZero();
    }

    @Test
    void missingStage_isSkipped() {
        assertThat(errorTrackingService.record(UUID.randomUUID(), ServiceType.DRIVE, null,
                classifier.classify(null), null, null)).isFalse();
        assertThat(errorRecordRepository.count()).isZero();
    }
}
