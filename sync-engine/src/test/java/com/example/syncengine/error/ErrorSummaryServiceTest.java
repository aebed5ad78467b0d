package com.example.syncengine.error;

import com.example.syncengine.dto.response.ErrorSummaryResponse;
import com.example.syncengine.entity.SyncErrorRecord;
import com.example.syncengine.repository.SyncErrorRecordRepository;
import com.example.syncengine.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ErrorSummaryServiceTest {

    private static final UUID USER_ID = UUID.randomUUID();

    @Mock
    private SyncErrorRecordRepository errorRecordRepository;

    private MutableClock clock;
    private ErrorSummaryService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        service = new ErrorSummaryService(errorRecordRepository, new ErrorClassifier(), clock);
    }

    @Test
    void noErrors_isHealthy() {
        stubWindow(24, List.of());

        ErrorSummaryResponse summary = service.getErrorSummary(USER_ID, 24, null, null, null);

        assertThat(summary.totalErrors()).isZero();
        assertThat(summary.urgencyScore().score()).isZero();
        assertThat(summary.urgencyScore().level()).isEqualTo(UrgencyLevel.LOW);
        assertThat(summary.recommendations()).containsExactly("No recent errors - system is healthy");
        assertThat(summary.errorPatterns()).isEmpty();
    }

    /**
     * Scenario: three revoked refresh tokens in the last day.
     * Expected: 3 x 20 for critical errors plus 25 for auth = 85, critical urgency.
     */
    @Test
    void revokedTokens_areCriticalUrgency() {
        List<SyncErrorRecord> errors = List.of(
                error(ErrorCategory.AUTH, ErrorSeverity.CRITICAL, "gmail", ErrorStage.TOKEN_REFRESH, 1),
                error(ErrorCategory.AUTH, ErrorSeverity.CRITICAL, "gmail", ErrorStage.TOKEN_REFRESH, 2),
                error(ErrorCategory.AUTH, ErrorSeverity.CRITICAL, "calendar", ErrorStage.TOKEN_REFRESH, 3));
        stubWindow(24, errors);

        ErrorSummaryResponse summary = service.getErrorSummary(USER_ID, 24, null, null, null);

        assertThat(summary.urgencyScore().score()).isEqualTo(85);
        assertThat(summary.urgencyScore().level()).isEqualTo(UrgencyLevel.CRITICAL);
        assertThat(summary.urgencyScore().factors())
                .contains("3 critical error(s)", "Authentication errors detected");
        assertThat(summary.criticalErrors()).hasSize(3);
        assertThat(summary.recommendations())
                .startsWith("IMMEDIATE ACTION REQUIRED: Critical errors detected")
                .contains("Check authentication credentials and token validity");
        assertThat(summary.recoveryStrategies())
                .extracting(RecoveryStrategy::action)
                .containsExactly(RecoveryAction.REAUTHENTICATE);
        assertThat(summary.errorsByCategory()).containsEntry("auth", 3L);
    }

    @Test
    void urgencyScore_isClampedTo100() {
        UrgencyScore score = service.calculateUrgencyScore(
                new UrgencySignals(10, 500, 20.0, true, true, true));

        assertThat(score.score()).isEqualTo(100);
        assertThat(score.level()).isEqualTo(UrgencyLevel.CRITICAL);
        assertThat(score.factors()).hasSize(6);
    }

    @Test
    void failureRate_bands() {
        assertThat(service.calculateUrgencyScore(new UrgencySignals(0, 10, 2.5, false, false, false)).score())
                .isEqualTo(15);
        assertThat(service.calculateUrgencyScore(new UrgencySignals(0, 10, 5.5, false, false, false)).score())
                .isEqualTo(30);
        assertThat(service.calculateUrgencyScore(new UrgencySignals(0, 10, 2.0, false, false, false)).score())
                .isZero();
    }

    @Test
    void patterns_areSortedByFrequency_andRecurringOnesRecommended() {
        List<SyncErrorRecord> errors = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            errors.add(error(ErrorCategory.RATE_LIMIT, ErrorSeverity.MEDIUM, "gmail", ErrorStage.INGESTION, i));
        }
        errors.add(error(ErrorCategory.VALIDATION, ErrorSeverity.MEDIUM, "drive", ErrorStage.NORMALIZATION, 7));
        stubWindow(24, errors);

        ErrorSummaryResponse summary = service.getErrorSummary(USER_ID, 24, null, null, null);

        assertThat(summary.errorPatterns()).extracting(ErrorPattern::category)
                .containsExactly(ErrorCategory.RATE_LIMIT, ErrorCategory.VALIDATION);
        assertThat(summary.errorPatterns().get(0).frequency()).isEqualTo(6);
        assertThat(summary.errorPatterns().get(0).lastOccurrence()).isEqualTo(clock.instant());
        assertThat(summary.recommendations()).contains(
                "Address recurring rate_limit errors (medium severity) (6 occurrences)",
                "Implement exponential backoff for API calls",
                "Review data validation and processing logic");
    }

    @Test
    void filters_narrowPatternsButTotalCountsTheWindow() {
        stubWindow(24, List.of(
                error(ErrorCategory.NETWORK, ErrorSeverity.MEDIUM, "gmail", ErrorStage.INGESTION, 1),
                error(ErrorCategory.SYSTEM, ErrorSeverity.HIGH, "drive", ErrorStage.INGESTION, 2),
                error(ErrorCategory.NETWORK, ErrorSeverity.MEDIUM, "gmail", ErrorStage.NORMALIZATION, 3)));

        ErrorSummaryResponse summary = service.getErrorSummary(USER_ID, 24, "gmail", ErrorStage.INGESTION, null);

        assertThat(summary.totalErrors()).isEqualTo(1);
        assertThat(summary.recentErrors()).hasSize(1);

        ErrorSummaryResponse bySeverity = service.getErrorSummary(USER_ID, 24, null, null, ErrorSeverity.HIGH);
        assertThat(bySeverity.totalErrors()).isEqualTo(3);
        assertThat(bySeverity.recentErrors()).hasSize(1);
        assertThat(bySeverity.errorPatterns()).extracting(ErrorPattern::category)
                .containsExactly(ErrorCategory.SYSTEM);
    }

    @Test
    void timeRange_isBounded() {
        assertThatThrownBy(() -> service.getErrorSummary(USER_ID, 0, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.getErrorSummary(USER_ID, 169, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void stubWindow(int hours, List<SyncErrorRecord> errors) {
        when(errorRecordRepository.findByUserIdAndOccurredAtAfterOrderByOccurredAtDesc(
                eq(USER_ID), eq(clock.instant().minus(Duration.ofHours(hours)))))
                .thenReturn(errors);
    }

    private SyncErrorRecord error(ErrorCategory category, ErrorSeverity severity, String svc,
                                  ErrorStage stage, int minutesAgo) {
        return SyncErrorRecord.builder()
                .id(UUID.randomUUID())
                .userId(USER_ID)
                .service(svc)
                .stage(stage.getWireName())
                .message(category.getWireName() + " failure")
                .category(category)
                .severity(severity)
                .retryable(severity != ErrorSeverity.CRITICAL)
                .occurredAt(clock.instant().minus(Duration.ofMinutes(minutesAgo)))
                .build();
    }
}
