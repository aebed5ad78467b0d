package com.example.syncengine.error;

import com.example.syncengine.dto.response.ErrorRecordResponse;
import com.example.syncengine.dto.response.ErrorSummaryResponse;
import com.example.syncengine.entity.SyncErrorRecord;
import com.example.syncengine.repository.SyncErrorRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Aggregates recent failures into patterns, an urgency score and recommendations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ErrorSummaryService {

    public static final int DEFAULT_TIME_RANGE_HOURS = 24;
    public static final int MAX_TIME_RANGE_HOURS = 168;

    private static final int RECENT_ERRORS_LIMIT = 50;
    private static final Set<ErrorCategory> DATA_CATEGORIES = EnumSet.of(ErrorCategory.VALIDATION);

    private final SyncErrorRecordRepository errorRecordRepository;
    private final ErrorClassifier errorClassifier;
    private final Clock clock;

    /**
     * Summarize a user's failures in the last {@code timeRangeHours} hours.
     *
     * @param service  optional service filter (gmail, calendar, drive)
     * @param stage    optional stage filter
     * @param severity optional severity filter, applied to the pattern and urgency inputs
     */
    @Transactional(readOnly = true)
    public ErrorSummaryResponse getErrorSummary(UUID userId,
                                                int timeRangeHours,
                                                String service,
                                                ErrorStage stage,
                                                ErrorSeverity severity) {
        if (timeRangeHours < 1 || timeRangeHours > MAX_TIME_RANGE_HOURS) {
            throw new IllegalArgumentException(
                    "timeRangeHours must be between 1 and " + MAX_TIME_RANGE_HOURS);
        }

        Instant now = Instant.now(clock);
        Instant since = now.minus(Duration.ofHours(timeRangeHours));

        List<SyncErrorRecord> windowErrors = errorRecordRepository
                .findByUserIdAndOccurredAtAfterOrderByOccurredAtDesc(userId, since).stream()
                .filter(e -> service == null || service.equalsIgnoreCase(e.getService()))
                .filter(e -> stage == null || stage.getWireName().equals(e.getStage()))
                .toList();

        List<SyncErrorRecord> filtered = severity == null
                ? windowErrors
                : windowErrors.stream().filter(e -> e.getSeverity() == severity).toList();

        List<SyncErrorRecord> critical = filtered.stream()
                .filter(e -> e.getSeverity() == ErrorSeverity.CRITICAL)
                .toList();

        List<ErrorPattern> patterns = identifyPatterns(filtered);

        UrgencyScore urgency = calculateUrgencyScore(new UrgencySignals(
                critical.size(),
                windowErrors.size(),
                (double) filtered.size() / Math.max(timeRangeHours, 1),
                filtered.stream().anyMatch(e -> e.getCategory() == ErrorCategory.AUTH),
                filtered.stream().anyMatch(e -> e.getCategory() == ErrorCategory.RATE_LIMIT),
                filtered.stream().anyMatch(e -> DATA_CATEGORIES.contains(e.getCategory()))));

        List<String> recommendations = generateRecommendations(windowErrors.size(), filtered, patterns, urgency);

        log.debug("Error summary: userId={}, window={}h, total={}, urgency={}({})",
                userId, timeRangeHours, windowErrors.size(), urgency.score(), urgency.level());

        return ErrorSummaryResponse.builder()
                .timeRangeHours(timeRangeHours)
                .generatedAt(now)
                .totalErrors(windowErrors.size())
                .errorsByCategory(countBy(windowErrors, e -> e.getCategory().getWireName()))
                .errorsBySeverity(countBy(windowErrors, e -> e.getSeverity().getWireName()))
                .recentErrors(filtered.stream().limit(RECENT_ERRORS_LIMIT).map(ErrorRecordResponse::from).toList())
                .criticalErrors(critical.stream().map(ErrorRecordResponse::from).toList())
                .recoveryStrategies(collectStrategies(filtered))
                .errorPatterns(patterns)
                .urgencyScore(urgency)
                .recommendations(recommendations)
                .build();
    }

    /**
     * Group failures by category and severity, most frequent first.
     */
    public List<ErrorPattern> identifyPatterns(List<SyncErrorRecord> errors) {
        Map<String, List<SyncErrorRecord>> grouped = new LinkedHashMap<>();
        for (SyncErrorRecord error : errors) {
            String key = error.getCategory().getWireName() + "-" + error.getSeverity().getWireName();
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(error);
        }

        return grouped.values().stream()
                .map(group -> {
                    SyncErrorRecord first = group.get(0);
                    Instant last = group.stream()
                            .map(SyncErrorRecord::getOccurredAt)
                            .max(Comparator.naturalOrder())
                            .orElse(null);
                    return new ErrorPattern(
                            first.getCategory().getWireName() + " errors ("
                                    + first.getSeverity().getWireName() + " severity)",
                            first.getCategory(),
                            first.getSeverity(),
                            group.size(),
                            last,
                            suggestedActionFor(first.getCategory()));
                })
                .sorted(Comparator.comparingLong(ErrorPattern::frequency).reversed())
                .toList();
    }

    /**
     * Additive urgency score, clamped to 100.
     */
    public UrgencyScore calculateUrgencyScore(UrgencySignals signals) {
        int score = 0;
        List<String> factors = new ArrayList<>();

        if (signals.criticalErrors() > 0) {
            score += (int) Math.min(signals.criticalErrors() * 20, 60);
            factors.add(signals.criticalErrors() + " critical error(s)");
        }

        if (signals.failureRatePerHour() > 5) {
            score += 30;
            factors.add(String.format(Locale.ROOT, "High failure rate: %.1f errors/hour", signals.failureRatePerHour()));
        } else if (signals.failureRatePerHour() > 2) {
            score += 15;
            factors.add(String.format(Locale.ROOT, "Moderate failure rate: %.1f errors/hour", signals.failureRatePerHour()));
        }

        if (signals.hasAuthErrors()) {
            score += 25;
            factors.add("Authentication errors detected");
        }
        if (signals.hasRateLimitErrors()) {
            score += 15;
            factors.add("Rate limiting issues detected");
        }
        if (signals.hasDataErrors()) {
            score += 20;
            factors.add("Data integrity issues detected");
        }
        if (signals.totalErrors() > 100) {
            score += 10;
            factors.add("High total error count: " + signals.totalErrors());
        }

        int clamped = Math.min(score, 100);
        return new UrgencyScore(clamped, UrgencyLevel.forScore(clamped), factors);
    }

    public List<String> generateRecommendations(long totalErrors,
                                                List<SyncErrorRecord> recentErrors,
                                                List<ErrorPattern> patterns,
                                                UrgencyScore urgency) {
        List<String> recommendations = new ArrayList<>();

        if (urgency.level() == UrgencyLevel.CRITICAL) {
            recommendations.add("IMMEDIATE ACTION REQUIRED: Critical errors detected");
            recommendations.add("Review and resolve critical errors immediately");
        }

        if (!patterns.isEmpty() && patterns.get(0).frequency() > 5) {
            ErrorPattern top = patterns.get(0);
            recommendations.add("Address recurring " + top.pattern() + " (" + top.frequency() + " occurrences)");
        }

        if (recentErrors.stream().anyMatch(e -> e.getCategory() == ErrorCategory.AUTH)) {
            recommendations.add("Check authentication credentials and token validity");
        }
        if (recentErrors.stream().anyMatch(e -> e.getCategory() == ErrorCategory.RATE_LIMIT)) {
            recommendations.add("Implement exponential backoff for API calls");
            recommendations.add("Consider upgrading API rate limits");
        }
        if (recentErrors.stream().anyMatch(e -> DATA_CATEGORIES.contains(e.getCategory()))) {
            recommendations.add("Review data validation and processing logic");
        }
        if (totalErrors > 50) {
            recommendations.add("Consider implementing more robust error handling");
        }
        if (totalErrors == 0) {
            recommendations.add("No recent errors - system is healthy");
        }
        return recommendations;
    }

    static String suggestedActionFor(ErrorCategory category) {
        return switch (category) {
            case AUTH -> "Check authentication credentials and refresh tokens";
            case RATE_LIMIT -> "Implement exponential backoff and rate limiting";
            case VALIDATION -> "Review data validation and processing logic";
            case NETWORK -> "Check network connectivity and retry logic";
            case PERMISSION -> "Verify granted permissions and re-authorize if needed";
            case SYSTEM -> "Retry later and contact support if the problem persists";
            case UNKNOWN -> "Review error logs and implement appropriate error handling";
        };
    }

    private List<RecoveryStrategy> collectStrategies(List<SyncErrorRecord> errors) {
        Map<RecoveryAction, RecoveryStrategy> unique = new LinkedHashMap<>();
        for (SyncErrorRecord error : errors) {
            for (RecoveryStrategy strategy : errorClassifier.strategiesFor(error.getCategory(), error.getSeverity())) {
                unique.putIfAbsent(strategy.action(), strategy);
            }
        }
        return List.copyOf(unique.values());
    }

    private static Map<String, Long> countBy(List<SyncErrorRecord> errors,
                                             Function<SyncErrorRecord, String> key) {
        return errors.stream().collect(Collectors.groupingBy(key, TreeMap::new, Collectors.counting()));
    }
}
