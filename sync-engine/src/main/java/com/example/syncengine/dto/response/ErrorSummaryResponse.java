package com.example.syncengine.dto.response;

import com.example.syncengine.error.ErrorPattern;
import com.example.syncengine.error.RecoveryStrategy;
import com.example.syncengine.error.UrgencyScore;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Builder
public record ErrorSummaryResponse(
        int timeRangeHours,
        Instant generatedAt,
        long totalErrors,
        Map<String, Long> errorsByCategory,
        Map<String, Long> errorsBySeverity,
        List<ErrorRecordResponse> recentErrors,
        List<ErrorRecordResponse> criticalErrors,
        List<RecoveryStrategy> recoveryStrategies,
        List<ErrorPattern> errorPatterns,
        UrgencyScore urgencyScore,
        List<String> recommendations
) {
}
