package com.example.syncengine.dto.response;

import com.example.syncengine.entity.SessionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Polling view of a sync session.
 *
 * @param estimate present only while importing or processing with a percentage strictly between 0 and 100
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionProgressResponse(
        UUID sessionId,
        String service,
        SessionStatus status,
        double progressPercentage,
        String currentStep,
        int totalItems,
        int importedItems,
        int processedItems,
        int failedItems,
        Map<String, Object> errorDetails,
        Instant startedAt,
        Instant completedAt,
        TimeEstimate estimate
) {

    public record TimeEstimate(long elapsedMs, long estimatedTotalMs, long remainingMs) {
    }
}
