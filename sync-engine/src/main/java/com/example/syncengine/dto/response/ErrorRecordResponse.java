package com.example.syncengine.dto.response;

import com.example.syncengine.entity.SyncErrorRecord;
import com.example.syncengine.error.ErrorCategory;
import com.example.syncengine.error.ErrorSeverity;

import java.time.Instant;
import java.util.UUID;

public record ErrorRecordResponse(
        UUID id,
        String service,
        String stage,
        String message,
        ErrorCategory category,
        ErrorSeverity severity,
        boolean retryable,
        UUID sessionId,
        String batchId,
        Instant occurredAt
) {

    public static ErrorRecordResponse from(SyncErrorRecord record) {
        return new ErrorRecordResponse(
                record.getId(),
                record.getService(),
                record.getStage(),
                record.getMessage(),
                record.getCategory(),
                record.getSeverity(),
                record.isRetryable(),
                record.getSessionId(),
                record.getBatchId(),
                record.getOccurredAt());
    }
}
