package com.example.syncengine.job;

import com.example.syncengine.entity.JobKind;
import com.example.syncengine.error.ErrorCategory;

import java.util.UUID;

/**
 * @param willRetry true when the job went back to the queue
 */
public record JobErrorSummary(
        UUID jobId,
        JobKind kind,
        String message,
        ErrorCategory category,
        boolean retryable,
        boolean willRetry,
        int attempts
) {
}
