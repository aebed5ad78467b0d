package com.example.syncengine.job;

import com.example.syncengine.error.CategorizedFailure;
import com.example.syncengine.error.ErrorCategory;

import java.util.UUID;

/**
 * The job's payload cannot be interpreted. Retrying cannot fix it.
 */
public class InvalidJobPayloadException extends RuntimeException implements CategorizedFailure {

    public InvalidJobPayloadException(UUID jobId, String detail) {
        super("Invalid payload for job " + jobId + ": " + detail);
    }

    public InvalidJobPayloadException(UUID jobId, Throwable cause) {
        super("Invalid payload for job " + jobId + ": " + cause.getMessage(), cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.VALIDATION;
    }
}
