package com.example.syncengine.error;

import java.time.Instant;

/**
 * Failures sharing one category and severity within the summary window.
 */
public record ErrorPattern(
        String pattern,
        ErrorCategory category,
        ErrorSeverity severity,
        long frequency,
        Instant lastOccurrence,
        String suggestedAction
) {
}
