package com.example.syncengine.error;

import java.util.List;

/**
 * Structured view of one failure. Computed per failure, never shared between failures.
 */
public record ErrorClassification(
        ErrorCategory category,
        ErrorSeverity severity,
        boolean retryable,
        List<RecoveryStrategy> recoveryStrategies,
        String userMessage,
        String technicalMessage
) {

    public ErrorClassification {
        recoveryStrategies = recoveryStrategies == null ? List.of() : List.copyOf(recoveryStrategies);
    }

    public boolean hasStrategy(RecoveryAction action) {
        return recoveryStrategies.stream().anyMatch(s -> s.action() == action);
    }
}
