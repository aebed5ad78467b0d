package com.example.syncengine.error;

/**
 * Inputs to the urgency score, derived from one error window.
 *
 * @param failureRatePerHour errors in the window divided by the window length in hours
 */
public record UrgencySignals(
        long criticalErrors,
        long totalErrors,
        double failureRatePerHour,
        boolean hasAuthErrors,
        boolean hasRateLimitErrors,
        boolean hasDataErrors
) {
}
