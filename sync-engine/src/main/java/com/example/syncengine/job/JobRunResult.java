package com.example.syncengine.job;

import java.util.List;

/**
 * Outcome of one runner call. {@code processed == succeeded + failed}.
 */
public record JobRunResult(int processed, int succeeded, int failed, List<JobErrorSummary> errors) {

    public static final JobRunResult EMPTY = new JobRunResult(0, 0, 0, List.of());

    public JobRunResult {
        errors = List.copyOf(errors);
    }

    /**
     * Jobs that reached a terminal error in this call.
     */
    public long terminalFailures() {
        return errors.stream().filter(e -> !e.willRetry()).count();
    }
}
