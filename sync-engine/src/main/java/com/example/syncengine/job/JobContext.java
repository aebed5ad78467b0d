package com.example.syncengine.job;

import com.example.syncengine.entity.JobKind;

import java.util.Map;
import java.util.UUID;

/**
 * What a handler receives for one execution of a job.
 *
 * @param attempt 1 for the first execution
 */
public record JobContext(
        UUID jobId,
        UUID userId,
        JobKind kind,
        String batchId,
        int attempt,
        Map<String, Object> payload
) {

    public String requireString(String field) {
        Object value = payload.get(field);
        if (!(value instanceof String text) || text.isBlank()) {
            throw new InvalidJobPayloadException(jobId, "missing field '" + field + "'");
        }
        return text;
    }

    public String optionalString(String field) {
        return payload.get(field) instanceof String text ? text : null;
    }
}
