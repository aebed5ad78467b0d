package com.example.syncengine.dto.response;

import com.example.syncengine.entity.Job;
import com.example.syncengine.entity.JobKind;
import com.example.syncengine.entity.JobStatus;

import java.time.Instant;
import java.util.UUID;

public record JobResponse(
        UUID id,
        JobKind kind,
        JobStatus status,
        int attempts,
        String batchId,
        String lastError,
        Instant createdAt,
        Instant updatedAt
) {

    public static JobResponse from(Job job) {
        return new JobResponse(job.getId(), job.getKind(), job.getStatus(), job.getAttempts(),
                job.getBatchId(), job.getLastError(), job.getCreatedAt(), job.getUpdatedAt());
    }
}
