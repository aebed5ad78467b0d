package com.example.syncengine.repository;

import com.example.syncengine.entity.Job;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Custom repository for atomic job claiming.
 */
public interface JobRepositoryCustom {

    /**
     * Claim up to {@code maxJobs} of the user's oldest queued jobs.
     *
     * Each returned job was moved QUEUED -> PROCESSING by this call and had its
     * attempts incremented. A job claimed by a concurrent caller is never returned.
     *
     * @param batchId restricts the claim to one batch; null claims from any batch
     */
    List<Job> claimQueuedJobs(UUID userId, String batchId, int maxJobs, Instant now);
}
