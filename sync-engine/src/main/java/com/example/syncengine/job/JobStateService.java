package com.example.syncengine.job;

import com.example.syncengine.entity.Job;
import com.example.syncengine.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Short transactions for job state changes. Handlers run between these calls,
 * never inside one.
 *
 * Each transition returns false when the job was no longer PROCESSING, which
 * happens when stuck-job recovery reclaimed it while the handler was running.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobStateService {

    private final JobRepository jobRepository;
    private final Clock clock;

    @Transactional
    public List<Job> claim(UUID userId, int maxJobs) {
        return claim(userId, null, maxJobs);
    }

    /**
     * @param batchId restricts the claim to one batch; null claims from any batch
     */
    @Transactional
    public List<Job> claim(UUID userId, String batchId, int maxJobs) {
        return jobRepository.claimQueuedJobs(userId, batchId, maxJobs, Instant.now(clock));
    }

    @Transactional
    public boolean complete(UUID jobId, String resultJson) {
        return logLost(jobId, "done", jobRepository.markDone(jobId, resultJson, Instant.now(clock)));
    }

    @Transactional
    public boolean requeue(UUID jobId, String error) {
        return logLost(jobId, "queued", jobRepository.requeue(jobId, error, Instant.now(clock)));
    }

    @Transactional
    public boolean fail(UUID jobId, String error, String resultJson) {
        return logLost(jobId, "error", jobRepository.markError(jobId, error, resultJson, Instant.now(clock)));
    }

    private static boolean logLost(UUID jobId, String target, int updated) {
        if (updated == 0) {
            log.warn("⚠️ Job {} was no longer processing, transition to {} skipped", jobId, target);
            return false;
        }
        return true;
    }
}
