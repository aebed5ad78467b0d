package com.example.syncengine.service;

import com.example.syncengine.job.JobQueueService;
import com.example.syncengine.job.JobRunResult;
import com.example.syncengine.job.JobRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs queued jobs in the background, one runner call per user, on the bounded job pool.
 *
 * Two instances draining the same user are safe: claims are atomic, so each job
 * is executed once.
 */
@Service
@Slf4j
public class QueueDrainService {

    private final JobQueueService jobQueueService;
    private final JobRunner jobRunner;
    private final TaskExecutor jobTaskExecutor;
    private final int batchSize;
    private final int maxUsersPerDrain;

    public QueueDrainService(JobQueueService jobQueueService,
                             JobRunner jobRunner,
                             @Qualifier("jobTaskExecutor") TaskExecutor jobTaskExecutor,
                             @Value("${sync.jobs.batch-size:10}") int batchSize,
                             @Value("${sync.jobs.drain-max-users:50}") int maxUsersPerDrain) {
        this.jobQueueService = jobQueueService;
        this.jobRunner = jobRunner;
        this.jobTaskExecutor = jobTaskExecutor;
        this.batchSize = batchSize;
        this.maxUsersPerDrain = maxUsersPerDrain;
    }

    /**
     * Process one batch for every user with queued jobs and wait for all of them.
     *
     * @return aggregate result of this drain
     */
    public JobRunResult drainQueues() {
        List<UUID> userIds = jobQueueService.findUsersWithQueuedJobs(maxUsersPerDrain);
        if (userIds.isEmpty()) {
            log.debug("No queued jobs to drain");
            return JobRunResult.EMPTY;
        }

        List<CompletableFuture<JobRunResult>> futures = new ArrayList<>();
        int rejected = 0;
        for (UUID userId : userIds) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> jobRunner.processUserJobs(userId, batchSize),
                        jobTaskExecutor));
            } catch (RejectedExecutionException e) {
                // picked up again by the next drain
                log.warn("⚠️ Job pool full, skipping userId={} until the next drain", userId);
                rejected++;
            }
        }

        int processed = 0;
        int succeeded = 0;
        int failed = 0;
        for (CompletableFuture<JobRunResult> future : futures) {
            JobRunResult result = future.exceptionally(ex -> {
                log.error("❌ Background job round failed: {}", ex.getMessage(), ex);
                return JobRunResult.EMPTY;
            }).join();
            processed += result.processed();
            succeeded += result.succeeded();
            failed += result.failed();
        }

        log.info("Drained queues of {} user(s): processed={}, succeeded={}, failed={}, rejected={}",
                futures.size(), processed, succeeded, failed, rejected);
        return new JobRunResult(processed, succeeded, failed, List.of());
    }
}
