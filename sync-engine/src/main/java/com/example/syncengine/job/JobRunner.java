package com.example.syncengine.job;

import com.example.syncengine.cache.CacheKeys;
import com.example.syncengine.cache.QueryCache;
import com.example.syncengine.entity.Job;
import com.example.syncengine.entity.JobKind;
import com.example.syncengine.error.ErrorCategory;
import com.example.syncengine.error.ErrorClassification;
import com.example.syncengine.error.ErrorClassifier;
import com.example.syncengine.error.ErrorStage;
import com.example.syncengine.error.ErrorTrackingService;
import com.example.syncengine.metrics.SyncMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Claims and executes a user's queued jobs inline.
 *
 * CRITICAL DESIGN:
 * - Claiming is atomic (see JobRepositoryImpl); a job is executed by at most one runner
 * - Handlers run OUTSIDE transactions; each state change is its own short transaction
 * - attempts is incremented when a job is claimed, so it counts executions
 * - A failure goes back to the queue only when its classification is retryable
 *   and the job has attempts left; otherwise it ends in ERROR with the
 *   classification stored as its result
 */
@Service
@Slf4j
public class JobRunner {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final JobStateService jobStateService;
    private final JobQueueService jobQueueService;
    private final JobHandlerRegistry handlerRegistry;
    private final ErrorClassifier errorClassifier;
    private final ErrorTrackingService errorTrackingService;
    private final QueryCache queryCache;
    private final SyncMetrics syncMetrics;
    private final int maxAttempts;

    public JobRunner(JobStateService jobStateService,
                     JobQueueService jobQueueService,
                     JobHandlerRegistry handlerRegistry,
                     ErrorClassifier errorClassifier,
                     ErrorTrackingService errorTrackingService,
                     QueryCache queryCache,
                     SyncMetrics syncMetrics,
                     @Value("${sync.jobs.max-attempts:3}") int maxAttempts) {
        this.jobStateService = jobStateService;
        this.jobQueueService = jobQueueService;
        this.handlerRegistry = handlerRegistry;
        this.errorClassifier = errorClassifier;
        this.errorTrackingService = errorTrackingService;
        this.queryCache = queryCache;
        this.syncMetrics = syncMetrics;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Process up to {@code maxJobs} of the user's queued jobs, oldest first.
     */
    public JobRunResult processUserJobs(UUID userId, int maxJobs) {
        return processUserJobs(userId, null, maxJobs);
    }

    /**
     * Process up to {@code maxJobs} of the user's queued jobs in {@code batchId}, oldest first.
     * Jobs of other batches stay queued.
     */
    public JobRunResult processUserJobs(UUID userId, String batchId, int maxJobs) {
        List<Job> claimed = jobStateService.claim(userId, batchId, maxJobs);
        if (claimed.isEmpty()) {
            log.debug("No queued jobs for userId={}, batchId={}", userId, batchId);
            return JobRunResult.EMPTY;
        }

        log.info("Processing {} job(s) for userId={}, batchId={}", claimed.size(), userId, batchId);
        int succeeded = 0;
        int failed = 0;
        List<JobErrorSummary> errors = new ArrayList<>();

        for (Job job : claimed) {
            Optional<JobErrorSummary> error = execute(job);
            if (error.isEmpty()) {
                succeeded++;
            } else {
                failed++;
                errors.add(error.get());
            }
        }

        queryCache.deletePattern(CacheKeys.jobsPattern(userId));
        log.info("Finished job round for userId={}: processed={}, succeeded={}, failed={}",
                userId, claimed.size(), succeeded, failed);
        return new JobRunResult(claimed.size(), succeeded, failed, errors);
    }

    private Optional<JobErrorSummary> execute(Job job) {
        MDC.put("jobId", job.getId().toString());
        Timer.Sample sample = syncMetrics.startJobTimer();
        try {
            JobHandler handler = handlerRegistry.handlerFor(job.getKind())
                    .orElseThrow(() -> new InvalidJobPayloadException(job.getId(),
                            "no handler registered for kind " + job.getKind()));

            JobContext context = new JobContext(job.getId(), job.getUserId(), job.getKind(),
                    job.getBatchId(), job.getAttempts(), jobQueueService.readPayload(job));

            Map<String, Object> result = handler.handle(context);
            jobStateService.complete(job.getId(), jobQueueService.toJson(result));
            syncMetrics.recordJobOutcome(job.getKind(), "done");
            log.debug("Job {} ({}) done on attempt {}", job.getId(), job.getKind(), job.getAttempts());
            return Optional.empty();

        } catch (Exception e) {
            return Optional.of(handleFailure(job, e));
        } finally {
            syncMetrics.stopJobTimer(sample, job.getKind());
            MDC.remove("jobId");
        }
    }

    private JobErrorSummary handleFailure(Job job, Exception e) {
        ErrorClassification classification = errorClassifier.classify(e);
        String message = truncate(classification.technicalMessage());
        boolean willRetry = classification.retryable() && job.getAttempts() < maxAttempts;

        if (willRetry) {
            jobStateService.requeue(job.getId(), message);
            syncMetrics.recordJobOutcome(job.getKind(), "requeued");
            log.warn("⚠️ Job {} ({}) failed on attempt {}/{}, requeued: category={}, message={}",
                    job.getId(), job.getKind(), job.getAttempts(), maxAttempts,
                    classification.category().getWireName(), message);
        } else {
            jobStateService.fail(job.getId(), message, jobQueueService.toJson(resultFor(classification, job)));
            syncMetrics.recordJobOutcome(job.getKind(), "error");
            log.error("❌ Job {} ({}) failed permanently on attempt {}: category={}, retryable={}, message={}",
                    job.getId(), job.getKind(), job.getAttempts(),
                    classification.category().getWireName(), classification.retryable(), message);
        }

        errorTrackingService.record(job.getUserId(), null, stageFor(job.getKind()), classification,
                null, job.getBatchId());

        return new JobErrorSummary(job.getId(), job.getKind(), "Job " + job.getId() + ": " + message,
                classification.category(), classification.retryable(), willRetry, job.getAttempts());
    }

    private static Map<String, Object> resultFor(ErrorClassification classification, Job job) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("classification", classification);
        result.put("attempts", job.getAttempts());
        return result;
    }

    private static ErrorStage stageFor(JobKind kind) {
        return switch (kind) {
            case NORMALIZE -> ErrorStage.NORMALIZATION;
            case EMBED -> ErrorStage.PROCESSING;
            case GMAIL_SYNC, CALENDAR_SYNC, DRIVE_SYNC -> ErrorStage.INGESTION;
        };
    }

    private static String truncate(String message) {
        if (message == null) {
            return ErrorCategory.UNKNOWN.getWireName();
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
