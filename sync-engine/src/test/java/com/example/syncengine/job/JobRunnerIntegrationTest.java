package com.example.syncengine.job;

import com.example.syncengine.cache.LocalQueryCache;
import com.example.syncengine.config.JpaConfig;
import com.example.syncengine.entity.Job;
import com.example.syncengine.entity.JobKind;
import com.example.syncengine.entity.JobStatus;
import com.example.syncengine.error.ErrorClassifier;
import com.example.syncengine.error.ErrorTrackingService;
import com.example.syncengine.exception.ProviderApiException;
import com.example.syncengine.metrics.SyncMetrics;
import com.example.syncengine.repository.JobRepository;
import com.example.syncengine.repository.SyncErrorRecordRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runner against a real schema: claiming, retries and terminal failures.
 *
 * Not transactional, so every state change commits as it does in production.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({
        JpaConfig.class,
        LocalQueryCache.class,
        SyncMetrics.class,
        ErrorClassifier.class,
        ErrorTrackingService.class,
        JobStateService.class,
        JobQueueService.class,
        JobHandlerRegistry.class,
        JobRunner.class,
        JobRunnerIntegrationTest.Config.class
})
class JobRunnerIntegrationTest {

    @Autowired
    private JobRunner jobRunner;
    @Autowired
    private JobQueueService jobQueueService;
    @Autowired
    private JobRepository jobRepository;
    @Autowired
    private SyncErrorRecordRepository errorRecordRepository;
    @Autowired
    private ScriptedNormalizeHandler handler;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        jobRepository.deleteAll();
        errorRecordRepository.deleteAll();
        handler.reset();
    }

    /**
     * Scenario: 50 queued jobs, one runner call with a limit of 10.
     * Expected: exactly 10 processed, 40 left queued.
     */
    @Test
    void processUserJobs_respectsLimit() {
        jobQueueService.enqueueBatch(userId, JobKind.NORMALIZE,
                IntStream.range(0, 50).mapToObj(i -> Map.<String, Object>of("service", "gmail", "n", i)).toList());

        JobRunResult result = jobRunner.processUserJobs(userId, 10);

        assertThat(result.processed()).isEqualTo(10);
        assertThat(result.succeeded()).isEqualTo(10);
        assertThat(countByStatus(JobStatus.QUEUED)).isEqualTo(40);
        assertThat(countByStatus(JobStatus.DONE)).isEqualTo(10);
    }

    @Test
    void otherUsersJobs_areNotClaimed() {
        UUID otherUser = UUID.randomUUID();
        jobQueueService.enqueue(JobKind.NORMALIZE, Map.of("service", "gmail"), otherUser, null);

        assertThat(jobRunner.processUserJobs(userId, 10)).isEqualTo(JobRunResult.EMPTY);
        assertThat(countByStatus(JobStatus.QUEUED)).isEqualTo(1);
    }

    /**
     * Scenario: the user has queued jobs in two batches, the runner is asked for one batch.
     * Expected: only that batch is claimed; the other stays queued.
     */
    @Test
    void batchScopedRound_leavesOtherBatchesQueued() {
        jobQueueService.enqueueBatch(userId, JobKind.NORMALIZE,
                List.of(Map.of("service", "gmail"), Map.of("service", "gmail")), "batch-mine");
        UUID foreign = jobQueueService.enqueue(JobKind.NORMALIZE, Map.of("service", "drive"), userId, "batch-other");

        JobRunResult result = jobRunner.processUserJobs(userId, "batch-mine", 10);

        assertThat(result.processed()).isEqualTo(2);
        assertThat(result.succeeded()).isEqualTo(2);
        Job untouched = reload(foreign);
        assertThat(untouched.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(untouched.getAttempts()).isZero();
    }

    /**
     * Scenario: handler fails with a retryable 503 twice, then succeeds.
     * Expected: DONE after three executions, last error cleared.
     */
    @Test
    void retryableFailures_areRequeuedUntilSuccess() {
        handler.script(new ProviderApiException("backend unavailable", 503, "service_unavailable"),
                new ProviderApiException("backend unavailable", 503, "service_unavailable"));
        UUID jobId = jobQueueService.enqueue(JobKind.NORMALIZE, Map.of("service", "gmail"), userId, "batch-1");

        JobRunResult first = jobRunner.processUserJobs(userId, 10);
        assertThat(first.failed()).isEqualTo(1);
        assertThat(first.errors().get(0).willRetry()).isTrue();
        assertThat(first.terminalFailures()).isZero();
        assertThat(reload(jobId).getStatus()).isEqualTo(JobStatus.QUEUED);

        jobRunner.processUserJobs(userId, 10);
        JobRunResult third = jobRunner.processUserJobs(userId, 10);

        Job job = reload(jobId);
        assertThat(third.succeeded()).isEqualTo(1);
        assertThat(job.getStatus()).isEqualTo(JobStatus.DONE);
        assertThat(job.getAttempts()).isEqualTo(3);
        assertThat(job.getLastError()).isNull();
        assertThat(job.getResult()).contains("\"normalized\"");
        assertThat(errorRecordRepository.count()).isEqualTo(2);
    }

    @Test
    void retryableFailure_onLastAttempt_isTerminal() {
        ProviderApiException unavailable = new ProviderApiException("backend unavailable", 503, null);
        handler.script(unavailable, unavailable, unavailable);
        UUID jobId = jobQueueService.enqueue(JobKind.NORMALIZE, Map.of("service", "gmail"), userId, null);

        jobRunner.processUserJobs(userId, 10);
        jobRunner.processUserJobs(userId, 10);
        JobRunResult last = jobRunner.processUserJobs(userId, 10);

        assertThat(last.terminalFailures()).isEqualTo(1);
        Job job = reload(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.ERROR);
        assertThat(job.getAttempts()).isEqualTo(3);
        assertThat(jobRunner.processUserJobs(userId, 10).processed()).isZero();
    }

    @Test
    void nonRetryableFailure_goesStraightToError() {
        handler.script(new ProviderApiException("insufficient permission", 403, "forbidden"));
        UUID jobId = jobQueueService.enqueue(JobKind.NORMALIZE, Map.of("service", "gmail"), userId, null);

        JobRunResult result = jobRunner.processUserJobs(userId, 10);

        assertThat(result.terminalFailures()).isEqualTo(1);
        Job job = reload(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.ERROR);
        assertThat(job.getAttempts()).isEqualTo(1);
        assertThat(job.getLastError()).isEqualTo("insufficient permission");
        assertThat(job.getResult()).contains("\"permission\"");
    }

    @Test
    void jobWithoutHandler_failsAsInvalidPayload() {
        UUID jobId = jobQueueService.enqueue(JobKind.EMBED, Map.of("recordIds", List.of("r1")), userId, null);

        JobRunResult result = jobRunner.processUserJobs(userId, 10);

        assertThat(result.errors()).singleElement().satisfies(error -> assertThat(error.willRetry()).isFalse());
        assertThat(reload(jobId).getStatus()).isEqualTo(JobStatus.ERROR);
    }

    @Test
    void jobCounts_reflectRunnerProgress() {
        List<UUID> ids = jobQueueService.enqueueBatch(userId, JobKind.NORMALIZE,
                List.of(Map.of("service", "gmail"), Map.of("service", "gmail"), Map.of("service", "gmail")),
                "batch-counts");

        jobRunner.processUserJobs(userId, 2);

        var counts = jobQueueService.getJobCounts(userId, "batch-counts");
        assertThat(ids).hasSize(3);
        assertThat(counts.total()).isEqualTo(3);
        assertThat(counts.done()).isEqualTo(2);
        assertThat(counts.queued()).isEqualTo(1);
    }

    private Job reload(UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow();
    }

    private long countByStatus(JobStatus status) {
        return jobRepository.findAll().stream().filter(j -> j.getStatus() == status).count();
    }

    /**
     * NORMALIZE handler that throws the scripted failures in order, then succeeds.
     */
    static class ScriptedNormalizeHandler implements JobHandler {

        private final Deque<RuntimeException> failures = new ArrayDeque<>();

        synchronized void script(RuntimeException... errors) {
            failures.addAll(List.of(errors));
        }

        synchronized void reset() {
            failures.clear();
        }

        @Override
        public Set<JobKind> supportedKinds() {
            return Set.of(JobKind.NORMALIZE);
        }

        @Override
        public synchronized Map<String, Object> handle(JobContext context) {
            RuntimeException next = failures.poll();
            if (next != null) {
                throw next;
            }
            return Map.of("normalized", 1, "attempt", context.attempt());
        }
    }

    @TestConfiguration
    static class Config {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper().findAndRegisterModules();
        }

        @Bean
        ScriptedNormalizeHandler scriptedNormalizeHandler() {
            return new ScriptedNormalizeHandler();
        }
    }
}
