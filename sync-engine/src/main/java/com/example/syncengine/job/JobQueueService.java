package com.example.syncengine.job;

import com.example.syncengine.cache.CacheKeys;
import com.example.syncengine.cache.QueryCache;
import com.example.syncengine.dto.response.EnqueuedJobResponse;
import com.example.syncengine.dto.response.JobCountsResponse;
import com.example.syncengine.dto.response.JobResponse;
import com.example.syncengine.entity.Job;
import com.example.syncengine.entity.JobKind;
import com.example.syncengine.entity.JobStatus;
import com.example.syncengine.entity.ServiceType;
import com.example.syncengine.repository.JobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Persisted job queue: enqueue, inspection and stuck-job recovery.
 *
 * No payload deduplication: enqueuing the same payload twice creates two jobs.
 */
@Service
@Slf4j
public class JobQueueService {

    private static final long COUNTS_TTL_SECONDS = 10;
    private static final int MAX_LIST_LIMIT = 200;

    private final JobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final QueryCache queryCache;
    private final Clock clock;
    private final int maxAttempts;

    public JobQueueService(JobRepository jobRepository,
                           ObjectMapper objectMapper,
                           QueryCache queryCache,
                           Clock clock,
                           @Value("${sync.jobs.max-attempts:3}") int maxAttempts) {
        this.jobRepository = jobRepository;
        this.objectMapper = objectMapper;
        this.queryCache = queryCache;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    @Transactional
    public UUID enqueue(JobKind kind, Map<String, Object> payload, UUID userId, String batchId) {
        Job job = jobRepository.save(Job.queued(userId, kind, toJson(payload), batchId));
        queryCache.deletePattern(CacheKeys.jobsPattern(userId));
        log.debug("Enqueued job: id={}, kind={}, userId={}, batchId={}", job.getId(), kind, userId, batchId);
        return job.getId();
    }

    /**
     * Queue a background provider import. Its normalize jobs will share the returned batch id.
     */
    @Transactional
    public EnqueuedJobResponse enqueueProviderSync(UUID userId, ServiceType service, Map<String, Object> options) {
        String batchId = UUID.randomUUID().toString();
        UUID jobId = enqueue(JobKind.providerSyncFor(service), options, userId, batchId);
        log.info("Queued background {} import: jobId={}, userId={}", service.getPathValue(), jobId, userId);
        return new EnqueuedJobResponse(jobId, batchId);
    }

    /**
     * Users that currently have queued jobs.
     */
    @Transactional(readOnly = true)
    public List<UUID> findUsersWithQueuedJobs(int limit) {
        return jobRepository.findUserIdsWithQueuedJobs(PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * Enqueue many jobs of one kind under a freshly generated batch id, all or nothing.
     */
    @Transactional
    public List<UUID> enqueueBatch(UUID userId, JobKind kind, List<Map<String, Object>> items) {
        return enqueueBatch(userId, kind, items, UUID.randomUUID().toString());
    }

    /**
     * Enqueue many jobs of one kind sharing {@code batchId}, all or nothing.
     */
    @Transactional
    public List<UUID> enqueueBatch(UUID userId, JobKind kind, List<Map<String, Object>> items, String batchId) {
        if (items.isEmpty()) {
            return List.of();
        }
        List<Job> jobs = items.stream()
                .map(item -> Job.queued(userId, kind, toJson(item), batchId))
                .toList();
        List<UUID> ids = jobRepository.saveAll(jobs).stream().map(Job::getId).toList();
        queryCache.deletePattern(CacheKeys.jobsPattern(userId));
        log.info("Enqueued batch: size={}, kind={}, userId={}, batchId={}", ids.size(), kind, userId, batchId);
        return ids;
    }

    /**
     * Job counts by status and kind, optionally restricted to one batch. Cached briefly.
     */
    public JobCountsResponse getJobCounts(UUID userId, String batchId) {
        return queryCache.get(CacheKeys.jobCounts(userId, batchId), () -> countJobs(userId, batchId),
                COUNTS_TTL_SECONDS);
    }

    @Transactional(readOnly = true)
    public List<JobResponse> listJobs(UUID userId, JobStatus status, String batchId, int limit) {
        int pageSize = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        return jobRepository.findForUser(userId, status, batchId, PageRequest.of(0, pageSize)).stream()
                .map(JobResponse::from)
                .toList();
    }

    /**
     * Return jobs left in PROCESSING longer than {@code stuckAfter} to the queue,
     * or fail them when they have no attempts left.
     *
     * @return number of jobs moved
     */
    @Transactional
    public int recoverStuckJobs(Duration stuckAfter) {
        Instant now = Instant.now(clock);
        Instant threshold = now.minus(stuckAfter);
        int requeued = jobRepository.requeueStuck(threshold, maxAttempts,
                "Requeued after exceeding processing timeout", now);
        int failed = jobRepository.failStuck(threshold, maxAttempts,
                "Abandoned in processing after final attempt", now);
        if (requeued + failed > 0) {
            log.warn("⚠️ Recovered stuck jobs: requeued={}, failed={}, threshold={}", requeued, failed, threshold);
        }
        return requeued + failed;
    }

    Map<String, Object> readPayload(Job job) {
        try {
            Map<String, Object> payload = objectMapper.readValue(job.getPayload(),
                    objectMapper.getTypeFactory().constructMapType(Map.class, String.class, Object.class));
            return payload == null ? Map.of() : payload;
        } catch (JsonProcessingException e) {
            throw new InvalidJobPayloadException(job.getId(), e);
        }
    }

    String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job document is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private JobCountsResponse countJobs(UUID userId, String batchId) {
        Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        Map<String, Long> byKind = new TreeMap<>();
        long total = 0;
        for (JobRepository.JobCountRow row : jobRepository.countGrouped(userId, batchId)) {
            byStatus.merge(row.getStatus(), row.getTotal(), Long::sum);
            byKind.merge(row.getKind().name().toLowerCase(), row.getTotal(), Long::sum);
            total += row.getTotal();
        }
        return new JobCountsResponse(
                batchId,
                total,
                byStatus.getOrDefault(JobStatus.QUEUED, 0L),
                byStatus.getOrDefault(JobStatus.PROCESSING, 0L),
                byStatus.getOrDefault(JobStatus.DONE, 0L),
                byStatus.getOrDefault(JobStatus.ERROR, 0L),
                byKind);
    }
}
