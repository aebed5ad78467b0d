package com.example.syncengine.scheduler;

import com.example.syncengine.error.ErrorTrackingService;
import com.example.syncengine.job.JobQueueService;
import com.example.syncengine.metrics.SyncMetrics;
import com.example.syncengine.service.QueueDrainService;
import com.example.syncengine.session.SyncSessionTracker;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * Scheduled maintenance of jobs, sessions and error records.
 *
 * CRITICAL DESIGN:
 * - @SchedulerLock ensures only ONE instance executes each task
 * - Scheduler delegates to services (NO business logic here)
 * - Correlation ID per run for tracing
 * - Can be disabled via sync.scheduler.enabled
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "sync.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class MaintenanceScheduler {

    private final JobQueueService jobQueueService;
    private final QueueDrainService queueDrainService;
    private final SyncSessionTracker sessionTracker;
    private final ErrorTrackingService errorTrackingService;
    private final SyncMetrics syncMetrics;
    private final int stuckThresholdMinutes;
    private final int sessionRetentionDays;
    private final int errorRetentionDays;
    private final boolean backgroundDrainEnabled;

    public MaintenanceScheduler(JobQueueService jobQueueService,
                                QueueDrainService queueDrainService,
                                SyncSessionTracker sessionTracker,
                                ErrorTrackingService errorTrackingService,
                                SyncMetrics syncMetrics,
                                @Value("${sync.jobs.stuck-threshold-minutes:10}") int stuckThresholdMinutes,
                                @Value("${sync.sessions.retention-days:30}") int sessionRetentionDays,
                                @Value("${sync.errors.retention-days:30}") int errorRetentionDays,
                                @Value("${sync.jobs.background-drain:true}") boolean backgroundDrainEnabled) {
        this.jobQueueService = jobQueueService;
        this.queueDrainService = queueDrainService;
        this.sessionTracker = sessionTracker;
        this.errorTrackingService = errorTrackingService;
        this.syncMetrics = syncMetrics;
        this.stuckThresholdMinutes = stuckThresholdMinutes;
        this.sessionRetentionDays = sessionRetentionDays;
        this.errorRetentionDays = errorRetentionDays;
        this.backgroundDrainEnabled = backgroundDrainEnabled;
    }

    /**
     * Return jobs abandoned in PROCESSING (crashed runner) to the queue.
     *
     * Default: Every 5 minutes
     */
    @Scheduled(cron = "${sync.scheduler.stuck-jobs-cron:0 */5 * * * *}")
    @SchedulerLock(name = "recoverStuckJobs", lockAtMostFor = "4m", lockAtLeastFor = "30s")
    public void recoverStuckJobs() {
        runWithCorrelationId("SCHEDULER-STUCK", () -> {
            int recovered = jobQueueService.recoverStuckJobs(Duration.ofMinutes(stuckThresholdMinutes));
            syncMetrics.recordJobsRecovered(recovered);
        });
    }

    /**
     * Run queued background jobs.
     *
     * Default: Every minute
     */
    @Scheduled(fixedDelayString = "${sync.scheduler.drain-interval-ms:60000}", initialDelay = 15000)
    @SchedulerLock(name = "drainJobQueues", lockAtMostFor = "9m", lockAtLeastFor = "10s")
    public void drainJobQueues() {
        if (!backgroundDrainEnabled) {
            return;
        }
        runWithCorrelationId("SCHEDULER-DRAIN", queueDrainService::drainQueues);
    }

    /**
     * Delete old sessions.
     *
     * Default: Daily at 3 AM
     */
    @Scheduled(cron = "${sync.scheduler.session-cleanup-cron:0 0 3 * * *}")
    @SchedulerLock(name = "cleanupOldSessions", lockAtMostFor = "30m", lockAtLeastFor = "1m")
    public void cleanupOldSessions() {
        runWithCorrelationId("SCHEDULER-SESSIONS", () -> sessionTracker.cleanupOldSessions(sessionRetentionDays));
    }

    /**
     * Delete old error records.
     *
     * Default: Daily at 3:30 AM
     */
    @Scheduled(cron = "${sync.scheduler.error-cleanup-cron:0 30 3 * * *}")
    @SchedulerLock(name = "purgeErrorRecords", lockAtMostFor = "30m", lockAtLeastFor = "1m")
    public void purgeErrorRecords() {
        runWithCorrelationId("SCHEDULER-ERRORS", () -> errorTrackingService.purgeOlderThan(errorRetentionDays));
    }

    private void runWithCorrelationId(String prefix, Runnable task) {
        String correlationId = prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);
        try {
            task.run();
        } catch (Exception e) {
            log.error("Error in scheduled task {}: {}", prefix, e.getMessage(), e);
        } finally {
            MDC.remove("correlationId");
        }
    }
}
