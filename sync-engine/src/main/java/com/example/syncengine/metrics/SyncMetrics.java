package com.example.syncengine.metrics;

import com.example.syncengine.cache.QueryCache;
import com.example.syncengine.entity.JobKind;
import com.example.syncengine.entity.ServiceType;
import com.example.syncengine.entity.SessionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Metrics component for Prometheus monitoring.
 *
 * Exposes:
 * - sync_jobs_total: Counter of executed jobs by kind and outcome (done, requeued, error)
 * - sync_job_duration_seconds: Timer of handler execution by kind
 * - sync_jobs_recovered_total: Stuck jobs returned to the queue
 * - sync_sessions_total: Counter of finished sync sessions by service and status
 * - sync_token_refresh_total: Token refreshes by outcome
 * - sync_cache_*: Query cache hits, misses, evictions and size
 *
 * Access metrics: http://localhost:8084/actuator/prometheus
 */
@Component
@Slf4j
public class SyncMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter jobsRecoveredCounter;

    public SyncMetrics(MeterRegistry meterRegistry, QueryCache queryCache) {
        this.meterRegistry = meterRegistry;

        this.jobsRecoveredCounter = Counter.builder("sync_jobs_recovered_total")
                .description("Stuck jobs returned to the queue")
                .register(meterRegistry);

        Gauge.builder("sync_cache_hits", queryCache, c -> c.stats().hits())
                .description("Query cache hits")
                .register(meterRegistry);
        Gauge.builder("sync_cache_misses", queryCache, c -> c.stats().misses())
                .description("Query cache misses")
                .register(meterRegistry);
        Gauge.builder("sync_cache_evictions", queryCache, c -> c.stats().evictions())
                .description("Entries evicted at capacity")
                .register(meterRegistry);
        Gauge.builder("sync_cache_size", queryCache, c -> c.stats().size())
                .description("Entries currently held")
                .register(meterRegistry);

        log.info("✅ SyncMetrics initialized");
    }

    /**
     * @param outcome done, requeued or error
     */
    public void recordJobOutcome(JobKind kind, String outcome) {
        Counter.builder("sync_jobs_total")
                .description("Executed jobs by kind and outcome")
                .tag("kind", tag(kind.name()))
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public Timer.Sample startJobTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopJobTimer(Timer.Sample sample, JobKind kind) {
        sample.stop(Timer.builder("sync_job_duration_seconds")
                .description("Job handler execution time")
                .tag("kind", tag(kind.name()))
                .register(meterRegistry));
    }

    public void recordJobsRecovered(int count) {
        jobsRecoveredCounter.increment(count);
    }

    public void recordSessionFinished(ServiceType service, SessionStatus status) {
        Counter.builder("sync_sessions_total")
                .description("Finished sync sessions by service and status")
                .tag("service", service.getPathValue())
                .tag("status", tag(status.name()))
                .register(meterRegistry)
                .increment();
    }

    /**
     * @param outcome success, failure or reauthorization_required
     */
    public void recordTokenRefresh(String outcome) {
        Counter.builder("sync_token_refresh_total")
                .description("Token refreshes by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    private static String tag(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
