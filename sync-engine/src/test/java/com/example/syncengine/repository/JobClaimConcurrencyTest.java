package com.example.syncengine.repository;

import com.example.syncengine.cache.LocalQueryCache;
import com.example.syncengine.config.JpaConfig;
import com.example.syncengine.entity.Job;
import com.example.syncengine.entity.JobKind;
import com.example.syncengine.entity.JobStatus;
import com.example.syncengine.job.JobQueueService;
import com.example.syncengine.job.JobStateService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * PRODUCTION GATE INTEGRATION TEST
 *
 * Verifies atomic job claiming against a REAL PostgreSQL database, with the
 * schema created by the Flyway migrations.
 *
 * CRITICAL: no job may be handed to two runners.
 */
@DataJpaTest(properties = {
        "spring.flyway.enabled=true",
        "spring.jpa.hibernate.ddl-auto=none"
})
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({
        JpaConfig.class,
        LocalQueryCache.class,
        JobStateService.class,
        JobQueueService.class,
        JobClaimConcurrencyTest.Config.class
})
class JobClaimConcurrencyTest {

    private static final int JOBS = 40;
    private static final int RUNNERS = 4;

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private JobStateService jobStateService;

    @Autowired
    private JobQueueService jobQueueService;

    @Autowired
    private JobRepository jobRepository;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        jobRepository.deleteAll();
    }

    /**
     * Scenario: 4 runners claim batches of 5 from the same user's 40 queued jobs at once.
     * Expected: every job claimed exactly once, each with attempts = 1.
     */
    @Test
    void concurrentRunners_neverClaimTheSameJob() throws Exception {
        jobQueueService.enqueueBatch(userId, JobKind.NORMALIZE,
                IntStream.range(0, JOBS).mapToObj(i -> Map.<String, Object>of("n", i)).toList());

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(RUNNERS);
        List<Future<List<UUID>>> results = new ArrayList<>();
        for (int i = 0; i < RUNNERS; i++) {
            Callable<List<UUID>> runner = () -> {
                start.await();
                List<UUID> mine = new ArrayList<>();
                List<Job> claimed;
                do {
                    claimed = jobStateService.claim(userId, 5);
                    claimed.forEach(job -> mine.add(job.getId()));
                } while (!claimed.isEmpty());
                return mine;
            };
            results.add(pool.submit(runner));
        }
        start.countDown();

        List<UUID> all = new ArrayList<>();
        for (Future<List<UUID>> result : results) {
            all.addAll(result.get(60, TimeUnit.SECONDS));
        }
        pool.shutdown();

        Set<UUID> unique = new HashSet<>(all);
        assertThat(all).hasSize(JOBS);
        assertThat(unique).hasSize(JOBS);
        assertThat(jobRepository.findAll())
                .allSatisfy(job -> {
                    assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
                    assertThat(job.getAttempts()).isEqualTo(1);
                });
    }

    @Test
    void stuckJobs_areRequeuedOrFailedByAttempts() {
        List<UUID> ids = jobQueueService.enqueueBatch(userId, JobKind.NORMALIZE,
                List.of(Map.<String, Object>of("n", 1), Map.<String, Object>of("n", 2)));
        List<Job> claimed = jobStateService.claim(userId, 2);
        assertThat(claimed).hasSize(2);

        Job exhausted = jobRepository.findById(ids.get(1)).orElseThrow();
        exhausted.setAttempts(3);
        jobRepository.save(exhausted);

        // a negative timeout treats every processing row as stuck
        int moved = jobQueueService.recoverStuckJobs(Duration.ofSeconds(-1));

        assertThat(moved).isEqualTo(2);
        assertThat(jobRepository.findById(ids.get(0)).orElseThrow().getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(jobRepository.findById(ids.get(1)).orElseThrow().getStatus()).isEqualTo(JobStatus.ERROR);
    }

    @TestConfiguration
    static class Config {

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper().findAndRegisterModules();
        }
    }
}
