package com.example.syncengine.service;

import com.example.syncengine.job.JobErrorSummary;
import com.example.syncengine.job.JobQueueService;
import com.example.syncengine.job.JobRunResult;
import com.example.syncengine.job.JobRunner;
import com.example.syncengine.entity.JobKind;
import com.example.syncengine.error.ErrorCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueueDrainServiceTest {

    @Mock
    private JobQueueService jobQueueService;
    @Mock
    private JobRunner jobRunner;

    @Test
    void drain_runsOneRoundPerUserAndAggregates() {
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        when(jobQueueService.findUsersWithQueuedJobs(50)).thenReturn(List.of(alice, bob));
        when(jobRunner.processUserJobs(alice, 10)).thenReturn(new JobRunResult(3, 3, 0, List.of()));
        when(jobRunner.processUserJobs(bob, 10)).thenReturn(new JobRunResult(2, 1, 1, List.of(
                new JobErrorSummary(UUID.randomUUID(), JobKind.NORMALIZE, "failed", ErrorCategory.SYSTEM,
                        true, true, 1))));

        JobRunResult result = drainService(new SyncTaskExecutor()).drainQueues();

        assertThat(result.processed()).isEqualTo(5);
        assertThat(result.succeeded()).isEqualTo(4);
        assertThat(result.failed()).isEqualTo(1);
    }

    @Test
    void emptyQueues_doNothing() {
        when(jobQueueService.findUsersWithQueuedJobs(50)).thenReturn(List.of());

        assertThat(drainService(new SyncTaskExecutor()).drainQueues()).isEqualTo(JobRunResult.EMPTY);
        verifyNoInteractions(jobRunner);
    }

    @Test
    void fullPool_skipsUsersUntilNextDrain() {
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        when(jobQueueService.findUsersWithQueuedJobs(50)).thenReturn(List.of(alice, bob));
        when(jobRunner.processUserJobs(alice, 10)).thenReturn(new JobRunResult(1, 1, 0, List.of()));
        AtomicInteger submissions = new AtomicInteger();
        TaskExecutor acceptsOne = task -> {
            if (submissions.incrementAndGet() > 1) {
                throw new RejectedExecutionException("queue full");
            }
            task.run();
        };

        JobRunResult result = drainService(acceptsOne).drainQueues();

        assertThat(result.processed()).isEqualTo(1);
        verify(jobRunner, times(1)).processUserJobs(alice, 10);
    }

    @Test
    void failingRound_doesNotAbortOtherUsers() {
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        when(jobQueueService.findUsersWithQueuedJobs(50)).thenReturn(List.of(alice, bob));
        when(jobRunner.processUserJobs(alice, 10)).thenThrow(new IllegalStateException("database unavailable"));
        when(jobRunner.processUserJobs(bob, 10)).thenReturn(new JobRunResult(2, 2, 0, List.of()));

        JobRunResult result = drainService(new SyncTaskExecutor()).drainQueues();

        assertThat(result.succeeded()).isEqualTo(2);
        verify(jobRunner, times(2)).processUserJobs(org.mockito.ArgumentMatchers.any(), anyInt());
    }

    private QueueDrainService drainService(TaskExecutor executor) {
        return new QueueDrainService(jobQueueService, jobRunner, executor, 10, 50);
    }
}
