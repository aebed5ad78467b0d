package com.example.syncengine.controller;

import com.example.syncengine.dto.response.JobCountsResponse;
import com.example.syncengine.dto.response.JobResponse;
import com.example.syncengine.entity.JobStatus;
import com.example.syncengine.job.JobQueueService;
import com.example.syncengine.job.JobRunResult;
import com.example.syncengine.job.JobRunner;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
public class JobController {

    private static final int MAX_JOBS_PER_CALL = 50;

    private final JobRunner jobRunner;
    private final JobQueueService jobQueueService;

    /**
     * Run the caller's queued jobs inline.
     */
    @PostMapping("/process")
    public ResponseEntity<JobRunResult> processJobs(
            @RequestHeader(SyncController.USER_HEADER) UUID userId,
            @RequestParam(defaultValue = "10") int maxJobs) {

        if (maxJobs < 1 || maxJobs > MAX_JOBS_PER_CALL) {
            throw new IllegalArgumentException("maxJobs must be between 1 and " + MAX_JOBS_PER_CALL);
        }
        return ResponseEntity.ok(jobRunner.processUserJobs(userId, maxJobs));
    }

    @GetMapping("/status")
    public ResponseEntity<JobCountsResponse> getStatus(
            @RequestHeader(SyncController.USER_HEADER) UUID userId,
            @RequestParam(required = false) String batchId) {

        return ResponseEntity.ok(jobQueueService.getJobCounts(userId, batchId));
    }

    @GetMapping
    public ResponseEntity<List<JobResponse>> listJobs(
            @RequestHeader(SyncController.USER_HEADER) UUID userId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String batchId,
            @RequestParam(defaultValue = "50") int limit) {

        JobStatus jobStatus = status == null ? null : JobStatus.valueOf(status.toUpperCase(Locale.ROOT));
        return ResponseEntity.ok(jobQueueService.listJobs(userId, jobStatus, batchId, limit));
    }
}
