package com.example.syncengine.repository;

import com.example.syncengine.entity.Job;
import com.example.syncengine.entity.JobKind;
import com.example.syncengine.entity.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for {@link Job}.
 *
 * Every status change is a conditional update on the expected current status.
 * A return value of 0 means another writer moved the row first.
 */
@Repository
public interface JobRepository extends JpaRepository<Job, UUID>, JobRepositoryCustom {

    Optional<Job> findByIdAndUserId(UUID id, UUID userId);

    @Query("SELECT DISTINCT j.userId FROM Job j " +
            "WHERE j.status = com.example.syncengine.entity.JobStatus.QUEUED")
    List<UUID> findUserIdsWithQueuedJobs(Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Job j SET j.status = com.example.syncengine.entity.JobStatus.DONE, " +
            "j.result = :result, j.lastError = NULL, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.status = com.example.syncengine.entity.JobStatus.PROCESSING")
    int markDone(@Param("id") UUID id, @Param("result") String result, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Job j SET j.status = com.example.syncengine.entity.JobStatus.QUEUED, " +
            "j.lastError = :error, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.status = com.example.syncengine.entity.JobStatus.PROCESSING")
    int requeue(@Param("id") UUID id, @Param("error") String error, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Job j SET j.status = com.example.syncengine.entity.JobStatus.ERROR, " +
            "j.lastError = :error, j.result = :result, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.status = com.example.syncengine.entity.JobStatus.PROCESSING")
    int markError(@Param("id") UUID id, @Param("error") String error,
                  @Param("result") String result, @Param("now") Instant now);

    /**
     * Return abandoned jobs that still have attempts left to the queue.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Job j SET j.status = com.example.syncengine.entity.JobStatus.QUEUED, " +
            "j.lastError = :error, j.updatedAt = :now " +
            "WHERE j.status = com.example.syncengine.entity.JobStatus.PROCESSING " +
            "AND j.updatedAt < :threshold AND j.attempts < :maxAttempts")
    int requeueStuck(@Param("threshold") Instant threshold, @Param("maxAttempts") int maxAttempts,
                     @Param("error") String error, @Param("now") Instant now);

    /**
     * Fail abandoned jobs that already used every attempt.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Job j SET j.status = com.example.syncengine.entity.JobStatus.ERROR, " +
            "j.lastError = :error, j.updatedAt = :now " +
            "WHERE j.status = com.example.syncengine.entity.JobStatus.PROCESSING " +
            "AND j.updatedAt < :threshold AND j.attempts >= :maxAttempts")
    int failStuck(@Param("threshold") Instant threshold, @Param("maxAttempts") int maxAttempts,
                  @Param("error") String error, @Param("now") Instant now);

    @Query("SELECT j.status AS status, j.kind AS kind, COUNT(j) AS total FROM Job j " +
            "WHERE j.userId = :userId AND (:batchId IS NULL OR j.batchId = :batchId) " +
            "GROUP BY j.status, j.kind")
    List<JobCountRow> countGrouped(@Param("userId") UUID userId, @Param("batchId") String batchId);

    @Query("SELECT j FROM Job j WHERE j.userId = :userId " +
            "AND (:status IS NULL OR j.status = :status) " +
            "AND (:batchId IS NULL OR j.batchId = :batchId) " +
            "ORDER BY j.createdAt DESC")
    List<Job> findForUser(@Param("userId") UUID userId,
                          @Param("status") JobStatus status,
                          @Param("batchId") String batchId,
                          Pageable pageable);

    interface JobCountRow {
        JobStatus getStatus();

        JobKind getKind();

        long getTotal();
    }
}
