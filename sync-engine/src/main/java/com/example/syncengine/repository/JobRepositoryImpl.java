package com.example.syncengine.repository;

import com.example.syncengine.entity.Job;
import com.example.syncengine.entity.JobStatus;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Implementation of atomic job claiming.
 *
 * CRITICAL: Claiming is a compare-and-swap per row
 * (UPDATE ... WHERE id = ? AND status = 'QUEUED'). Only rows for which this call's
 * update reported one affected row are returned, so two concurrent runners can
 * never both execute the same job. Candidates lost to a concurrent runner are
 * replaced from the next oldest queued rows until maxJobs are held or none remain.
 */
@Repository
@Slf4j
public class JobRepositoryImpl implements JobRepositoryCustom {

    private static final int MAX_REFILL_ROUNDS = 5;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public List<Job> claimQueuedJobs(UUID userId, String batchId, int maxJobs, Instant now) {
        if (maxJobs <= 0) {
            return List.of();
        }

        List<UUID> claimed = new ArrayList<>();
        for (int round = 0; round < MAX_REFILL_ROUNDS && claimed.size() < maxJobs; round++) {
            TypedQuery<UUID> query = entityManager.createQuery(
                    "SELECT j.id FROM Job j WHERE j.userId = :userId AND j.status = :status " +
                            (batchId == null ? "" : "AND j.batchId = :batchId ") +
                            "ORDER BY j.createdAt ASC, j.id ASC", UUID.class)
                    .setParameter("userId", userId)
                    .setParameter("status", JobStatus.QUEUED);
            if (batchId != null) {
                query.setParameter("batchId", batchId);
            }
            List<UUID> candidates = query.setMaxResults(maxJobs - claimed.size()).getResultList();
            if (candidates.isEmpty()) {
                break;
            }

            for (UUID id : candidates) {
                int updated = entityManager.createQuery(
                                "UPDATE Job j SET j.status = :processing, j.attempts = j.attempts + 1, " +
                                        "j.updatedAt = :now WHERE j.id = :id AND j.status = :queued")
                        .setParameter("processing", JobStatus.PROCESSING)
                        .setParameter("queued", JobStatus.QUEUED)
                        .setParameter("now", now)
                        .setParameter("id", id)
                        .executeUpdate();
                if (updated == 1) {
                    claimed.add(id);
                } else {
                    log.debug("Job {} was claimed by a concurrent runner", id);
                }
            }
        }

        if (claimed.isEmpty()) {
            return List.of();
        }

        entityManager.clear();
        return entityManager.createQuery(
                        "SELECT j FROM Job j WHERE j.id IN :ids ORDER BY j.createdAt ASC, j.id ASC", Job.class)
                .setParameter("ids", claimed)
                .getResultList();
    }
}
