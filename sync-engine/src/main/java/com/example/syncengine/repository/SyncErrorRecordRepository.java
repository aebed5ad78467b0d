package com.example.syncengine.repository;

import com.example.syncengine.entity.SyncErrorRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface SyncErrorRecordRepository extends JpaRepository<SyncErrorRecord, UUID> {

    List<SyncErrorRecord> findByUserIdAndOccurredAtAfterOrderByOccurredAtDesc(UUID userId, Instant since);

    long countByUserIdAndOccurredAtAfter(UUID userId, Instant since);

    @Modifying
    @Query("DELETE FROM SyncErrorRecord e WHERE e.occurredAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
