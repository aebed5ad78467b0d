package com.example.syncengine.repository;

import com.example.syncengine.entity.ServiceType;
import com.example.syncengine.entity.SessionStatus;
import com.example.syncengine.entity.SyncSession;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SyncSessionRepository extends JpaRepository<SyncSession, UUID> {

    Optional<SyncSession> findByIdAndUserId(UUID id, UUID userId);

    List<SyncSession> findByUserIdAndStatusInOrderByStartedAtDesc(UUID userId, Collection<SessionStatus> statuses);

    Optional<SyncSession> findFirstByUserIdAndServiceOrderByStartedAtDesc(UUID userId, ServiceType service);

    @Query("SELECT s FROM SyncSession s WHERE s.userId = :userId " +
            "AND (:service IS NULL OR s.service = :service) " +
            "AND (:status IS NULL OR s.status = :status) " +
            "ORDER BY s.startedAt DESC")
    List<SyncSession> findForUser(@Param("userId") UUID userId,
                                  @Param("service") ServiceType service,
                                  @Param("status") SessionStatus status,
                                  Pageable pageable);

    /**
     * Cancel only while the session is still active. Bumps the version so a
     * concurrent progress write based on the old row fails.
     *
     * @return 1 when cancelled, 0 when missing, not owned, or already terminal
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE SyncSession s SET s.status = com.example.syncengine.entity.SessionStatus.CANCELLED, " +
            "s.completedAt = :now, s.currentStep = :step, s.updatedAt = :now, s.version = s.version + 1 " +
            "WHERE s.id = :id AND s.userId = :userId AND s.status IN :active")
    int cancelIfActive(@Param("id") UUID id,
                       @Param("userId") UUID userId,
                       @Param("active") Collection<SessionStatus> active,
                       @Param("step") String step,
                       @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM SyncSession s WHERE s.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") Instant cutoff);
}
