package com.funnelanalytics.infrastructure.persistence.repository;

import com.funnelanalytics.infrastructure.persistence.entity.FunnelEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for funnel events.
 */
@Repository
public interface FunnelEventRepository extends JpaRepository<FunnelEventEntity, UUID> {

    /**
     * Every event of a funnel inside a closed window, in one query.
     *
     * Ordered so that each session's events come out contiguous and in
     * step order.
     */
    @Query("SELECT e FROM FunnelEventEntity e WHERE " +
           "e.funnelId = :funnelId AND " +
           "(:sessionId IS NULL OR e.sessionId = :sessionId) AND " +
           "e.timestamp BETWEEN :startTime AND :endTime " +
           "ORDER BY e.sessionId ASC, e.stepNumber ASC, e.timestamp ASC")
    List<FunnelEventEntity> findEventsInWindow(
            @Param("funnelId") UUID funnelId,
            @Param("sessionId") String sessionId,
            @Param("startTime") Instant startTime,
            @Param("endTime") Instant endTime
    );
}
