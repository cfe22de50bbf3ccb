package com.funnelanalytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only funnel event.
 *
 * Indexing Strategy:
 * - (funnelId, timestamp) for the per-window batch fetch
 * - (funnelId, sessionId, timestamp) for single-session lookups
 */
@Entity
@Table(name = "funnel_events", indexes = {
    @Index(name = "idx_funnel_event_window", columnList = "funnelId,timestamp"),
    @Index(name = "idx_funnel_event_session", columnList = "funnelId,sessionId,timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelEventEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID ownerId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID funnelId;

    @Column(nullable = false, length = 255)
    private String sessionId;

    @Column(nullable = false, length = 255)
    private String step;

    @Column(nullable = false)
    private int stepNumber;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(columnDefinition = "TEXT")
    private String metadata;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (timestamp == null) {
            timestamp = createdAt;
        }
    }
}
