package com.funnelanalytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Materialized per-step metrics of one period.
 *
 * The unique key backs the ON CONFLICT upsert; rows are written only through
 * {@code FunnelMetricsUpsertRepository}.
 */
@Entity
@Table(name = "funnel_metrics",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_funnel_metrics_step_period", columnNames = {"funnelId", "step", "period"})
    },
    indexes = {
        @Index(name = "idx_funnel_metrics_period", columnList = "funnelId,period")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelMetricsEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID funnelId;

    @Column(nullable = false, length = 255)
    private String step;

    @Column(nullable = false)
    private int stepNumber;

    @Column(nullable = false)
    private long totalCount;

    @Column(nullable = false)
    private double conversionRate;

    @Column(nullable = false)
    private double dropOffRate;

    @Column
    private Double avgTimeToNext;

    @Column(nullable = false, length = 10)
    private String period;

    @Column(nullable = false)
    private Instant periodStart;

    @Column(nullable = false)
    private Instant periodEnd;

    @Column(nullable = false)
    private Instant createdAt;
}
