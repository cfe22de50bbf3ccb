package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Materialized per-step aggregate for one period, unique on
 * {@code (funnelId, step, period)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelMetrics {

    private UUID funnelId;
    private String step;
    private int stepNumber;
    private long totalCount;
    private double conversionRate;
    private double dropOffRate;
    private Double avgTimeToNext;
    private String period;
    private Instant periodStart;
    private Instant periodEnd;
}
