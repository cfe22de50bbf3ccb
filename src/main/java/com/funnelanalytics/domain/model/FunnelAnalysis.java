package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Whole-funnel report: totals, per-step breakdown and drop-off points ranked
 * worst first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelAnalysis {

    private UUID funnelId;
    private String funnelName;
    private Instant periodStart;
    private Instant periodEnd;
    private long totalSessions;
    private double completionRate;
    private double averageTimeToComplete;
    private List<StepAnalysis> steps;
    private List<DropOffPoint> dropOffPoints;
}
