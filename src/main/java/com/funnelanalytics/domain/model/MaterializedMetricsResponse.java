package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Materialized metrics read, optionally limited to one period.
 *
 * {@code period} is null when every stored period was requested.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaterializedMetricsResponse {

    private UUID funnelId;
    private String period;
    private List<FunnelMetrics> metrics;
    private boolean cached;
    private long queryTimeMs;
}
