package com.funnelanalytics.api;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One aggregation period; the period key is the start date.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalculateMetricsRequest {

    @NotNull
    private Instant periodStart;

    @NotNull
    private Instant periodEnd;
}
