package com.funnelanalytics.domain.store;

import com.funnelanalytics.domain.model.FunnelMetrics;

import java.util.List;
import java.util.UUID;

/**
 * Storage of materialized per-step, per-period metrics.
 */
public interface FunnelMetricsStore {

    /**
     * Inserts the row or overwrites every computed field and the window
     * bounds of the existing row with the same {@code (funnelId, step, period)}.
     * Atomic per key.
     */
    void upsert(FunnelMetrics metrics);

    /**
     * Rows ordered by period descending, then step number ascending.
     *
     * @param period null for every period
     */
    List<FunnelMetrics> findMetrics(UUID funnelId, String period);
}
